package com.incarts.analytics.config;

import com.incarts.analytics.domain.exception.BackendUnavailableException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.executor.ExecutorRouter;
import com.incarts.analytics.domain.executor.QueryExecutor;
import com.incarts.analytics.domain.result.ResultNormalizer;
import com.incarts.analytics.infrastructure.connection.DirectConnectionSettings;
import com.incarts.analytics.infrastructure.connection.LazyBackendHandle;
import com.incarts.analytics.infrastructure.direct.DirectQueryExecutor;
import com.incarts.analytics.infrastructure.direct.JdbcSqlBackend;
import com.incarts.analytics.infrastructure.direct.SqlBackend;
import com.incarts.analytics.infrastructure.direct.SqlStatementRenderer;
import com.incarts.analytics.infrastructure.emulated.EmulatedQueryExecutor;
import com.incarts.analytics.infrastructure.emulated.PostgrestTableBackend;
import com.incarts.analytics.infrastructure.emulated.TableBackend;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend clients and executors.
 *
 * Neither backend is contacted at startup. Each client is built on the first query
 * that needs it, so the service starts with only one backend configured and recovers
 * once an unreachable backend comes back.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class BackendConfiguration {

    @Bean
    public LazyBackendHandle<SqlBackend> directBackend(AnalyticsProperties properties) {
        return new LazyBackendHandle<>(ExecutorKind.DIRECT, () -> {
            DirectConnectionSettings settings = DirectConnectionSettings
                    .resolve(properties.getDirect(), properties.getEmulated())
                    .orElseThrow(() -> new BackendUnavailableException(ExecutorKind.DIRECT,
                            "No warehouse database configured (analytics.direct.url or analytics.direct.service-key)"));
            log.info("Connecting to warehouse database {}", settings.getJdbcUrl());

            HikariConfig config = new HikariConfig();
            config.setPoolName("warehouse-pool");
            config.setJdbcUrl(settings.getJdbcUrl());
            config.setUsername(settings.getUsername());
            config.setPassword(settings.getPassword());
            config.setMaximumPoolSize(properties.getDirect().getMaximumPoolSize());
            config.setReadOnly(true);
            HikariDataSource dataSource = new HikariDataSource(config);

            try {
                JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
                jdbcTemplate.setQueryTimeout((int) properties.getDirect().getQueryTimeout().toSeconds());
                jdbcTemplate.queryForObject("SELECT 1", Integer.class);
                return new JdbcSqlBackend(jdbcTemplate);
            } catch (RuntimeException e) {
                dataSource.close();
                throw e;
            }
        });
    }

    @Bean
    public LazyBackendHandle<TableBackend> emulatedBackend(AnalyticsProperties properties,
                                                          RestTemplateBuilder restTemplateBuilder) {
        AnalyticsProperties.Emulated emulated = properties.getEmulated();
        return new LazyBackendHandle<>(ExecutorKind.EMULATED, () -> {
            if (emulated.getUrl() == null || emulated.getUrl().isBlank()) {
                throw new BackendUnavailableException(ExecutorKind.EMULATED,
                        "No data API configured (analytics.emulated.url)");
            }
            RestTemplate restTemplate = restTemplateBuilder
                    .setConnectTimeout(emulated.getConnectTimeout())
                    .setReadTimeout(emulated.getReadTimeout())
                    .build();
            return new PostgrestTableBackend(restTemplate, emulated.getUrl(), emulated.getApiKey(), emulated.getPageSize());
        });
    }

    @Bean
    public DirectQueryExecutor directQueryExecutor(LazyBackendHandle<SqlBackend> directBackend,
                                                   SqlStatementRenderer renderer,
                                                   ResultNormalizer normalizer) {
        return new DirectQueryExecutor(directBackend, renderer, normalizer);
    }

    @Bean
    public EmulatedQueryExecutor emulatedQueryExecutor(LazyBackendHandle<TableBackend> emulatedBackend,
                                                       ResultNormalizer normalizer,
                                                       AnalyticsProperties properties) {
        AnalyticsProperties.Emulated emulated = properties.getEmulated();
        return new EmulatedQueryExecutor(emulatedBackend, normalizer, emulated.getMaxRows(), emulated.getMaxLookupKeys());
    }

    @Bean
    public ExecutorRouter executorRouter(DirectQueryExecutor directQueryExecutor,
                                         EmulatedQueryExecutor emulatedQueryExecutor,
                                         AnalyticsProperties properties) {
        List<QueryExecutor> executors = new ArrayList<>();
        for (ExecutorKind kind : properties.getExecutor().order()) {
            executors.add(kind == ExecutorKind.DIRECT ? directQueryExecutor : emulatedQueryExecutor);
        }
        log.info("Executor order: {}", properties.getExecutor().order());
        return new ExecutorRouter(executors);
    }
}
