package com.incarts.analytics.config;

import com.incarts.analytics.domain.executor.ExecutorKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Backend selection and connection settings ({@code analytics.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    @Valid
    @NotNull
    private Executor executor = new Executor();

    @Valid
    @NotNull
    private Direct direct = new Direct();

    @Valid
    @NotNull
    private Emulated emulated = new Emulated();

    @Valid
    @NotNull
    private Cors cors = new Cors();

    @Data
    public static class Executor {

        @NotNull
        private ExecutorKind preferred = ExecutorKind.DIRECT;

        @NotNull
        private List<ExecutorKind> fallback = new ArrayList<>(List.of(ExecutorKind.EMULATED));

        /**
         * Preferred executor first, then fallbacks, each kind once.
         */
        public List<ExecutorKind> order() {
            Set<ExecutorKind> order = new LinkedHashSet<>();
            order.add(preferred);
            order.addAll(fallback);
            return new ArrayList<>(order);
        }
    }

    @Data
    public static class Direct {

        /** JDBC URL or postgres:// URL (DATABASE_URL). */
        private String url;
        private String username;
        private String password;
        /** Used as database password when no URL is given (SUPABASE_SERVICE_KEY). */
        private String serviceKey;

        @Min(1)
        private int maximumPoolSize = 5;

        @NotNull
        private Duration queryTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Emulated {

        /** Data API base URL (SUPABASE_URL). */
        private String url;
        /** SUPABASE_KEY */
        private String apiKey;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        /** Most fact rows ever fetched for client-side aggregation or sorting. */
        @Min(1)
        private int maxRows = 10_000;

        /** Most surrogate keys folded into one membership filter. */
        @Min(1)
        private int maxLookupKeys = 500;

        @Min(1)
        private int pageSize = 1_000;
    }

    @Data
    public static class Cors {

        /** Browser origins of the dashboard front ends. */
        @NotNull
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost", "http://localhost:3000", "http://localhost:8080"));
    }
}
