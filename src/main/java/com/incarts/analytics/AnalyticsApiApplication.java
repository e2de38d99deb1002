package com.incarts.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * InCarts Analytics API
 *
 * Reporting backend over the click/visit warehouse.
 *
 * Architecture:
 * - REST APIs for KPIs, charts and ranked tables
 * - Query templates compiled into backend-neutral plans
 * - Direct SQL executor (PostgreSQL over JDBC) with a REST table emulator as fallback
 * - Redis caching for KPI values
 *
 * The warehouse DataSource is created lazily by the direct executor, not by Spring Boot.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class AnalyticsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsApiApplication.class, args);
    }
}
