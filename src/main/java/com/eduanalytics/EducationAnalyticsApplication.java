package com.eduanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Education Analytics Warehouse
 *
 * Analytics back end for an education institution.
 *
 * Architecture:
 * - PostgreSQL star schema (dimensions + facts) for structured data
 * - MongoDB for feedback, surveys, system logs and ETL job logs
 * - Redis caching for expensive aggregates
 * - Background ETL jobs for bulk CSV / Excel / JSON loads
 * - PostgreSQL tuning endpoints (indexes, materialized views, query plans)
 */
@SpringBootApplication
@EnableAsync
public class EducationAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EducationAnalyticsApplication.class, args);
    }
}
