package com.cred.freestyle.enrollment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the enrollment service.
 *
 * System Overview:
 * - Capacity-bounded registration for scheduled offerings
 * - Free offerings confirm immediately; paid offerings confirm on payment callback
 * - FIFO waitlist with time-limited seat offers once an offering is full
 * - Periodic sweeps for lapsed offers, stale pending payments, reminders and closing
 *
 * Architecture:
 * - API Layer: REST controllers, header-based authentication
 * - Service Layer: Registration and waitlist orchestration under a per-offering row lock
 * - Data Access Layer: JPA repositories with pessimistic locking
 * - Infrastructure Layer: Payment gateway, Kafka notifications, Redis reminder keys, CloudWatch metrics
 *
 * @author Enrollment Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class EnrollmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnrollmentApplication.class, args);
    }
}
