package com.coverwise.insurance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Insurance Service Application
 *
 * Decision engine for premium calculation, quote scoring and ranking, and the
 * claims workflow with approval authority checks.
 *
 * @author Coverwise Engineering Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.coverwise.insurance.repository")
@EnableTransactionManagement
public class InsuranceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsuranceServiceApplication.class, args);
    }
}
