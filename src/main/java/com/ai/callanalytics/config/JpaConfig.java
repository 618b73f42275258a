package com.ai.callanalytics.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

// kept off the application class so web-slice tests start without a DataSource
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.ai.callanalytics.repository")
@EntityScan(basePackages = "com.ai.callanalytics.entity")
public class JpaConfig {
}
