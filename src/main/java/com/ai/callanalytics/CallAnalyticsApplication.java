package com.ai.callanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.callanalytics")
public class CallAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallAnalyticsApplication.class, args);
    }
}
