package com.analyticsplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.analyticsplatform")
public class AnalyticsPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsPlatformApplication.class, args);
    }
}
