package com.delta.casetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CaseTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseTrackerApplication.class, args);
    }
}
