package com.brandinsight.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResearchOrchestrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchOrchestrationApplication.class, args);
    }
}
