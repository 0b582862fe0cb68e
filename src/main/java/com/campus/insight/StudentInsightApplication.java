package com.campus.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StudentInsightApplication {
    public static void main(String[] args) {
        SpringApplication.run(StudentInsightApplication.class, args);
    }
}
