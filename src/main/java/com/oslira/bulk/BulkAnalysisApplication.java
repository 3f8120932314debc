package com.oslira.bulk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bulk profile analysis service.
 */
@SpringBootApplication
public class BulkAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkAnalysisApplication.class, args);
    }
}
