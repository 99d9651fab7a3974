package com.brandcheck;

import com.brandcheck.processing.BatchValidationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class BrandCheckApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(BrandCheckApplication.class, args);

        // Batch mode: the runner has already validated the configured documents
        if (!context.getBeansOfType(BatchValidationRunner.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
