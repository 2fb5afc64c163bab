package com.previewenv.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for the Preview Environment Controller.
 */
@SpringBootApplication(scanBasePackages = {
    "com.previewenv.api",
    "com.previewenv.engine"
})
@EnableScheduling
public class PreviewEnvApplication {

    public static void main(String[] args) {
        SpringApplication.run(PreviewEnvApplication.class, args);
    }
}
