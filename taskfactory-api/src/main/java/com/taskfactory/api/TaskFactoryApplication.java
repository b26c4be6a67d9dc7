package com.taskfactory.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the Task Factory.
 */
@SpringBootApplication(scanBasePackages = "com.taskfactory")
public class TaskFactoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskFactoryApplication.class, args);
    }
}
