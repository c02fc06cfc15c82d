package com.example.workflowhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowHubApplication.class, args);
    }
}
