package com.example.workflowsynth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowSynthApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowSynthApplication.class, args);
    }
}
