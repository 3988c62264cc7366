package com.modelrouter.decisionlog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DecisionLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionLogApplication.class, args);
    }
}
