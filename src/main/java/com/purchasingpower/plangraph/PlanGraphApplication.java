package com.purchasingpower.plangraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlanGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanGraphApplication.class, args);
    }
}
