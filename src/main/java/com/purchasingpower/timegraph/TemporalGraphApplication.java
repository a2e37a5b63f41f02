package com.purchasingpower.timegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TemporalGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemporalGraphApplication.class, args);
    }
}
