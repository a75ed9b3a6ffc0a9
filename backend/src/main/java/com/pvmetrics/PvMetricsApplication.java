package com.pvmetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PvMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PvMetricsApplication.class, args);
    }
}
