package com.medwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedWatchApplication.class, args);
    }
}
