package com.copyradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopyRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopyRadarApplication.class, args);
    }
}
