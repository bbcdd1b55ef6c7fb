package com.leaflog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeafLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeafLogApplication.class, args);
    }
}
