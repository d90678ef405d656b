package com.bank.patterns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatternDiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternDiscoveryApplication.class, args);
    }
}
