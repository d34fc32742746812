package com.jay.ptanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceAnalyzerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PriceAnalyzerApplication.class, args);
    }
}
