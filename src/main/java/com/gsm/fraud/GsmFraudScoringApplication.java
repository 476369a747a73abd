package com.gsm.fraud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GsmFraudScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(GsmFraudScoringApplication.class, args);
    }
}
