package com.contractrisk.quant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantRiskApplication.class, args);
    }
}
