package com.landdev.cashflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.landdev.cashflow")
public class CashFlowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashFlowEngineApplication.class, args);
    }
}
