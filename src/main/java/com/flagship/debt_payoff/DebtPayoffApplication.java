package com.flagship.debt_payoff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DebtPayoffApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebtPayoffApplication.class, args);
    }
}
