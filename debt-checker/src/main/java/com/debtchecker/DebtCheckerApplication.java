package com.debtchecker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class DebtCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebtCheckerApplication.class, args);
    }
}
