package com.powerguard.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PowerGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PowerGuardApplication.class, args);
    }
}
