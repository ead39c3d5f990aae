package com.nosota.mloan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MloanApplication {
    public static void main(String[] args) {
        SpringApplication.run(MloanApplication.class, args);
    }
}
