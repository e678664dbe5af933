package com.vtrade.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VtradeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VtradeApplication.class, args);
    }
}
