package com.vulnscan.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VulnScanApplication {
    public static void main(String[] args) {
        SpringApplication.run(VulnScanApplication.class, args);
    }
}
