package com.simiq.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication(scanBasePackages = "com.simiq")
@EnableAsync
public class SimiqApplication {
    public static void main(String[] args) {
        SpringApplication.run(SimiqApplication.class, args);
    }
}
