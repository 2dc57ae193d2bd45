package com.feetrail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeeTrailApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeeTrailApplication.class, args);
    }
}
