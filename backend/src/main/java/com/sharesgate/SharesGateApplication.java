package com.sharesgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SharesGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SharesGateApplication.class, args);
    }
}
