package com.swisspairing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwissPairingApplication {
    public static void main(String[] args) {
        SpringApplication.run(SwissPairingApplication.class, args);
    }
}
