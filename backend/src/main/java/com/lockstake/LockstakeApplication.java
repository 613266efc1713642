package com.lockstake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LockstakeApplication {
    public static void main(String[] args) {
        SpringApplication.run(LockstakeApplication.class, args);
    }
}
