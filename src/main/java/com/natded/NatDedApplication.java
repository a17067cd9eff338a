package com.natded;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NatDedApplication {

    public static void main(String[] args) {
        SpringApplication.run(NatDedApplication.class, args);
    }
}
