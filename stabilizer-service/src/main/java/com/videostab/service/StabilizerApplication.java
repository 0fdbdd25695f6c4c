package com.videostab.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StabilizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StabilizerApplication.class, args);
    }
}
