package com.omnioracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OmniOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmniOracleApplication.class, args);
    }
}
