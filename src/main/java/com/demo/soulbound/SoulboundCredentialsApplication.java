package com.demo.soulbound;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SoulboundCredentialsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SoulboundCredentialsApplication.class, args);
    }
}
