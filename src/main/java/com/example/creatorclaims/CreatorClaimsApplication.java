package com.example.creatorclaims;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CreatorClaimsApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            CreatorClaimsApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CreatorClaimsApplication.class, args);
        logger.info("Application started");
    }
}
