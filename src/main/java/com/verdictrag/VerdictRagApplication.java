package com.verdictrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class VerdictRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerdictRagApplication.class, args);
    }
}
