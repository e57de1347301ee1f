package com.judgmentrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class JudgmentRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(JudgmentRagApplication.class, args);
    }
}
