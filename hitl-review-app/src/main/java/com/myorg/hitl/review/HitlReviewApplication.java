package com.myorg.hitl.review;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HitlReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(HitlReviewApplication.class, args);
    }
}
