package com.tradedash.overview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OverviewServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OverviewServiceApplication.class, args);
    }
}
