package com.newswatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsWatchApplication.class, args);
    }
}
