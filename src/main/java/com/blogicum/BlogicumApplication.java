package com.blogicum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlogicumApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogicumApplication.class, args);
    }
}
