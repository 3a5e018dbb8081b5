package com.example.tagsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TagSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TagSyncApplication.class, args);
    }
}
