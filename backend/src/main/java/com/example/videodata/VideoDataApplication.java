package com.example.videodata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoDataApplication.class, args);
    }
}
