package com.len.songqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SongRequestQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(SongRequestQueueApplication.class, args);
    }

}
