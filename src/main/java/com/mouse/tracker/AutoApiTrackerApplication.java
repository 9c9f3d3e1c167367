package com.mouse.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AutoApiTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoApiTrackerApplication.class, args);
    }

}
