package com.yourapp.reps.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepsTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepsTrackerApplication.class, args);
    }

}
