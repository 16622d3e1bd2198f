package com.lidar.overtake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OvertakeDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(OvertakeDetectionApplication.class, args);
    }
}
