package com.autoposter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AutoposterApplication {
    public static void main(String[] args) {
        SpringApplication.run(AutoposterApplication.class, args);
    }
}
