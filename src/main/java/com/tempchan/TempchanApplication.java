package com.tempchan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TempchanApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempchanApplication.class, args);
    }
}
