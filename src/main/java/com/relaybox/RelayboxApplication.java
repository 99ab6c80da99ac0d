package com.relaybox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RelayboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayboxApplication.class, args);
    }
}
