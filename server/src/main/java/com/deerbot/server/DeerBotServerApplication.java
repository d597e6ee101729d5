package com.deerbot.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeerBotServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeerBotServerApplication.class, args);
    }
}
