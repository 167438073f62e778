package com.aigreentick.services.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampaignDispatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignDispatcherApplication.class, args);
    }
}
