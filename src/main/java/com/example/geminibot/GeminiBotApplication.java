package com.example.geminibot;

import com.example.geminibot.config.BotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(BotProperties.class)
public class GeminiBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeminiBotApplication.class, args);
    }
}
