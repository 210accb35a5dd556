package com.example.werewolf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class WerewolfGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(WerewolfGameApplication.class, args);
    }
}
