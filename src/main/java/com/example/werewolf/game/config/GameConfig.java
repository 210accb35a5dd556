package com.example.werewolf.game.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class GameConfig {

    /**
     * 역할 배정 셔플과 방 코드/시크릿 생성에 쓰는 난수원
     */
    @Bean
    public Random gameRandom() {
        return new SecureRandom();
    }
}
