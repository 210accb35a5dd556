package com.example.werewolf.game.service;

import com.example.werewolf.global.config.GameProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * 방 코드, 호스트 시크릿, 플레이어 ID 생성
 */
@Component
@RequiredArgsConstructor
public class IdentifierGenerator {

    private static final String DIGITS = "0123456789";
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Random gameRandom;
    private final GameProperties gameProperties;

    public String roomCode() {
        return randomString(DIGITS, gameProperties.getRoomCodeLength());
    }

    public String secret() {
        return randomString(ALPHANUMERIC, gameProperties.getSecretLength());
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(gameRandom.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
