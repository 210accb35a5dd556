package com.example.werewolf.global.config;

import com.example.werewolf.global.concurrency.LockType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * werewolf.* 설정값
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "werewolf")
public class GameProperties {

    // 게임 시작 최소 인원
    private int minPlayers = 4;

    private int roomCodeLength = 4;

    // 호스트 시크릿, 플레이어 ID 길이
    private int secretLength = 8;

    private LockType lockType = LockType.READ_WRITE;
}
