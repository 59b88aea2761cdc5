package com.example.cluegame.global.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * clue.game.* 설정
 *
 * @param definition 게임 정의 파일 위치 (classpath: 또는 file:), 비우면 콘솔에서 묻는다
 * @param seed       난수 시드, 없으면 매번 다른 게임
 * @param aiOnly     게임 정의의 aiOnly 값을 덮어쓸 때 사용
 * @param maxTurns   턴 수 상한, 0이면 무제한
 */
@Validated
@ConfigurationProperties(prefix = "clue.game")
public record GameProperties(
        @DefaultValue("classpath:games/classic.json") String definition,
        Long seed,
        Boolean aiOnly,
        @PositiveOrZero @DefaultValue("0") int maxTurns
) {
    public static GameProperties defaults() {
        return new GameProperties("classpath:games/classic.json", null, null, 0);
    }

    public boolean hasTurnLimit() {
        return maxTurns > 0;
    }
}
