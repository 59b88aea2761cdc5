package com.example.cluegame.game.domain;

public enum AgentType {
    HUMAN, // 콘솔 입력
    AI // 자동 플레이어
}
