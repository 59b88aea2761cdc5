package com.example.cluegame.game.domain;

public enum GameResult {
    WIN, // 정확한 고발로 승리
    GAME_OVER // 승자 없이 종료
}
