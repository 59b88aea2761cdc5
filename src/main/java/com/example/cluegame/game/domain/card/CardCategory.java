package com.example.cluegame.game.domain.card;

public enum CardCategory {
    SUSPECT, // 용의자
    WEAPON, // 흉기
    ROOM // 방
}
