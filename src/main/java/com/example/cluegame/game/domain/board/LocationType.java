package com.example.cluegame.game.domain.board;

public enum LocationType {
    ROOM, // 방
    SPACE // 복도 칸
}
