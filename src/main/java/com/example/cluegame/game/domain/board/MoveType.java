package com.example.cluegame.game.domain.board;

public enum MoveType {
    ROLL, // 주사위 굴리기
    PASSAGE // 비밀 통로
}
