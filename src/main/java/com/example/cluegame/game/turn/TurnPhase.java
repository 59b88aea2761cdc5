package com.example.cluegame.game.turn;

public enum TurnPhase {
    AWAIT_MOVE, // 주사위/비밀 통로 선택
    AWAIT_MOVEMENT, // 주사위 결과로 이동할 위치 선택
    ACCUSATION, // 고발 방 도착, 최종 고발
    GUESS, // 방 도착, 추리
    END_TURN, // 복도 칸 도착
    WIN, // 정확한 고발
    GAME_OVER; // 승자 없이 종료

    public boolean isTerminal() {
        return this == WIN || this == GAME_OVER;
    }
}
