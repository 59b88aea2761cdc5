package com.example.cluegame.game.turn;

/**
 * 턴 페이즈 상태 인터페이스 (State Pattern)
 */
public interface TurnPhaseState {

    /**
     * 현재 페이즈를 처리하고 다음 컨텍스트를 반환
     *
     * @param context 현재 턴 컨텍스트
     * @return 다음 페이즈가 설정된 새 컨텍스트
     */
    TurnContext process(TurnContext context);

    /**
     * 현재 페이즈 종류 반환
     */
    TurnPhase getTurnPhase();
}
