package com.example.cluegame.game.turn;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class TurnPhaseFactory {

    private final AwaitMoveState awaitMoveState;
    private final AwaitMovementState awaitMovementState;
    private final AccusationState accusationState;
    private final GuessState guessState;
    private final EndTurnState endTurnState;

    /**
     * 현재 페이즈에 맞는 상태 객체 반환
     */
    public TurnPhaseState getState(TurnPhase phase) {
        return switch (phase) {
            case AWAIT_MOVE -> awaitMoveState;
            case AWAIT_MOVEMENT -> awaitMovementState;
            case ACCUSATION -> accusationState;
            case GUESS -> guessState;
            case END_TURN -> endTurnState;
            case WIN, GAME_OVER -> throw new IllegalStateException("terminal phase has no state: " + phase);
        };
    }
}
