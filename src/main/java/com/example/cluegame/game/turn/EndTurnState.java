package com.example.cluegame.game.turn;

import com.example.cluegame.game.domain.GamePlayerState;
import org.springframework.stereotype.Component;

/**
 * 복도 칸 도착 시 위치만 저장하고 턴을 넘긴다
 */
@Component
public class EndTurnState implements TurnPhaseState {

    @Override
    public TurnContext process(TurnContext context) {
        GamePlayerState moved = context.getCurrent().withLocation(context.getDestination());
        return context.advance(context.getGame().withPlayer(moved));
    }

    @Override
    public TurnPhase getTurnPhase() {
        return TurnPhase.END_TURN;
    }
}
