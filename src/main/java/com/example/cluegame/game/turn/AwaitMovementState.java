package com.example.cluegame.game.turn;

import com.example.cluegame.game.agent.AgentFactory;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.view.GameDisplay;
import com.example.cluegame.global.random.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 주사위 이동 페이즈
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AwaitMovementState implements TurnPhaseState {

    static final int MIN_ROLL = 2;
    static final int MAX_ROLL = 12;

    private final AgentFactory agentFactory;
    private final GameDisplay display;
    private final RandomSource random;

    @Override
    public TurnContext process(TurnContext context) {
        GameState game = context.getGame();
        GamePlayerState current = context.getCurrent();

        int roll = random.nextIntInclusive(MIN_ROLL, MAX_ROLL);
        display.printDiceRoll(current, roll);

        List<MovementOption> options = context.getBoard().getMovementOptions(game, roll);
        Location location = agentFactory.getAgent(current).chooseMovement(current, game.publicState(), options);
        display.printMovement(current, location);
        log.debug("[턴] {} 주사위 {} → {}", current.getSuspect(), roll, location);
        return context.arriveAt(location);
    }

    @Override
    public TurnPhase getTurnPhase() {
        return TurnPhase.AWAIT_MOVEMENT;
    }
}
