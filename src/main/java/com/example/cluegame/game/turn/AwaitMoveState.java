package com.example.cluegame.game.turn;

import com.example.cluegame.game.agent.AgentFactory;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.TurnLookup;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.view.GameDisplay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 턴 시작 페이즈
 * - 탈락자는 건너뛰고, 모두 탈락이면 게임 종료
 * - 주사위/비밀 통로 선택
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AwaitMoveState implements TurnPhaseState {

    private final AgentFactory agentFactory;
    private final GameDisplay display;

    @Override
    public TurnContext process(TurnContext context) {
        GameState game = context.getGame();
        TurnLookup lookup = game.lookupCurrent().orElseThrow();
        GamePlayerState current = lookup.current();
        GamePlayerState next = lookup.next();

        if (current.isOut()) {
            if (game.players().allOut()) {
                log.info("[턴] 모든 플레이어 탈락");
                return context.finish(game, TurnPhase.GAME_OVER, null);
            }
            return context.advance(game, next);
        }

        display.printTurn(game.publicState(), current);
        if (current.isHuman()) {
            display.printSheet(current);
        }

        List<Move> options = context.getBoard().getMoveOptions(game);
        Move move = agentFactory.getAgent(current).answerMove(current, game.publicState(), options);
        display.printMove(current, move);
        log.debug("[턴] {} 이동 방식: {}", current.getSuspect(), move);

        TurnContext started = context.toBuilder()
                .current(current)
                .next(next)
                .turns(context.getTurns() + 1)
                .build();
        if (move.isPassage()) {
            return started.arriveAt(move.destination());
        }
        return started.withPhase(TurnPhase.AWAIT_MOVEMENT);
    }

    @Override
    public TurnPhase getTurnPhase() {
        return TurnPhase.AWAIT_MOVE;
    }
}
