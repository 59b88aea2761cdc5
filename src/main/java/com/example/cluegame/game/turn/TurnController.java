package com.example.cluegame.game.turn;

import com.example.cluegame.game.board.BoardModel;
import com.example.cluegame.game.domain.GameOutcome;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.view.GameDisplay;
import com.example.cluegame.global.config.GameProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 게임 진행 컨트롤러.
 * 종료 페이즈(WIN, GAME_OVER)에 도달할 때까지 페이즈 상태를 반복 실행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnController {

    private final TurnPhaseFactory phaseFactory;
    private final GameDisplay display;
    private final GameProperties properties;

    public GameOutcome run(GameState initial, BoardModel board) {
        log.info("[게임] 시작: 첫 플레이어={}, players={}",
                initial.publicState().currentPlayer(), initial.players().size());
        TurnContext context = TurnContext.start(initial, board);
        while (!context.isTerminal()) {
            context = step(context);
        }
        return finish(context);
    }

    /**
     * 페이즈 하나를 처리합니다.
     */
    public TurnContext step(TurnContext context) {
        if (context.getPhase() == TurnPhase.AWAIT_MOVE
                && properties.hasTurnLimit()
                && context.getTurns() >= properties.maxTurns()) {
            log.warn("[게임] 턴 상한 {} 도달, 승자 없이 종료", properties.maxTurns());
            return context.finish(context.getGame(), TurnPhase.GAME_OVER, null);
        }
        TurnPhaseState state = phaseFactory.getState(context.getPhase());
        TurnContext next = state.process(context);
        log.debug("[턴] {} -> {} (current={})",
                context.getPhase(), next.getPhase(), next.getGame().publicState().currentPlayer());
        return next;
    }

    /**
     * 다음 턴 시작(AWAIT_MOVE) 또는 종료 페이즈까지 진행합니다.
     */
    public TurnContext playTurn(TurnContext context) {
        TurnContext current = context;
        do {
            current = step(current);
        } while (!current.isTerminal() && current.getPhase() != TurnPhase.AWAIT_MOVE);
        return current;
    }

    public GameOutcome finish(TurnContext context) {
        GameState state = context.getGame();
        if (context.getPhase() == TurnPhase.WIN) {
            log.info("[게임] 종료: 승자={}, turns={}", context.getWinner(), context.getTurns());
            display.displayVictory(context.getWinner(), state.envelope());
            return GameOutcome.win(context.getWinner(), state, context.getTurns());
        }
        if (context.getPhase() != TurnPhase.GAME_OVER) {
            throw new IllegalStateException("game is still running in phase " + context.getPhase());
        }
        log.info("[게임] 종료: 승자 없음, turns={}", context.getTurns());
        display.displayMessage("게임 종료. 정답은 " + state.envelope() + " 였습니다.");
        return GameOutcome.gameOver(state, context.getTurns());
    }
}
