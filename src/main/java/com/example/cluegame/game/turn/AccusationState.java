package com.example.cluegame.game.turn;

import com.example.cluegame.game.agent.AgentFactory;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.view.GameDisplay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 최종 고발 페이즈
 * - 정답이면 승리, 틀리면 탈락 후 종료 조건 확인
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccusationState implements TurnPhaseState {

    private final AgentFactory agentFactory;
    private final GameDisplay display;

    @Override
    public TurnContext process(TurnContext context) {
        GameState game = context.getGame();
        PublicState publicState = game.publicState();
        GamePlayerState player = context.getCurrent().withLocation(context.getDestination());

        CardTriple accusation = agentFactory.getAgent(player).makeAccusation(player, publicState);
        display.printAccusation(player, accusation);

        if (accusation.equals(game.envelope())) {
            log.info("[고발] {} 정답: {}", player.getSuspect(), accusation);
            return context.finish(game.withPlayer(player), TurnPhase.WIN, player.getSuspect());
        }

        log.info("[고발] {} 오답으로 탈락: {}", player.getSuspect(), accusation);
        display.displayMessage(player.getSuspect() + "님의 고발이 틀렸습니다. 게임에서 탈락합니다.");
        GameState updated = game.withPlayer(player.withOut(true));

        if (shouldContinue(updated)) {
            return context.advance(updated);
        }
        return context.finish(updated, TurnPhase.GAME_OVER, null);
    }

    /**
     * aiOnly가 아니면 살아있는 사람 플레이어가 있어야 계속한다. 모두 탈락이면 항상 종료.
     */
    static boolean shouldContinue(GameState state) {
        boolean guard = state.publicState().aiOnly() || state.players().hasActiveHuman();
        return guard && !state.players().allOut();
    }

    @Override
    public TurnPhase getTurnPhase() {
        return TurnPhase.ACCUSATION;
    }
}
