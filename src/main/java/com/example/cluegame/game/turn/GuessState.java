package com.example.cluegame.game.turn;

import com.example.cluegame.game.agent.AgentFactory;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.view.GameDisplay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 추리 페이즈
 * - 추리자 다음 플레이어부터 한 바퀴 돌며 처음 보여준 카드 하나만 받는다
 * - 아무도 못 보여주면 추리자 시트의 UNKNOWN 카드를 봉투로 올린다
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GuessState implements TurnPhaseState {

    private final AgentFactory agentFactory;
    private final GameDisplay display;

    @Override
    public TurnContext process(TurnContext context) {
        GamePlayerState guesser = context.getCurrent().withLocation(context.getDestination());
        GameState game = context.getGame().withPlayer(guesser);
        PublicState publicState = game.publicState();

        CardTriple guess = agentFactory.getAgent(guesser).makeGuess(guesser, publicState);
        display.printGuess(guesser, guess);

        for (GamePlayerState responder : game.players().revealOrder(guesser.getSuspect())) {
            Optional<Card> shown = agentFactory.getAgent(responder)
                    .answerGuess(responder, publicState, guess, guesser.getSuspect());
            if (shown.isEmpty()) {
                continue;
            }
            Card card = shown.get();
            log.debug("[추리] {} → {} 카드 공개: {}", responder.getSuspect(), guesser.getSuspect(), card);
            display.printReveal(guesser, Optional.of(responder.getSuspect()), shown);

            GamePlayerState updatedGuesser = guesser.withSheet(
                    guesser.getSheet().recordShown(card, responder.getSuspect()));
            GamePlayerState updatedResponder = responder.withSheet(
                    responder.getSheet().noteShownTo(card, guesser.getSuspect()));
            return context.advance(game.withPlayer(updatedGuesser).withPlayer(updatedResponder));
        }

        log.debug("[추리] {}의 추리를 아무도 반박하지 못함: {}", guesser.getSuspect(), guess);
        display.printReveal(guesser, Optional.empty(), Optional.empty());
        GamePlayerState updatedGuesser = guesser.withSheet(guesser.getSheet().markNoDisprove(guess));
        return context.advance(game.withPlayer(updatedGuesser));
    }

    @Override
    public TurnPhase getTurnPhase() {
        return TurnPhase.GUESS;
    }
}
