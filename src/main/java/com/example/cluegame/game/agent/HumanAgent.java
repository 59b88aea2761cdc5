package com.example.cluegame.game.agent;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.domain.sheet.BeliefKind;
import com.example.cluegame.global.error.ErrorCode;
import com.example.cluegame.game.view.PlayerPrompt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 사람 플레이어 전략
 * - 모든 결정을 PlayerPrompt 입력으로 받는다
 */
@Component
@RequiredArgsConstructor
public class HumanAgent implements PlayerAgent {

    private final PlayerPrompt prompt;

    @Override
    public AgentType getAgentType() {
        return AgentType.HUMAN;
    }

    @Override
    public Move answerMove(GamePlayerState me, PublicState publicState, List<Move> options) {
        if (options.size() == 1) {
            return options.get(0);
        }
        return prompt.promptMove(me, options);
    }

    @Override
    public Location chooseMovement(GamePlayerState me, PublicState publicState, List<MovementOption> options) {
        return prompt.promptMovement(me, options);
    }

    @Override
    public CardTriple makeGuess(GamePlayerState me, PublicState publicState) {
        Location location = me.getLocation();
        if (!location.isRoom()) {
            throw ErrorCode.NOT_IN_ROOM.commonException(location.name());
        }
        return prompt.promptGuess(me, Card.room(location.name()));
    }

    @Override
    public CardTriple makeAccusation(GamePlayerState me, PublicState publicState) {
        return prompt.promptAccusation(me);
    }

    @Override
    public Optional<Card> answerGuess(GamePlayerState me, PublicState publicState, CardTriple guess, String asker) {
        // 보여줄 수 있는 카드가 있으면 반드시 보여줘야 한다
        List<Card> matches = guess.cards().stream()
                .filter(card -> me.getSheet().is(card, BeliefKind.MINE))
                .toList();
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        return Optional.of(prompt.promptReveal(me, matches, asker));
    }
}
