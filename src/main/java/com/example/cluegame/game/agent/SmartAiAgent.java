package com.example.cluegame.game.agent;

import com.example.cluegame.game.ai.DeductionEngine;
import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * AI 플레이어 전략
 * - 자기 시트만 보고 DeductionEngine에 위임
 */
@Component
@RequiredArgsConstructor
public class SmartAiAgent implements PlayerAgent {

    private final DeductionEngine deductionEngine;

    @Override
    public AgentType getAgentType() {
        return AgentType.AI;
    }

    @Override
    public Move answerMove(GamePlayerState me, PublicState publicState, List<Move> options) {
        return deductionEngine.decideMove(me.getSheet(), options);
    }

    @Override
    public Location chooseMovement(GamePlayerState me, PublicState publicState, List<MovementOption> options) {
        return deductionEngine.decideMovement(me.getSheet(), publicState, options);
    }

    @Override
    public CardTriple makeGuess(GamePlayerState me, PublicState publicState) {
        return deductionEngine.decideGuess(me.getSheet(), me.getLocation());
    }

    @Override
    public CardTriple makeAccusation(GamePlayerState me, PublicState publicState) {
        return deductionEngine.decideAccusation(me.getSheet());
    }

    @Override
    public Optional<Card> answerGuess(GamePlayerState me, PublicState publicState, CardTriple guess, String asker) {
        return deductionEngine.decideReveal(me.getSheet(), guess, asker);
    }
}
