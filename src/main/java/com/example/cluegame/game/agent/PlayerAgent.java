package com.example.cluegame.game.agent;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;

import java.util.List;
import java.util.Optional;

/**
 * 플레이어 종류별 의사결정 전략 인터페이스 (Strategy Pattern)
 */
public interface PlayerAgent {

    AgentType getAgentType();

    /**
     * 주사위 또는 비밀 통로 선택
     */
    Move answerMove(GamePlayerState me, PublicState publicState, List<Move> options);

    /**
     * 주사위 결과로 갈 수 있는 위치 중 선택
     */
    Location chooseMovement(GamePlayerState me, PublicState publicState, List<MovementOption> options);

    /**
     * 현재 방에서 할 추리
     */
    CardTriple makeGuess(GamePlayerState me, PublicState publicState);

    /**
     * 고발 방에서 할 최종 고발
     */
    CardTriple makeAccusation(GamePlayerState me, PublicState publicState);

    /**
     * 다른 플레이어의 추리에 보여줄 카드, 없으면 empty
     *
     * @param asker 추리한 플레이어 id
     */
    Optional<Card> answerGuess(GamePlayerState me, PublicState publicState, CardTriple guess, String asker);
}
