package com.example.cluegame.game.domain;

import java.util.Optional;

/**
 * 게임 종료 결과
 *
 * @param turns 실제로 진행된 턴 수 (탈락자 건너뛰기는 제외)
 */
public record GameOutcome(GameResult result, Optional<String> winner, GameState finalState, int turns) {

    public static GameOutcome win(String winner, GameState finalState, int turns) {
        return new GameOutcome(GameResult.WIN, Optional.of(winner), finalState, turns);
    }

    public static GameOutcome gameOver(GameState finalState, int turns) {
        return new GameOutcome(GameResult.GAME_OVER, Optional.empty(), finalState, turns);
    }
}
