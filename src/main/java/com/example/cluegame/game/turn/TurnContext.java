package com.example.cluegame.game.turn;

import com.example.cluegame.game.board.BoardModel;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.board.Location;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.With;

/**
 * 턴 상태 머신이 한 단계씩 넘겨받는 불변 컨텍스트.
 * current/next/destination은 한 턴 안에서만 의미가 있다.
 */
@Getter
@With
@Builder(toBuilder = true)
@AllArgsConstructor
public class TurnContext {

    private final BoardModel board;
    private final GameState game;
    private final TurnPhase phase;

    private final GamePlayerState current;
    private final GamePlayerState next;
    private final Location destination;

    private final int turns;
    private final String winner;

    public static TurnContext start(GameState game, BoardModel board) {
        return TurnContext.builder()
                .board(board)
                .game(game)
                .phase(TurnPhase.AWAIT_MOVE)
                .build();
    }

    /**
     * 도착한 위치에 따라 다음 페이즈를 정한다.
     */
    public TurnContext arriveAt(Location location) {
        String accusationRoom = game.publicState().accusationRoom();
        TurnPhase nextPhase;
        if (location.isRoom(accusationRoom)) {
            nextPhase = TurnPhase.ACCUSATION;
        } else if (location.isRoom()) {
            nextPhase = TurnPhase.GUESS;
        } else {
            nextPhase = TurnPhase.END_TURN;
        }
        return toBuilder().destination(location).phase(nextPhase).build();
    }

    /**
     * 갱신된 게임 상태로 다음 플레이어의 턴을 시작한다.
     */
    public TurnContext advance(GameState updated, GamePlayerState nextPlayer) {
        return toBuilder()
                .game(updated.advanceTo(nextPlayer.getSuspect()))
                .phase(TurnPhase.AWAIT_MOVE)
                .current(null)
                .next(null)
                .destination(null)
                .build();
    }

    public TurnContext advance(GameState updated) {
        return advance(updated, next);
    }

    public TurnContext finish(GameState updated, TurnPhase terminal, String winner) {
        return toBuilder().game(updated).phase(terminal).winner(winner).build();
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }
}
