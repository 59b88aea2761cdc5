package com.example.cluegame.game.board;

import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;

import java.util.List;

/**
 * 보드 기하 정보. 현재 플레이어 기준으로 선택지를 계산한다.
 */
public interface BoardModel {

    /**
     * 턴 시작 시 선택지: 주사위와 현재 방에서 나가는 비밀 통로
     */
    List<Move> getMoveOptions(GameState state);

    /**
     * 주사위 눈 roll로 갈 수 있는 위치
     */
    List<MovementOption> getMovementOptions(GameState state, int roll);
}
