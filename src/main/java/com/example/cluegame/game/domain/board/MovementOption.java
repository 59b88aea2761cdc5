package com.example.cluegame.game.domain.board;

import java.util.Objects;

/**
 * 주사위 결과로 도달할 수 있는 위치.
 *
 * @param exact 주사위 눈과 정확히 같은 거리인지 여부
 */
public record MovementOption(Location location, boolean exact) {
    public MovementOption {
        Objects.requireNonNull(location, "location");
    }

    public boolean isRoom() {
        return location.isRoom();
    }
}
