package com.example.cluegame.game.domain.board;

import java.util.Objects;

/**
 * 턴 시작 시 고르는 이동 방식. PASSAGE면 destination이 정해져 있다.
 */
public record Move(MoveType type, Location destination) {
    private static final Move ROLL = new Move(MoveType.ROLL, null);

    public Move {
        Objects.requireNonNull(type, "type");
        if (type == MoveType.PASSAGE && (destination == null || !destination.isRoom())) {
            throw new IllegalArgumentException("passage must lead to a room");
        }
    }

    public static Move roll() {
        return ROLL;
    }

    public static Move passage(Location destination) {
        return new Move(MoveType.PASSAGE, destination);
    }

    public boolean isPassage() {
        return type == MoveType.PASSAGE;
    }

    @Override
    public String toString() {
        return isPassage() ? "Passage(" + destination.name() + ")" : "Roll";
    }
}
