package com.example.cluegame.game.domain.board;

import java.util.Objects;

/**
 * 보드 위의 위치. 방이면 name은 방 카드 이름과 같다.
 */
public record Location(LocationType type, String name) {
    public Location {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
    }

    public static Location room(String name) {
        return new Location(LocationType.ROOM, name);
    }

    public static Location space(String name) {
        return new Location(LocationType.SPACE, name);
    }

    public boolean isRoom() {
        return type == LocationType.ROOM;
    }

    public boolean isRoom(String roomName) {
        return isRoom() && name.equals(roomName);
    }

    @Override
    public String toString() {
        return name;
    }
}
