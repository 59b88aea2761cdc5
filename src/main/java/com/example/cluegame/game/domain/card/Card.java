package com.example.cluegame.game.domain.card;

import java.util.Objects;

/**
 * 게임 카드 한 장. 이름은 카드 전체에서 유일하다.
 */
public record Card(CardCategory category, String name) {
    public Card {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
    }

    public static Card suspect(String name) {
        return new Card(CardCategory.SUSPECT, name);
    }

    public static Card weapon(String name) {
        return new Card(CardCategory.WEAPON, name);
    }

    public static Card room(String name) {
        return new Card(CardCategory.ROOM, name);
    }

    public boolean is(CardCategory other) {
        return category == other;
    }

    @Override
    public String toString() {
        return name;
    }
}
