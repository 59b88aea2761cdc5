package com.example.cluegame.game.domain.card;

import java.util.List;
import java.util.Objects;

/**
 * 용의자, 흉기, 방 한 장씩으로 이루어진 조합.
 * 추리(guess), 고발(accusation), 봉투(정답) 모두 이 형태를 쓴다.
 */
public record CardTriple(Card suspect, Card weapon, Card room) {
    public CardTriple {
        requireCategory(suspect, CardCategory.SUSPECT);
        requireCategory(weapon, CardCategory.WEAPON);
        requireCategory(room, CardCategory.ROOM);
    }

    public List<Card> cards() {
        return List.of(suspect, weapon, room);
    }

    public boolean contains(Card card) {
        return suspect.equals(card) || weapon.equals(card) || room.equals(card);
    }

    public Card get(CardCategory category) {
        return switch (category) {
            case SUSPECT -> suspect;
            case WEAPON -> weapon;
            case ROOM -> room;
        };
    }

    @Override
    public String toString() {
        return suspect.name() + " / " + weapon.name() + " / " + room.name();
    }

    private static void requireCategory(Card card, CardCategory category) {
        Objects.requireNonNull(card, category.name());
        if (!card.is(category)) {
            throw new IllegalArgumentException("expected " + category + " card but was " + card.category());
        }
    }
}
