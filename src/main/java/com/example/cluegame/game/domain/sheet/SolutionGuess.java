package com.example.cluegame.game.domain.sheet;

import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.global.error.ErrorCode;

import java.util.Optional;

/**
 * 시트에서 읽어낸 정답 후보. 비어 있는 칸은 아직 풀리지 않은 카테고리.
 */
public record SolutionGuess(Optional<Card> suspect, Optional<Card> weapon, Optional<Card> room) {

    public Optional<Card> get(CardCategory category) {
        return switch (category) {
            case SUSPECT -> suspect;
            case WEAPON -> weapon;
            case ROOM -> room;
        };
    }

    public boolean isComplete() {
        return suspect.isPresent() && weapon.isPresent() && room.isPresent();
    }

    public CardTriple toTriple() {
        return new CardTriple(require(CardCategory.SUSPECT), require(CardCategory.WEAPON), require(CardCategory.ROOM));
    }

    private Card require(CardCategory category) {
        return get(category).orElseThrow(() -> ErrorCode.CATEGORY_UNRESOLVED.commonException(category.name()));
    }
}
