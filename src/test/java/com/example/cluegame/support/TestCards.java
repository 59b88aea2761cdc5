package com.example.cluegame.support;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;

import java.util.List;

/**
 * 테스트용 3x3 카드 세트와 플레이어 생성 도우미
 */
public final class TestCards {

    public static final Card RED = Card.suspect("Red");
    public static final Card BLUE = Card.suspect("Blue");
    public static final Card GREEN = Card.suspect("Green");

    public static final Card KNIFE = Card.weapon("Knife");
    public static final Card ROPE = Card.weapon("Rope");
    public static final Card PIPE = Card.weapon("Pipe");

    public static final Card LIBRARY = Card.room("Library");
    public static final Card KITCHEN = Card.room("Kitchen");
    public static final Card HALL = Card.room("Hall");

    public static final List<Card> UNIVERSE = List.of(
            RED, BLUE, GREEN,
            KNIFE, ROPE, PIPE,
            LIBRARY, KITCHEN, HALL);

    public static final String ACCUSATION_ROOM = "Cellar";
    public static final Location CELLAR = Location.room(ACCUSATION_ROOM);

    private TestCards() {
    }

    public static KnowledgeSheet sheet(Card... hand) {
        return KnowledgeSheet.initialize(UNIVERSE, List.of(hand));
    }

    public static GamePlayerState player(String suspect, AgentType type, Location location, Card... hand) {
        return GamePlayerState.builder()
                .suspect(suspect)
                .agentType(type)
                .location(location)
                .sheet(sheet(hand))
                .build();
    }
}
