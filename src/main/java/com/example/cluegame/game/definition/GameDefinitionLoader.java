package com.example.cluegame.game.definition;

import com.example.cluegame.game.board.GraphBoard;
import com.example.cluegame.game.definition.GameDefinition.BoardDefinition;
import com.example.cluegame.game.definition.GameDefinition.EnvelopeDefinition;
import com.example.cluegame.game.definition.GameDefinition.PlayerDefinition;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.Players;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;
import com.example.cluegame.global.config.GameProperties;
import com.example.cluegame.global.error.CommonException;
import com.example.cluegame.global.error.ErrorCode;
import com.example.cluegame.global.random.RandomSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 게임 정의(JSON)를 읽어 초기 GameState와 보드를 만든다.
 * 봉투와 손패가 없으면 RandomSource로 뽑고 나눠준다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameDefinitionLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final RandomSource random;
    private final GameProperties properties;

    public LoadedGame importGame(String location) {
        String resolved = resolveLocation(location);
        Resource resource = resourceLoader.getResource(resolved);
        if (!resource.exists()) {
            throw ErrorCode.GAME_DEFINITION_LOAD_FAILED.commonException("not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            log.info("[로드] 게임 정의 읽는 중: {}", resolved);
            return importGame(in);
        } catch (IOException e) {
            throw new CommonException(ErrorCode.GAME_DEFINITION_LOAD_FAILED, location, e);
        }
    }

    public LoadedGame importGame(InputStream in) {
        GameDefinition definition;
        try {
            definition = objectMapper.readValue(in, GameDefinition.class);
        } catch (IOException e) {
            throw new CommonException(ErrorCode.GAME_DEFINITION_LOAD_FAILED, e.getMessage(), e);
        }
        return build(definition);
    }

    public LoadedGame build(GameDefinition definition) {
        if (definition == null) {
            throw invalid("empty definition");
        }
        Map<String, Card> cards = collectCards(definition);
        String accusationRoom = requireText(definition.accusationRoom(), "accusationRoom");
        if (cards.containsKey(accusationRoom)) {
            throw invalid("accusation room must not be a card: " + accusationRoom);
        }

        GraphBoard board = buildBoard(definition, cards, accusationRoom);
        List<PlayerDefinition> playerDefinitions = requireList(definition.players(), "players");

        Set<String> seenPlayers = new HashSet<>();
        for (PlayerDefinition player : playerDefinitions) {
            String suspect = requireText(player.suspect(), "players.suspect");
            Card card = cards.get(suspect);
            if (card == null || !card.is(CardCategory.SUSPECT)) {
                throw invalid("player is not a suspect card: " + suspect);
            }
            if (!seenPlayers.add(suspect)) {
                throw invalid("duplicate player: " + suspect);
            }
            if (player.agent() == null) {
                throw invalid("missing agent type for " + suspect);
            }
        }

        Deal deal = hasFixedDeal(definition)
                ? fixedDeal(definition, cards)
                : randomDeal(cards, playerDefinitions.size());

        List<GamePlayerState> players = new ArrayList<>();
        for (int i = 0; i < playerDefinitions.size(); i++) {
            PlayerDefinition player = playerDefinitions.get(i);
            Location start = startLocation(board, player.start(), player.suspect());
            players.add(GamePlayerState.builder()
                    .suspect(player.suspect())
                    .agentType(player.agent())
                    .location(start)
                    .sheet(KnowledgeSheet.initialize(cards.values(), deal.hands().get(i)))
                    .build());
        }

        String firstPlayer = definition.firstPlayer() == null
                ? playerDefinitions.get(0).suspect()
                : definition.firstPlayer();
        if (!seenPlayers.contains(firstPlayer)) {
            throw invalid("first player is not playing: " + firstPlayer);
        }

        boolean aiOnly = properties.aiOnly() != null
                ? properties.aiOnly()
                : Boolean.TRUE.equals(definition.aiOnly());
        GameState state = new GameState(
                Players.of(players),
                new PublicState(firstPlayer, accusationRoom, aiOnly),
                deal.envelope());

        String name = definition.name() == null ? "unnamed" : definition.name();
        log.info("[로드] 게임 '{}' 준비 완료: players={}, cards={}, aiOnly={}",
                name, players.size(), cards.size(), aiOnly);
        return new LoadedGame(name, state, board);
    }

    // ==================== 카드 ====================

    private Map<String, Card> collectCards(GameDefinition definition) {
        Map<String, Card> cards = new LinkedHashMap<>();
        addCards(cards, requireList(definition.suspects(), "suspects"), CardCategory.SUSPECT);
        addCards(cards, requireList(definition.weapons(), "weapons"), CardCategory.WEAPON);
        addCards(cards, requireList(definition.rooms(), "rooms"), CardCategory.ROOM);
        return cards;
    }

    private void addCards(Map<String, Card> cards, List<String> names, CardCategory category) {
        for (String name : names) {
            requireText(name, category.name().toLowerCase());
            if (cards.putIfAbsent(name, new Card(category, name)) != null) {
                throw invalid("duplicate card name: " + name);
            }
        }
    }

    // ==================== 보드 ====================

    private GraphBoard buildBoard(GameDefinition definition, Map<String, Card> cards, String accusationRoom) {
        BoardDefinition boardDefinition = definition.board();
        if (boardDefinition == null) {
            throw invalid("missing board");
        }
        GraphBoard.Builder builder = GraphBoard.builder();
        Set<String> spaces = new HashSet<>();
        for (String space : nullToEmpty(boardDefinition.spaces())) {
            String name = requireText(space, "board.spaces");
            if (cards.containsKey(name) || name.equals(accusationRoom) || !spaces.add(name)) {
                throw invalid("space name clashes with another location: " + name);
            }
            builder.location(Location.space(name));
        }
        for (Card room : cards.values()) {
            if (room.is(CardCategory.ROOM)) {
                builder.location(Location.room(room.name()));
            }
        }
        builder.location(Location.room(accusationRoom));

        for (List<String> edge : nullToEmpty(boardDefinition.edges())) {
            requirePair(edge, "board.edges");
            builder.edge(toLocation(edge.get(0), cards, accusationRoom, spaces),
                    toLocation(edge.get(1), cards, accusationRoom, spaces));
        }
        for (List<String> passage : nullToEmpty(boardDefinition.passages())) {
            requirePair(passage, "board.passages");
            Location a = toLocation(passage.get(0), cards, accusationRoom, spaces);
            Location b = toLocation(passage.get(1), cards, accusationRoom, spaces);
            if (!a.isRoom() || !b.isRoom()) {
                throw invalid("passage must connect two rooms: " + passage);
            }
            builder.passage(a, b);
        }
        return builder.build();
    }

    private Location startLocation(GraphBoard board, String name, String suspect) {
        String start = requireText(name, "start of " + suspect);
        Location room = Location.room(start);
        if (board.contains(room)) {
            return room;
        }
        Location space = Location.space(start);
        if (board.contains(space)) {
            return space;
        }
        throw invalid("unknown start location for " + suspect + ": " + start);
    }

    private Location toLocation(String name, Map<String, Card> cards, String accusationRoom, Set<String> spaces) {
        if (name == null) {
            throw invalid("location name is missing");
        }
        Card card = cards.get(name);
        if ((card != null && card.is(CardCategory.ROOM)) || name.equals(accusationRoom)) {
            return Location.room(name);
        }
        if (spaces.contains(name)) {
            return Location.space(name);
        }
        throw invalid("unknown location: " + name);
    }

    // ==================== 분배 ====================

    private record Deal(CardTriple envelope, List<List<Card>> hands) {
    }

    private boolean hasFixedDeal(GameDefinition definition) {
        boolean anyHand = definition.players().stream().anyMatch(p -> p.hand() != null);
        boolean allHands = definition.players().stream().allMatch(p -> p.hand() != null);
        if (definition.envelope() == null && !anyHand) {
            return false;
        }
        if (definition.envelope() == null || !allHands) {
            throw invalid("envelope and every hand must be given together");
        }
        return true;
    }

    private Deal fixedDeal(GameDefinition definition, Map<String, Card> cards) {
        EnvelopeDefinition envelope = definition.envelope();
        CardTriple solution = new CardTriple(
                requireCard(cards, envelope.suspect(), CardCategory.SUSPECT),
                requireCard(cards, envelope.weapon(), CardCategory.WEAPON),
                requireCard(cards, envelope.room(), CardCategory.ROOM));

        Set<Card> dealt = new HashSet<>(solution.cards());
        List<List<Card>> hands = new ArrayList<>();
        for (PlayerDefinition player : definition.players()) {
            List<Card> hand = new ArrayList<>();
            for (String name : player.hand()) {
                Card card = cards.get(name);
                if (card == null) {
                    throw invalid("unknown card in hand of " + player.suspect() + ": " + name);
                }
                if (!dealt.add(card)) {
                    throw invalid("card dealt twice: " + name);
                }
                hand.add(card);
            }
            hands.add(hand);
        }
        if (dealt.size() != cards.size()) {
            throw invalid("hands and envelope must cover every card");
        }
        return new Deal(solution, hands);
    }

    private Deal randomDeal(Map<String, Card> cards, int playerCount) {
        List<Card> universe = new ArrayList<>(cards.values());
        CardTriple envelope = new CardTriple(
                random.pick(byCategory(universe, CardCategory.SUSPECT)),
                random.pick(byCategory(universe, CardCategory.WEAPON)),
                random.pick(byCategory(universe, CardCategory.ROOM)));

        List<Card> deck = new ArrayList<>(universe);
        deck.removeAll(envelope.cards());
        random.shuffle(deck);

        List<List<Card>> hands = new ArrayList<>();
        for (int i = 0; i < playerCount; i++) {
            hands.add(new ArrayList<>());
        }
        for (int i = 0; i < deck.size(); i++) {
            hands.get(i % playerCount).add(deck.get(i));
        }
        log.debug("[로드] 카드 분배 완료: deck={}, players={}", deck.size(), playerCount);
        return new Deal(envelope, hands);
    }

    private List<Card> byCategory(List<Card> cards, CardCategory category) {
        return cards.stream().filter(card -> card.is(category)).toList();
    }

    // ==================== 검증 헬퍼 ====================

    private Card requireCard(Map<String, Card> cards, String name, CardCategory category) {
        Card card = cards.get(name);
        if (card == null || !card.is(category)) {
            throw invalid("envelope " + category.name().toLowerCase() + " is not a " + category + " card: " + name);
        }
        return card;
    }

    private String resolveLocation(String location) {
        if (!location.contains(":") && Files.exists(Path.of(location))) {
            return "file:" + location;
        }
        return location;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw invalid("missing " + field);
        }
        return value;
    }

    private static <T> List<T> requireList(List<T> values, String field) {
        if (values == null || values.isEmpty()) {
            throw invalid("missing " + field);
        }
        return values;
    }

    private static void requirePair(List<String> pair, String field) {
        if (pair == null || pair.size() != 2) {
            throw invalid(field + " entries must have exactly two names: " + pair);
        }
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static CommonException invalid(String detail) {
        return ErrorCode.INVALID_GAME_DEFINITION.commonException(detail);
    }
}
