package com.example.cluegame.game.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 턴 순서대로 고정된 플레이어 링.
 * 마지막 플레이어 다음은 첫 플레이어다. 교체는 새 Players를 돌려준다.
 */
public final class Players {

    private final GamePlayerState[] seats;
    private final Map<String, Integer> indexById;

    private Players(GamePlayerState[] seats, Map<String, Integer> indexById) {
        this.seats = seats;
        this.indexById = indexById;
    }

    public static Players of(List<GamePlayerState> players) {
        GamePlayerState[] seats = players.toArray(new GamePlayerState[0]);
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < seats.length; i++) {
            if (indexById.putIfAbsent(seats[i].getSuspect(), i) != null) {
                throw new IllegalArgumentException("duplicate player: " + seats[i].getSuspect());
            }
        }
        return new Players(seats, Collections.unmodifiableMap(indexById));
    }

    /**
     * 플레이어 목록 전체를 턴 순서대로 반환합니다.
     */
    public List<GamePlayerState> getAsList() {
        return Collections.unmodifiableList(Arrays.asList(seats));
    }

    public Optional<GamePlayerState> findById(String playerId) {
        Integer index = indexById.get(playerId);
        return index == null ? Optional.empty() : Optional.of(seats[index]);
    }

    /**
     * 현재 플레이어와 그 다음 플레이어를 찾습니다.
     */
    public TurnLookup lookup(String playerId) {
        if (seats.length == 0) {
            return TurnLookup.emptyRing(playerId);
        }
        Integer index = indexById.get(playerId);
        if (index == null) {
            return TurnLookup.notFound(playerId);
        }
        return TurnLookup.found(seats[index], seats[(index + 1) % seats.length]);
    }

    /**
     * 같은 용의자 이름의 플레이어를 교체한 새 링을 반환합니다.
     */
    public Players replace(GamePlayerState player) {
        Integer index = indexById.get(player.getSuspect());
        if (index == null) {
            throw new IllegalArgumentException("unknown player: " + player.getSuspect());
        }
        GamePlayerState[] copy = seats.clone();
        copy[index] = player;
        return new Players(copy, indexById);
    }

    /**
     * 추리자 바로 다음부터 한 바퀴 돌며, 추리자를 제외한 플레이어를 반환합니다.
     */
    public List<GamePlayerState> revealOrder(String guesserId) {
        Integer index = indexById.get(guesserId);
        if (index == null) {
            throw new IllegalArgumentException("unknown player: " + guesserId);
        }
        List<GamePlayerState> order = new ArrayList<>(seats.length - 1);
        for (int offset = 1; offset < seats.length; offset++) {
            order.add(seats[(index + offset) % seats.length]);
        }
        return order;
    }

    public boolean allOut() {
        for (GamePlayerState player : seats) {
            if (!player.isOut()) {
                return false;
            }
        }
        return true;
    }

    public boolean hasActiveHuman() {
        for (GamePlayerState player : seats) {
            if (player.isActiveHuman()) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return seats.length;
    }

    public boolean isEmpty() {
        return seats.length == 0;
    }
}
