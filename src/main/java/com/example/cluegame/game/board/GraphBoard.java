package com.example.cluegame.game.board;

import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 방과 복도 칸을 무방향 그래프로 표현한 보드.
 * 방은 지나갈 수 없고 들어가면 이동이 끝난다. 다른 플레이어는 길을 막지 않는다.
 */
@Slf4j
public class GraphBoard implements BoardModel {

    private final Map<Location, Set<Location>> adjacency;
    private final Map<Location, List<Location>> passages;

    private GraphBoard(Map<Location, Set<Location>> adjacency, Map<Location, List<Location>> passages) {
        this.adjacency = adjacency;
        this.passages = passages;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Move> getMoveOptions(GameState state) {
        GamePlayerState player = state.currentPlayer();
        List<Move> options = new ArrayList<>();
        options.add(Move.roll());
        for (Location destination : passages.getOrDefault(player.getLocation(), List.of())) {
            options.add(Move.passage(destination));
        }
        return options;
    }

    @Override
    public List<MovementOption> getMovementOptions(GameState state, int roll) {
        Location start = state.currentPlayer().getLocation();
        Map<Location, Integer> distances = distancesFrom(start, roll);

        List<MovementOption> options = new ArrayList<>();
        distances.forEach((location, distance) -> {
            if (location.equals(start)) {
                return;
            }
            if (location.isRoom()) {
                options.add(new MovementOption(location, distance == roll));
            } else if (distance == roll) {
                options.add(new MovementOption(location, true));
            }
        });
        // 고발 방 말고 갈 곳이 없으면 제자리도 후보로 둔다
        String accusationRoom = state.publicState().accusationRoom();
        if (options.stream().allMatch(option -> option.location().isRoom(accusationRoom))) {
            log.debug("[보드] {}에서 {}칸으로 갈 곳이 없어 제자리", start, roll);
            options.add(new MovementOption(start, false));
        }
        return options;
    }

    public Set<Location> locations() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public boolean contains(Location location) {
        return adjacency.containsKey(location);
    }

    public List<Location> passagesFrom(Location room) {
        return passages.getOrDefault(room, List.of());
    }

    // BFS, 출발지가 아닌 방에서는 더 뻗어나가지 않는다
    private Map<Location, Integer> distancesFrom(Location start, int limit) {
        Map<Location, Integer> distances = new LinkedHashMap<>();
        Deque<Location> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            Location current = queue.poll();
            int distance = distances.get(current);
            if (distance == limit || (current.isRoom() && !current.equals(start))) {
                continue;
            }
            for (Location neighbor : adjacency.getOrDefault(current, Set.of())) {
                if (!distances.containsKey(neighbor)) {
                    distances.put(neighbor, distance + 1);
                    queue.add(neighbor);
                }
            }
        }
        return distances;
    }

    public static class Builder {
        private final Map<Location, Set<Location>> adjacency = new LinkedHashMap<>();
        private final Map<Location, List<Location>> passages = new LinkedHashMap<>();

        public Builder location(Location location) {
            adjacency.computeIfAbsent(location, key -> new LinkedHashSet<>());
            return this;
        }

        public Builder edge(Location a, Location b) {
            location(a).location(b);
            adjacency.get(a).add(b);
            adjacency.get(b).add(a);
            return this;
        }

        public Builder passage(Location a, Location b) {
            if (!a.isRoom() || !b.isRoom()) {
                throw new IllegalArgumentException("passage must connect two rooms: " + a + " - " + b);
            }
            location(a).location(b);
            passages.computeIfAbsent(a, key -> new ArrayList<>()).add(b);
            passages.computeIfAbsent(b, key -> new ArrayList<>()).add(a);
            return this;
        }

        public GraphBoard build() {
            Map<Location, Set<Location>> frozenAdjacency = new LinkedHashMap<>();
            adjacency.forEach((key, value) -> frozenAdjacency.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(value))));
            Map<Location, List<Location>> frozenPassages = new LinkedHashMap<>();
            passages.forEach((key, value) -> frozenPassages.put(key, List.copyOf(value)));
            return new GraphBoard(Collections.unmodifiableMap(frozenAdjacency), Collections.unmodifiableMap(frozenPassages));
        }
    }
}
