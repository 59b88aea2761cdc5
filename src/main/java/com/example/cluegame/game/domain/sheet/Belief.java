package com.example.cluegame.game.domain.sheet;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 카드 한 장에 대한 플레이어의 믿음
 */
public sealed interface Belief permits Belief.Unknown, Belief.Mine, Belief.Envelope, Belief.ShownBy {

    BeliefKind kind();

    default boolean is(BeliefKind other) {
        return kind() == other;
    }

    static Belief unknown() {
        return Unknown.INSTANCE;
    }

    static Belief mine() {
        return new Mine(Set.of());
    }

    static Belief envelope() {
        return Envelope.INSTANCE;
    }

    static Belief shownBy(String playerId) {
        return new ShownBy(playerId);
    }

    record Unknown() implements Belief {
        static final Unknown INSTANCE = new Unknown();

        @Override
        public BeliefKind kind() {
            return BeliefKind.UNKNOWN;
        }
    }

    /**
     * @param shownTo 이미 이 카드를 본 플레이어 id
     */
    record Mine(Set<String> shownTo) implements Belief {
        public Mine {
            shownTo = Collections.unmodifiableSet(new LinkedHashSet<>(shownTo));
        }

        @Override
        public BeliefKind kind() {
            return BeliefKind.MINE;
        }

        public boolean wasShownTo(String playerId) {
            return shownTo.contains(playerId);
        }

        public Mine withViewer(String playerId) {
            if (shownTo.contains(playerId)) {
                return this;
            }
            Set<String> viewers = new LinkedHashSet<>(shownTo);
            viewers.add(playerId);
            return new Mine(viewers);
        }
    }

    record Envelope() implements Belief {
        static final Envelope INSTANCE = new Envelope();

        @Override
        public BeliefKind kind() {
            return BeliefKind.ENVELOPE;
        }
    }

    record ShownBy(String playerId) implements Belief {
        public ShownBy {
            Objects.requireNonNull(playerId, "playerId");
        }

        @Override
        public BeliefKind kind() {
            return BeliefKind.SHOWN_BY;
        }
    }
}
