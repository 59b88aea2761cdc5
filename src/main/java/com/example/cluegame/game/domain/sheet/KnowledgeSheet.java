package com.example.cluegame.game.domain.sheet;

import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.global.error.ErrorCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 플레이어 한 명의 추리 시트.
 * 게임의 모든 카드에 대해 정확히 하나의 믿음을 가진다.
 * 불변 객체이며 모든 갱신은 새 시트를 돌려준다.
 */
public final class KnowledgeSheet {

    private final Map<Card, Belief> entries;

    private KnowledgeSheet(Map<Card, Belief> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * 손패는 MINE, 나머지는 UNKNOWN으로 시트를 만든다.
     *
     * @throws com.example.cluegame.global.error.CommonException 손패에 게임에 없는 카드가 있을 때
     */
    public static KnowledgeSheet initialize(Collection<Card> universe, Collection<Card> hand) {
        for (Card card : hand) {
            if (!universe.contains(card)) {
                throw ErrorCode.CARD_NOT_IN_UNIVERSE.commonException(card.name());
            }
        }
        Map<Card, Belief> entries = new LinkedHashMap<>();
        for (Card card : universe) {
            entries.put(card, hand.contains(card) ? Belief.mine() : Belief.unknown());
        }
        return new KnowledgeSheet(entries);
    }

    public Belief belief(Card card) {
        Belief belief = entries.get(card);
        if (belief == null) {
            throw ErrorCode.CARD_NOT_IN_UNIVERSE.commonException(card.name());
        }
        return belief;
    }

    public boolean is(Card card, BeliefKind kind) {
        return belief(card).is(kind);
    }

    /**
     * 다른 플레이어가 보여준 카드를 기록한다. 이미 SHOWN_BY면 그대로 둔다.
     */
    public KnowledgeSheet recordShown(Card card, String by) {
        Belief current = belief(card);
        return switch (current.kind()) {
            case UNKNOWN -> with(card, Belief.shownBy(by));
            case SHOWN_BY -> this;
            case MINE, ENVELOPE -> throw ErrorCode.BELIEF_CONTRADICTION.commonException(
                    card.name() + " is " + current.kind() + ", cannot be shown by " + by);
        };
    }

    /**
     * 아무도 반박하지 못한 추리의 UNKNOWN 카드를 봉투로 올린다.
     */
    public KnowledgeSheet markNoDisprove(CardTriple triple) {
        Map<Card, Belief> updated = new LinkedHashMap<>(entries);
        for (Card card : triple.cards()) {
            if (belief(card).is(BeliefKind.UNKNOWN)) {
                updated.put(card, Belief.envelope());
            }
        }
        return new KnowledgeSheet(updated);
    }

    /**
     * 내 카드를 viewer에게 보여줬다고 기록한다.
     */
    public KnowledgeSheet noteShownTo(Card card, String viewer) {
        Belief current = belief(card);
        if (!(current instanceof Belief.Mine mine)) {
            throw ErrorCode.BELIEF_CONTRADICTION.commonException(
                    "showed card not in hand: " + card.name());
        }
        Belief.Mine updated = mine.withViewer(viewer);
        return updated == mine ? this : with(card, updated);
    }

    public boolean categorySolved(CardCategory category) {
        return cardsWith(category, BeliefKind.ENVELOPE).size() == 1;
    }

    public boolean allSolved() {
        for (CardCategory category : CardCategory.values()) {
            if (!categorySolved(category)) {
                return false;
            }
        }
        return true;
    }

    public SolutionGuess solutionGuess() {
        return new SolutionGuess(
                envelopeCard(CardCategory.SUSPECT),
                envelopeCard(CardCategory.WEAPON),
                envelopeCard(CardCategory.ROOM));
    }

    public List<Card> cards(CardCategory category) {
        return entries.keySet().stream()
                .filter(card -> card.is(category))
                .toList();
    }

    public List<Card> cardsWith(CardCategory category, BeliefKind kind) {
        return entries.entrySet().stream()
                .filter(e -> e.getKey().is(category) && e.getValue().is(kind))
                .map(Map.Entry::getKey)
                .toList();
    }

    public Set<Card> universe() {
        return entries.keySet();
    }

    public Map<Card, Belief> entries() {
        return entries;
    }

    public Map<BeliefKind, Long> countByKind() {
        return entries.values().stream()
                .collect(Collectors.groupingBy(Belief::kind, Collectors.counting()));
    }

    private Optional<Card> envelopeCard(CardCategory category) {
        List<Card> marked = cardsWith(category, BeliefKind.ENVELOPE);
        return marked.size() == 1 ? Optional.of(marked.get(0)) : Optional.empty();
    }

    private KnowledgeSheet with(Card card, Belief belief) {
        Map<Card, Belief> updated = new LinkedHashMap<>(entries);
        updated.put(card, belief);
        return new KnowledgeSheet(updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof KnowledgeSheet other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "KnowledgeSheet" + entries;
    }
}
