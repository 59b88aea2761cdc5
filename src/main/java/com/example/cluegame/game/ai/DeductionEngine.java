package com.example.cluegame.game.ai;

import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.domain.sheet.Belief;
import com.example.cluegame.game.domain.sheet.BeliefKind;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;
import com.example.cluegame.global.error.ErrorCode;
import com.example.cluegame.global.random.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * AI 플레이어의 의사결정 정책.
 * 상태를 갖지 않으며 자기 시트와 공개 상태만 읽는다. 동점은 RandomSource로 고른다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeductionEngine {

    private final RandomSource random;

    /**
     * 주사위를 굴릴지, 비밀 통로를 탈지 결정합니다.
     * 방 카테고리가 풀리지 않았으면 내 방 → 봉투 방 순서로 통로를 찾고,
     * 풀렸으면 아직 모르는 방으로 가는 통로를 찾습니다. 없으면 주사위.
     */
    public Move decideMove(KnowledgeSheet sheet, List<Move> options) {
        List<Move> passages = options.stream().filter(Move::isPassage).toList();
        if (!sheet.categorySolved(CardCategory.ROOM)) {
            List<Move> mine = passagesTo(sheet, passages, BeliefKind.MINE);
            if (!mine.isEmpty()) {
                return random.pick(mine);
            }
            List<Move> envelope = passagesTo(sheet, passages, BeliefKind.ENVELOPE);
            if (!envelope.isEmpty()) {
                return random.pick(envelope);
            }
            return Move.roll();
        }
        List<Move> unknown = passagesTo(sheet, passages, BeliefKind.UNKNOWN);
        return unknown.isEmpty() ? Move.roll() : random.pick(unknown);
    }

    /**
     * 주사위 결과로 갈 수 있는 위치 중 하나를 고릅니다.
     * 세 카테고리가 모두 풀렸으면 고발 방 외에는 선택지가 없습니다.
     */
    public Location decideMovement(KnowledgeSheet sheet, PublicState publicState, List<MovementOption> options) {
        String accusationRoom = publicState.accusationRoom();
        if (sheet.allSolved()) {
            List<MovementOption> accusation = options.stream()
                    .filter(option -> option.location().isRoom(accusationRoom))
                    .toList();
            if (accusation.size() != 1) {
                throw ErrorCode.ACCUSATION_ROOM_NOT_FOUND.commonException(
                        accusation.size() + " options lead to " + accusationRoom);
            }
            return accusation.get(0).location();
        }

        List<MovementOption> candidates = options.stream()
                .filter(option -> !option.location().isRoom(accusationRoom))
                .toList();

        List<Predicate<MovementOption>> tiers = new ArrayList<>();
        if (!sheet.categorySolved(CardCategory.SUSPECT) || !sheet.categorySolved(CardCategory.WEAPON)) {
            // 내 방/봉투 방에서 추리하면 용의자와 무기만 캐물을 수 있다
            tiers.add(option -> option.exact() && roomIs(sheet, option.location(), BeliefKind.MINE));
            tiers.add(option -> option.exact() && roomIs(sheet, option.location(), BeliefKind.ENVELOPE));
            tiers.add(option -> roomIs(sheet, option.location(), BeliefKind.MINE)
                    || roomIs(sheet, option.location(), BeliefKind.ENVELOPE));
        }
        if (!sheet.categorySolved(CardCategory.ROOM)) {
            tiers.add(option -> option.exact() && roomIs(sheet, option.location(), BeliefKind.UNKNOWN));
            tiers.add(option -> roomIs(sheet, option.location(), BeliefKind.UNKNOWN));
        }

        for (Predicate<MovementOption> tier : tiers) {
            List<Location> matched = candidates.stream().filter(tier).map(MovementOption::location).toList();
            if (!matched.isEmpty()) {
                return random.pick(matched);
            }
        }
        return random.pick(candidates.stream().map(MovementOption::location).toList());
    }

    /**
     * 현재 방에서 할 추리를 만듭니다. 방은 현재 위치로 고정됩니다.
     */
    public CardTriple decideGuess(KnowledgeSheet sheet, Location currentRoom) {
        if (!currentRoom.isRoom() || !sheet.universe().contains(Card.room(currentRoom.name()))) {
            throw ErrorCode.NOT_IN_ROOM.commonException(currentRoom.name());
        }
        CardTriple guess = new CardTriple(
                chooseGuessCard(sheet, CardCategory.SUSPECT),
                chooseGuessCard(sheet, CardCategory.WEAPON),
                Card.room(currentRoom.name()));
        log.debug("[추리] 추리 결정: {}", guess);
        return guess;
    }

    /**
     * 시트의 봉투 카드로 고발합니다. 모든 카테고리가 풀려 있어야 합니다.
     */
    public CardTriple decideAccusation(KnowledgeSheet sheet) {
        return sheet.solutionGuess().toTriple();
    }

    /**
     * 다른 플레이어의 추리에 보여줄 카드를 고릅니다.
     * 여러 장이면 아직 asker에게 보여주지 않은 카드를 우선합니다.
     */
    public Optional<Card> decideReveal(KnowledgeSheet sheet, CardTriple guess, String asker) {
        List<Card> matches = guess.cards().stream()
                .filter(card -> sheet.is(card, BeliefKind.MINE))
                .toList();
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        List<Card> fresh = matches.stream()
                .filter(card -> !((Belief.Mine) sheet.belief(card)).wasShownTo(asker))
                .toList();
        return Optional.of(random.pick(fresh.isEmpty() ? matches : fresh));
    }

    private Card chooseGuessCard(KnowledgeSheet sheet, CardCategory category) {
        if (sheet.categorySolved(category)) {
            List<Card> mine = sheet.cardsWith(category, BeliefKind.MINE);
            if (!mine.isEmpty()) {
                return random.pick(mine);
            }
            return sheet.cardsWith(category, BeliefKind.ENVELOPE).get(0);
        }
        return random.pick(sheet.cardsWith(category, BeliefKind.UNKNOWN));
    }

    private List<Move> passagesTo(KnowledgeSheet sheet, List<Move> passages, BeliefKind kind) {
        return passages.stream()
                .filter(move -> roomIs(sheet, move.destination(), kind))
                .toList();
    }

    // 고발 방처럼 카드가 없는 방은 어떤 믿음에도 해당하지 않는다
    private boolean roomIs(KnowledgeSheet sheet, Location location, BeliefKind kind) {
        if (!location.isRoom()) {
            return false;
        }
        Card room = Card.room(location.name());
        return sheet.universe().contains(room) && sheet.is(room, kind);
    }
}
