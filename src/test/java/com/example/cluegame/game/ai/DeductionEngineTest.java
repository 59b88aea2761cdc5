package com.example.cluegame.game.ai;

import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;
import com.example.cluegame.global.error.CommonException;
import com.example.cluegame.global.error.ErrorCode;
import com.example.cluegame.global.random.RandomSource;
import com.example.cluegame.support.ScriptedRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.example.cluegame.support.TestCards.ACCUSATION_ROOM;
import static com.example.cluegame.support.TestCards.BLUE;
import static com.example.cluegame.support.TestCards.CELLAR;
import static com.example.cluegame.support.TestCards.GREEN;
import static com.example.cluegame.support.TestCards.HALL;
import static com.example.cluegame.support.TestCards.KITCHEN;
import static com.example.cluegame.support.TestCards.KNIFE;
import static com.example.cluegame.support.TestCards.LIBRARY;
import static com.example.cluegame.support.TestCards.PIPE;
import static com.example.cluegame.support.TestCards.RED;
import static com.example.cluegame.support.TestCards.ROPE;
import static com.example.cluegame.support.TestCards.sheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeductionEngineTest {

    private static final PublicState PUBLIC = new PublicState("Red", ACCUSATION_ROOM, false);

    private static final Location LIBRARY_ROOM = Location.room("Library");
    private static final Location KITCHEN_ROOM = Location.room("Kitchen");
    private static final Location HALL_ROOM = Location.room("Hall");
    private static final Location S1 = Location.space("s1");

    private final DeductionEngine engine = new DeductionEngine(new ScriptedRandomSource());

    // Hall은 내 카드, Kitchen/Library는 모름
    private static KnowledgeSheet roomUnsolved() {
        return sheet(RED, HALL);
    }

    // Library가 봉투로 확정, Hall은 내 카드, Kitchen은 모름
    private static KnowledgeSheet roomSolved() {
        return sheet(RED, KNIFE, HALL).markNoDisprove(new CardTriple(RED, KNIFE, LIBRARY));
    }

    @Nested
    @DisplayName("decideMove")
    class DecideMove {

        @Test
        @DisplayName("방 미해결: 내 방으로 가는 통로를 탄다")
        void unsolvedPrefersMinePassage() {
            List<Move> options = List.of(Move.roll(), Move.passage(KITCHEN_ROOM), Move.passage(HALL_ROOM));

            assertThat(engine.decideMove(roomUnsolved(), options)).isEqualTo(Move.passage(HALL_ROOM));
        }

        @Test
        @DisplayName("방 미해결: 내 방이나 봉투 방으로 가는 통로가 없으면 주사위")
        void unsolvedRollsOtherwise() {
            List<Move> options = List.of(Move.roll(), Move.passage(KITCHEN_ROOM), Move.passage(CELLAR));

            assertThat(engine.decideMove(roomUnsolved(), options)).isEqualTo(Move.roll());
        }

        @Test
        @DisplayName("방 해결: 아직 모르는 방으로 가는 통로를 탄다")
        void solvedPrefersUnknownPassage() {
            List<Move> options = List.of(Move.roll(), Move.passage(HALL_ROOM), Move.passage(KITCHEN_ROOM));

            assertThat(engine.decideMove(roomSolved(), options)).isEqualTo(Move.passage(KITCHEN_ROOM));
        }

        @Test
        @DisplayName("방 해결: 모르는 방으로 가는 통로가 없으면 주사위")
        void solvedRollsOtherwise() {
            List<Move> options = List.of(Move.roll(), Move.passage(HALL_ROOM), Move.passage(LIBRARY_ROOM));

            assertThat(engine.decideMove(roomSolved(), options)).isEqualTo(Move.roll());
        }
    }

    @Nested
    @DisplayName("decideMovement")
    class DecideMovement {

        @Test
        @DisplayName("세 카테고리가 모두 풀리면 고발 방으로 간다")
        void allSolvedGoesToAccusationRoom() {
            KnowledgeSheet solved = sheet(RED, KNIFE, HALL).markNoDisprove(new CardTriple(GREEN, PIPE, LIBRARY));
            List<MovementOption> options = List.of(
                    new MovementOption(S1, true),
                    new MovementOption(KITCHEN_ROOM, true),
                    new MovementOption(CELLAR, false));

            assertThat(engine.decideMovement(solved, PUBLIC, options)).isEqualTo(CELLAR);
        }

        @Test
        @DisplayName("모두 풀렸는데 고발 방에 갈 수 없으면 치명적 오류")
        void allSolvedWithoutAccusationRoom() {
            KnowledgeSheet solved = sheet(RED, KNIFE, HALL).markNoDisprove(new CardTriple(GREEN, PIPE, LIBRARY));
            List<MovementOption> options = List.of(new MovementOption(S1, true));

            assertThatThrownBy(() -> engine.decideMovement(solved, PUBLIC, options))
                    .isInstanceOf(CommonException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ACCUSATION_ROOM_NOT_FOUND);
        }

        @Test
        @DisplayName("방 미해결이라도 주사위 눈이 딱 맞는 내 방을 먼저 고른다")
        void unsolvedPrefersExactMineRoom() {
            List<MovementOption> options = List.of(
                    new MovementOption(CELLAR, true),
                    new MovementOption(HALL_ROOM, true),
                    new MovementOption(KITCHEN_ROOM, false),
                    new MovementOption(LIBRARY_ROOM, true),
                    new MovementOption(S1, true));

            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, options)).isEqualTo(HALL_ROOM);
        }

        @Test
        @DisplayName("방 미해결: 내 방이 딱 맞지 않아도 모르는 방보다 우선")
        void unsolvedPrefersLooseMineOverExactUnknown() {
            List<MovementOption> options = List.of(
                    new MovementOption(HALL_ROOM, false),
                    new MovementOption(LIBRARY_ROOM, true));

            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, options)).isEqualTo(HALL_ROOM);
        }

        @Test
        @DisplayName("방 미해결: 내 방이 없으면 딱 맞는 모르는 방, 그다음 닿을 수 있는 모르는 방")
        void unsolvedFallsBackToUnknownRooms() {
            List<MovementOption> exact = List.of(
                    new MovementOption(S1, true),
                    new MovementOption(KITCHEN_ROOM, false),
                    new MovementOption(LIBRARY_ROOM, true));
            List<MovementOption> loose = List.of(
                    new MovementOption(S1, true),
                    new MovementOption(KITCHEN_ROOM, false));

            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, exact)).isEqualTo(LIBRARY_ROOM);
            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, loose)).isEqualTo(KITCHEN_ROOM);
        }

        @Test
        @DisplayName("용의자와 무기만 풀렸으면 내 방 대신 모르는 방으로 간다")
        void onlyRoomUnsolvedSkipsMineRooms() {
            KnowledgeSheet onlyRoomLeft = sheet(RED, KNIFE, HALL).markNoDisprove(new CardTriple(GREEN, PIPE, HALL));
            List<MovementOption> options = List.of(
                    new MovementOption(HALL_ROOM, true),
                    new MovementOption(LIBRARY_ROOM, false),
                    new MovementOption(S1, true));

            assertThat(engine.decideMovement(onlyRoomLeft, PUBLIC, options)).isEqualTo(LIBRARY_ROOM);
        }

        @Test
        @DisplayName("방 해결: 딱 맞는 봉투 방이 딱 맞지 않는 내 방보다 우선")
        void solvedPrefersExactEnvelopeOverLooseMine() {
            List<MovementOption> options = List.of(
                    new MovementOption(HALL_ROOM, false),
                    new MovementOption(KITCHEN_ROOM, true),
                    new MovementOption(LIBRARY_ROOM, true));

            assertThat(engine.decideMovement(roomSolved(), PUBLIC, options)).isEqualTo(LIBRARY_ROOM);
        }

        @Test
        @DisplayName("방 해결: 딱 맞는 방이 없으면 닿을 수 있는 내 방이나 봉투 방")
        void solvedFallsBackToReachableMineRoom() {
            List<MovementOption> options = List.of(
                    new MovementOption(S1, true),
                    new MovementOption(KITCHEN_ROOM, true),
                    new MovementOption(HALL_ROOM, false));

            assertThat(engine.decideMovement(roomSolved(), PUBLIC, options)).isEqualTo(HALL_ROOM);
        }

        @Test
        @DisplayName("갈 만한 방이 없으면 고발 방을 뺀 아무 곳이나")
        void fallsBackToAnyNonAccusationOption() {
            List<MovementOption> options = List.of(
                    new MovementOption(CELLAR, true),
                    new MovementOption(S1, true));

            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, options)).isEqualTo(S1);
        }

        @Test
        @DisplayName("고발 방 말고는 제자리뿐이면 제자리에 머문다")
        void staysPutWhenOnlyAccusationRoomIsReachable() {
            List<MovementOption> options = List.of(
                    new MovementOption(CELLAR, false),
                    new MovementOption(S1, false));

            assertThat(engine.decideMovement(roomUnsolved(), PUBLIC, options)).isEqualTo(S1);
        }
    }

    @Nested
    @DisplayName("decideGuess")
    class DecideGuess {

        @Test
        @DisplayName("미해결 카테고리는 모르는 카드, 방은 현재 위치")
        void unsolvedUsesUnknownCards() {
            KnowledgeSheet sheet = sheet(RED, KNIFE).recordShown(BLUE, "Blue");

            CardTriple guess = engine.decideGuess(sheet, KITCHEN_ROOM);

            assertThat(guess).isEqualTo(new CardTriple(GREEN, ROPE, KITCHEN));
        }

        @Test
        @DisplayName("해결된 카테고리는 봉투 카드보다 내 카드를 우선")
        void solvedPrefersMineCard() {
            KnowledgeSheet sheet = sheet(RED, KNIFE).markNoDisprove(new CardTriple(GREEN, PIPE, HALL));

            CardTriple guess = engine.decideGuess(sheet, LIBRARY_ROOM);

            assertThat(guess.suspect()).isEqualTo(RED);
            assertThat(guess.weapon()).isEqualTo(KNIFE);
            assertThat(guess.room()).isEqualTo(LIBRARY);
        }

        @Test
        @DisplayName("해결됐는데 내 카드가 없으면 봉투 카드")
        void solvedWithoutMineUsesEnvelopeCard() {
            KnowledgeSheet sheet = sheet(HALL).markNoDisprove(new CardTriple(GREEN, PIPE, HALL));

            CardTriple guess = engine.decideGuess(sheet, LIBRARY_ROOM);

            assertThat(guess.suspect()).isEqualTo(GREEN);
            assertThat(guess.weapon()).isEqualTo(PIPE);
        }

        @Test
        @DisplayName("방이 아닌 곳이나 고발 방에서는 추리할 수 없다")
        void requiresCardRoom() {
            assertThatThrownBy(() -> engine.decideGuess(roomUnsolved(), S1))
                    .isInstanceOf(CommonException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_IN_ROOM);
            assertThatThrownBy(() -> engine.decideGuess(roomUnsolved(), CELLAR))
                    .isInstanceOf(CommonException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_IN_ROOM);
        }
    }

    @Nested
    @DisplayName("decideAccusation")
    class DecideAccusation {

        @Test
        @DisplayName("시트의 봉투 카드로 고발한다")
        void accusesEnvelope() {
            KnowledgeSheet solved = sheet(RED).markNoDisprove(new CardTriple(BLUE, ROPE, HALL));

            assertThat(engine.decideAccusation(solved)).isEqualTo(new CardTriple(BLUE, ROPE, HALL));
        }

        @Test
        @DisplayName("풀리지 않은 카테고리가 있으면 치명적 오류")
        void unresolvedCategory() {
            KnowledgeSheet partial = sheet(RED, ROPE).markNoDisprove(new CardTriple(BLUE, ROPE, HALL));

            assertThatThrownBy(() -> engine.decideAccusation(partial))
                    .isInstanceOf(CommonException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CATEGORY_UNRESOLVED);
        }
    }

    @Nested
    @DisplayName("decideReveal")
    class DecideReveal {

        private final CardTriple guess = new CardTriple(RED, KNIFE, LIBRARY);

        @Test
        @DisplayName("겹치는 내 카드가 없으면 보여주지 않는다")
        void nothingToShow() {
            assertThat(engine.decideReveal(sheet(BLUE, ROPE), guess, "Green")).isEmpty();
        }

        @Test
        @DisplayName("한 장이면 그 카드를 보여준다")
        void singleMatch() {
            assertThat(engine.decideReveal(sheet(BLUE, KNIFE), guess, "Green")).contains(KNIFE);
        }

        @Test
        @DisplayName("여러 장이면 아직 asker에게 보여주지 않은 카드를 우선")
        void prefersFreshCard() {
            KnowledgeSheet sheet = sheet(RED, KNIFE, LIBRARY)
                    .noteShownTo(RED, "Green")
                    .noteShownTo(KNIFE, "Green");

            assertThat(engine.decideReveal(sheet, guess, "Green")).contains(LIBRARY);
        }

        @Test
        @DisplayName("모두 이미 보여줬다면 겹치는 카드 중 무작위")
        void allShownPicksAmongMatches() {
            KnowledgeSheet sheet = sheet(RED, KNIFE)
                    .noteShownTo(RED, "Green")
                    .noteShownTo(KNIFE, "Green");
            DeductionEngine seeded = new DeductionEngine(RandomSource.seeded(11L));

            Set<Card> shown = new HashSet<>();
            for (int i = 0; i < 200; i++) {
                Optional<Card> card = seeded.decideReveal(sheet, guess, "Green");
                card.ifPresent(shown::add);
            }

            assertThat(shown).containsExactlyInAnyOrder(RED, KNIFE);
        }
    }
}
