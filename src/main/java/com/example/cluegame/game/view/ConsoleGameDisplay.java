package com.example.cluegame.game.view;

import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.game.domain.sheet.Belief;
import com.example.cluegame.game.domain.sheet.BeliefKind;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;
import java.util.Optional;

/**
 * 표준 출력 기반 게임 화면
 */
@Component
public class ConsoleGameDisplay implements GameDisplay {

    private final PrintStream out;

    @Autowired
    public ConsoleGameDisplay() {
        this(System.out);
    }

    public ConsoleGameDisplay(PrintStream out) {
        this.out = out;
    }

    @Override
    public void printTurn(PublicState publicState, GamePlayerState player) {
        out.println();
        out.printf("===== %s님의 턴 (%s) =====%n", player.getSuspect(), player.getLocation());
    }

    @Override
    public void printMove(GamePlayerState player, Move move) {
        if (move.isPassage()) {
            out.printf("%s님이 비밀 통로로 %s에 이동합니다.%n", player.getSuspect(), move.destination());
        } else {
            out.printf("%s님이 주사위를 굴립니다.%n", player.getSuspect());
        }
    }

    @Override
    public void printDiceRoll(GamePlayerState player, int roll) {
        out.printf("주사위 결과: %d%n", roll);
    }

    @Override
    public void printMovement(GamePlayerState player, Location location) {
        if (location.isRoom()) {
            out.printf("%s님이 %s에 들어갔습니다.%n", player.getSuspect(), location.name());
        } else {
            out.printf("%s님이 %s 칸에 도착했습니다.%n", player.getSuspect(), location.name());
        }
    }

    @Override
    public void printGuess(GamePlayerState player, CardTriple guess) {
        out.printf("%s님의 추리: %s%n", player.getSuspect(), guess);
    }

    @Override
    public void printAccusation(GamePlayerState player, CardTriple accusation) {
        out.printf("%s님의 최종 고발: %s%n", player.getSuspect(), accusation);
    }

    @Override
    public void printReveal(GamePlayerState guesser, Optional<String> revealer, Optional<Card> card) {
        if (revealer.isEmpty()) {
            out.println("아무도 반박하지 못했습니다.");
            return;
        }
        if (guesser.isHuman() && card.isPresent()) {
            out.printf("%s님이 %s님에게 [%s] 카드를 보여주었습니다.%n",
                    revealer.get(), guesser.getSuspect(), card.get().name());
        } else {
            out.printf("%s님이 %s님에게 카드를 보여주었습니다.%n", revealer.get(), guesser.getSuspect());
        }
    }

    @Override
    public void printSheet(GamePlayerState player) {
        KnowledgeSheet sheet = player.getSheet();
        out.printf("--- %s님의 추리 시트 ---%n", player.getSuspect());
        for (CardCategory category : CardCategory.values()) {
            out.printf("[%s]%n", category);
            for (Card card : sheet.cards(category)) {
                out.printf("  %-16s %s%n", card.name(), describe(sheet.belief(card)));
            }
        }
        Map<BeliefKind, Long> counts = sheet.countByKind();
        out.printf("미확인 %d장, 봉투 추정 %d장%n",
                counts.getOrDefault(BeliefKind.UNKNOWN, 0L),
                counts.getOrDefault(BeliefKind.ENVELOPE, 0L));
    }

    @Override
    public void displayMessage(String message) {
        out.println(message);
    }

    @Override
    public void displayError(String message) {
        out.println("[오류] " + message);
    }

    @Override
    public void displayVictory(String winner, CardTriple envelope) {
        out.println();
        out.printf("*** %s님이 사건을 해결했습니다! 정답: %s ***%n", winner, envelope);
    }

    private String describe(Belief belief) {
        return switch (belief.kind()) {
            case UNKNOWN -> "?";
            case MINE -> {
                Belief.Mine mine = (Belief.Mine) belief;
                yield mine.shownTo().isEmpty() ? "내 카드" : "내 카드 (보여줌: " + String.join(", ", mine.shownTo()) + ")";
            }
            case ENVELOPE -> "봉투";
            case SHOWN_BY -> "보유: " + ((Belief.ShownBy) belief).playerId();
        };
    }
}
