package com.example.cluegame.game.view;

import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardCategory;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.global.error.CommonException;
import com.example.cluegame.global.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;

/**
 * 번호 선택 방식의 콘솔 입력. 잘못된 입력은 다시 묻는다.
 */
@Component
@Slf4j
public class ConsolePlayerPrompt implements PlayerPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    @Autowired
    public ConsolePlayerPrompt() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    }

    public ConsolePlayerPrompt(Reader in, PrintStream out) {
        this.in = new BufferedReader(in);
        this.out = out;
    }

    @Override
    public Move promptMove(GamePlayerState player, List<Move> options) {
        return choose("이동 방법을 고르세요", options,
                move -> move.isPassage() ? "비밀 통로 → " + move.destination().name() : "주사위 굴리기");
    }

    @Override
    public Location promptMovement(GamePlayerState player, List<MovementOption> options) {
        MovementOption chosen = choose("이동할 위치를 고르세요", options,
                option -> option.location().name() + (option.isRoom() ? " (방)" : ""));
        return chosen.location();
    }

    @Override
    public CardTriple promptGuess(GamePlayerState player, Card room) {
        Card suspect = choose("용의자를 고르세요", player.getSheet().cards(CardCategory.SUSPECT), Card::name);
        Card weapon = choose("흉기를 고르세요", player.getSheet().cards(CardCategory.WEAPON), Card::name);
        return new CardTriple(suspect, weapon, room);
    }

    @Override
    public CardTriple promptAccusation(GamePlayerState player) {
        out.println("최종 고발입니다. 틀리면 탈락합니다.");
        Card suspect = choose("용의자를 고르세요", player.getSheet().cards(CardCategory.SUSPECT), Card::name);
        Card weapon = choose("흉기를 고르세요", player.getSheet().cards(CardCategory.WEAPON), Card::name);
        Card room = choose("방을 고르세요", player.getSheet().cards(CardCategory.ROOM), Card::name);
        return new CardTriple(suspect, weapon, room);
    }

    @Override
    public Card promptReveal(GamePlayerState player, List<Card> matches, String asker) {
        return choose(asker + "님에게 보여줄 카드를 고르세요", matches, Card::name);
    }

    @Override
    public String promptFilename() {
        while (true) {
            out.print("게임 정의 파일 경로를 입력하세요: ");
            out.flush();
            String line = readLine();
            if (!line.isBlank()) {
                return line.trim();
            }
        }
    }

    private <T> T choose(String title, List<T> options, Function<T, String> label) {
        if (options.isEmpty()) {
            throw ErrorCode.EMPTY_CANDIDATES.commonException(title);
        }
        while (true) {
            out.println(title);
            for (int i = 0; i < options.size(); i++) {
                out.printf("  %d) %s%n", i + 1, label.apply(options.get(i)));
            }
            out.print("> ");
            out.flush();
            String line = readLine().trim();
            try {
                int choice = Integer.parseInt(line);
                if (choice >= 1 && choice <= options.size()) {
                    return options.get(choice - 1);
                }
            } catch (NumberFormatException e) {
                log.debug("[입력] 숫자가 아닌 입력: {}", line);
            }
            out.printf("1부터 %d 사이의 번호를 입력하세요.%n", options.size());
        }
    }

    private String readLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                throw ErrorCode.INPUT_CLOSED.commonException();
            }
            return line;
        } catch (IOException e) {
            throw new CommonException(ErrorCode.INPUT_CLOSED, e.getMessage(), e);
        }
    }
}
