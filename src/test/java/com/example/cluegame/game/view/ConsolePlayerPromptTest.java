package com.example.cluegame.game.view;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.CardTriple;
import com.example.cluegame.global.error.CommonException;
import com.example.cluegame.global.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.example.cluegame.support.TestCards.GREEN;
import static com.example.cluegame.support.TestCards.HALL;
import static com.example.cluegame.support.TestCards.KNIFE;
import static com.example.cluegame.support.TestCards.PIPE;
import static com.example.cluegame.support.TestCards.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsolePlayerPromptTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final GamePlayerState me = player("Red", AgentType.HUMAN, Location.room("Hall"));

    private ConsolePlayerPrompt prompt(String input) {
        return new ConsolePlayerPrompt(new StringReader(input), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("번호로 고르고, 숫자가 아니거나 범위를 벗어난 입력은 다시 묻는다")
    void repromptsOnInvalidInput() {
        List<Move> options = List.of(Move.roll(), Move.passage(Location.room("Kitchen")));

        Move move = prompt("abc\n7\n2\n").promptMove(me, options);

        assertThat(move).isEqualTo(Move.passage(Location.room("Kitchen")));
        assertThat(output()).contains("1부터 2 사이의 번호를 입력하세요.");
    }

    @Test
    @DisplayName("이동 위치 선택")
    void promptMovement() {
        List<MovementOption> options = List.of(
                new MovementOption(Location.space("s1"), true),
                new MovementOption(Location.room("Library"), false));

        assertThat(prompt("2\n").promptMovement(me, options)).isEqualTo(Location.room("Library"));
        assertThat(output()).contains("Library (방)");
    }

    @Test
    @DisplayName("고발은 용의자, 흉기, 방 순서로 고른다")
    void promptAccusation() {
        // 시트 순서: Red, Blue, Green / Knife, Rope, Pipe / Library, Kitchen, Hall
        CardTriple accusation = prompt("3\n3\n3\n").promptAccusation(me);

        assertThat(accusation).isEqualTo(new CardTriple(GREEN, PIPE, HALL));
    }

    @Test
    @DisplayName("추리의 방은 묻지 않는다")
    void promptGuess() {
        CardTriple guess = prompt("3\n1\n").promptGuess(me, HALL);

        assertThat(guess).isEqualTo(new CardTriple(GREEN, KNIFE, HALL));
    }

    @Test
    @DisplayName("빈 줄은 무시하고 파일 경로를 받는다")
    void promptFilename() {
        assertThat(prompt("\n  games/custom.json \n").promptFilename()).isEqualTo("games/custom.json");
    }

    @Test
    @DisplayName("입력이 끝나면 INPUT_CLOSED")
    void inputClosed() {
        assertThatThrownBy(() -> prompt("").promptMove(me, List.of(Move.roll(), Move.roll())))
                .isInstanceOf(CommonException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INPUT_CLOSED);
    }
}
