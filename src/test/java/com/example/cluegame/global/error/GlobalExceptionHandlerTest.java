package com.example.cluegame.global.error;

import com.example.cluegame.support.RecordingGameDisplay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final RecordingGameDisplay display = new RecordingGameDisplay();
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(display);

    @Test
    @DisplayName("감싸진 CommonException도 찾아서 오류 메시지와 종료 코드 2로 변환")
    void wrappedCommonException() {
        CommonException cause = ErrorCode.PLAYER_NOT_FOUND.commonException("Z");
        IllegalStateException wrapped = new IllegalStateException("Failed to execute ApplicationRunner", cause);

        handler.handle(wrapped);

        assertThat(display.events()).containsExactly("error:No player with suspect name: Z");
        assertThat(handler.getExitCode(wrapped)).isEqualTo(2);
    }

    @Test
    @DisplayName("그 밖의 예외는 내부 오류로 표시하고 종료 코드 1")
    void unexpectedException() {
        RuntimeException e = new RuntimeException("boom");

        handler.handle(e);

        assertThat(display.events()).containsExactly("error:Internal Error: boom");
        assertThat(handler.getExitCode(e)).isEqualTo(1);
    }
}
