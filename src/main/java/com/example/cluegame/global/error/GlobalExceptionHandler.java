package com.example.cluegame.global.error;

import com.example.cluegame.game.view.GameDisplay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * 게임 실행 중 올라온 예외를 로그, 화면 오류 메시지, 종료 코드로 변환
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler implements ExitCodeExceptionMapper {

    static final int COMMON_EXIT_CODE = 2;
    static final int UNHANDLED_EXIT_CODE = 1;

    private final GameDisplay display;

    public void handle(Exception e) {
        CommonException common = findCommonException(e);
        if (common != null) {
            handleCommonException(common);
        } else {
            handleException(e);
        }
    }

    public void handleCommonException(CommonException e) {
        log.error("CommonException: [{}] {}", e.getErrorCode().getCode(), e.getMessage());
        display.displayError(e.getMessage());
    }

    public void handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        display.displayError("Internal Error: " + e.getMessage());
    }

    @Override
    public int getExitCode(Throwable exception) {
        return findCommonException(exception) != null ? COMMON_EXIT_CODE : UNHANDLED_EXIT_CODE;
    }

    // 시작 실패는 IllegalStateException 등으로 감싸져 올라올 수 있음
    private CommonException findCommonException(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof CommonException common) {
                return common;
            }
            current = current.getCause();
        }
        return null;
    }
}
