package com.example.cluegame.game.runner;

import com.example.cluegame.game.definition.GameDefinitionLoader;
import com.example.cluegame.game.definition.LoadedGame;
import com.example.cluegame.game.domain.GameOutcome;
import com.example.cluegame.game.turn.TurnController;
import com.example.cluegame.game.view.PlayerPrompt;
import com.example.cluegame.global.config.GameProperties;
import com.example.cluegame.global.error.GlobalExceptionHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 애플리케이션 시작 시 게임 정의를 읽어 한 판을 끝까지 진행한다.
 * 정의 파일 위치: 첫 번째 인자 > clue.game.definition > 콘솔 입력
 * 실패는 GlobalExceptionHandler가 한 번만 보고하고, 종료 코드는 SpringApplication.exit로 전달된다.
 */
@Component
@ConditionalOnProperty(prefix = "clue.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GameRunner implements ApplicationRunner, ExitCodeGenerator {

    private final GameDefinitionLoader loader;
    private final TurnController turnController;
    private final PlayerPrompt prompt;
    private final GameProperties properties;
    private final GlobalExceptionHandler exceptionHandler;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        try {
            String definition = resolveDefinition(args);
            LoadedGame game = loader.importGame(definition);
            log.info("▶ 게임 시작: {}", game.name());
            GameOutcome outcome = turnController.run(game.state(), game.board());
            log.info("▶ 게임 종료: result={}, winner={}, turns={}",
                    outcome.result(), outcome.winner().orElse("-"), outcome.turns());
        } catch (Exception e) {
            exceptionHandler.handle(e);
            exitCode = exceptionHandler.getExitCode(e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    String resolveDefinition(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (!positional.isEmpty()) {
            return positional.get(0);
        }
        if (properties.definition() != null && !properties.definition().isBlank()) {
            return properties.definition();
        }
        return prompt.promptFilename();
    }
}
