package com.example.cluegame.global.config;

import com.example.cluegame.global.random.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GameProperties.class)
@Slf4j
public class GameConfig {

    @Bean
    public RandomSource randomSource(GameProperties properties) {
        if (properties.seed() != null) {
            log.info("[설정] 고정 시드 사용: seed={}", properties.seed());
            return RandomSource.seeded(properties.seed());
        }
        return RandomSource.threadLocal();
    }
}
