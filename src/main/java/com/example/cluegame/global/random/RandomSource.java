package com.example.cluegame.global.random;

import com.example.cluegame.global.error.ErrorCode;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 주사위와 AI 동점 처리에 쓰이는 유일한 난수원.
 * 테스트에서는 시드를 고정하거나 값을 스크립트로 주입한다.
 */
public interface RandomSource {
    int nextIntInclusive(int minInclusive, int maxInclusive);

    default <T> T pick(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw ErrorCode.EMPTY_CANDIDATES.commonException();
        }
        return candidates.get(nextIntInclusive(0, candidates.size() - 1));
    }

    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            Collections.swap(list, i, nextIntInclusive(0, i));
        }
    }

    static RandomSource threadLocal() {
        return (minInclusive, maxInclusive) -> {
            if (maxInclusive < minInclusive) {
                throw new IllegalArgumentException("maxInclusive must be >= minInclusive");
            }
            return ThreadLocalRandom.current().nextInt(minInclusive, maxInclusive + 1);
        };
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return (minInclusive, maxInclusive) -> {
            if (maxInclusive < minInclusive) {
                throw new IllegalArgumentException("maxInclusive must be >= minInclusive");
            }
            return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
        };
    }
}
