package com.example.cluegame.game.domain;

import com.example.cluegame.global.error.ErrorCode;

/**
 * 현재 플레이어와 다음 플레이어 조회 결과.
 * FOUND가 아니면 current/next는 null이다.
 */
public record TurnLookup(LookupStatus status, GamePlayerState current, GamePlayerState next, String playerId) {

    public static TurnLookup found(GamePlayerState current, GamePlayerState next) {
        return new TurnLookup(LookupStatus.FOUND, current, next, current.getSuspect());
    }

    public static TurnLookup emptyRing(String playerId) {
        return new TurnLookup(LookupStatus.EMPTY_RING, null, null, playerId);
    }

    public static TurnLookup notFound(String playerId) {
        return new TurnLookup(LookupStatus.NOT_FOUND, null, null, playerId);
    }

    public boolean isFound() {
        return status == LookupStatus.FOUND;
    }

    /**
     * 조회 실패는 복구할 수 없는 오류로 올린다.
     */
    public TurnLookup orElseThrow() {
        return switch (status) {
            case FOUND -> this;
            case EMPTY_RING -> throw ErrorCode.EMPTY_RING.commonException();
            case NOT_FOUND -> throw ErrorCode.PLAYER_NOT_FOUND.commonException(playerId);
        };
    }
}
