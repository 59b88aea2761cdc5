package com.example.cluegame.game.domain;

/**
 * 모든 플레이어가 볼 수 있는 공개 상태
 *
 * @param currentPlayer  현재 턴 플레이어 id
 * @param accusationRoom 최종 고발을 하는 방 이름
 * @param aiOnly         사람 플레이어가 모두 탈락해도 게임을 계속하는지 여부
 */
public record PublicState(String currentPlayer, String accusationRoom, boolean aiOnly) {

    public PublicState withCurrentPlayer(String playerId) {
        return new PublicState(playerId, accusationRoom, aiOnly);
    }
}
