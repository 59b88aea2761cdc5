package com.example.cluegame.game.domain;

import com.example.cluegame.game.domain.card.CardTriple;

import java.util.Objects;

/**
 * 게임 전체 상태. 턴 진행마다 새 인스턴스가 만들어진다.
 *
 * @param envelope 게임 시작 시 정해지는 정답
 */
public record GameState(Players players, PublicState publicState, CardTriple envelope) {
    public GameState {
        Objects.requireNonNull(players, "players");
        Objects.requireNonNull(publicState, "publicState");
        Objects.requireNonNull(envelope, "envelope");
    }

    public GameState withPlayer(GamePlayerState player) {
        return new GameState(players.replace(player), publicState, envelope);
    }

    public GameState advanceTo(String nextPlayerId) {
        return new GameState(players, publicState.withCurrentPlayer(nextPlayerId), envelope);
    }

    public TurnLookup lookupCurrent() {
        return players.lookup(publicState.currentPlayer());
    }

    public GamePlayerState currentPlayer() {
        return lookupCurrent().orElseThrow().current();
    }
}
