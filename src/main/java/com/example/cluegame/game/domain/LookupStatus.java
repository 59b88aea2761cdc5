package com.example.cluegame.game.domain;

public enum LookupStatus {
    FOUND,
    EMPTY_RING,
    NOT_FOUND
}
