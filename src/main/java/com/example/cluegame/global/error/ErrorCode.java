package com.example.cluegame.global.error;

import lombok.Getter;

@Getter
public enum ErrorCode {
    EMPTY_RING("EMPTY_RING", "No players in game"),
    PLAYER_NOT_FOUND("PLAYER_NOT_FOUND", "No player with suspect name"),
    CATEGORY_UNRESOLVED("CATEGORY_UNRESOLVED", "Card category is not resolved"),
    EMPTY_CANDIDATES("EMPTY_CANDIDATES", "Cannot choose from an empty candidate list"),
    BELIEF_CONTRADICTION("BELIEF_CONTRADICTION", "Belief transition contradicts the knowledge sheet"),
    CARD_NOT_IN_UNIVERSE("CARD_NOT_IN_UNIVERSE", "Card is not part of this game"),
    ACCUSATION_ROOM_NOT_FOUND("ACCUSATION_ROOM_NOT_FOUND", "Can't find accusation room"),
    NOT_IN_ROOM("NOT_IN_ROOM", "Trying to guess from a location that is not a room"),
    INVALID_GAME_DEFINITION("INVALID_GAME_DEFINITION", "Invalid game definition"),
    GAME_DEFINITION_LOAD_FAILED("GAME_DEFINITION_LOAD_FAILED", "Game definition could not be loaded"),
    INPUT_CLOSED("INPUT_CLOSED", "Input stream closed while waiting for a choice"),
    ;
    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}
