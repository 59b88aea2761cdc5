package com.example.cluegame.game.domain.sheet;

public enum BeliefKind {
    UNKNOWN, // 아직 모름
    MINE, // 내 손패
    ENVELOPE, // 봉투(정답)로 추정
    SHOWN_BY // 다른 플레이어가 보여줌
}
