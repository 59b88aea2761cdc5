package com.example.cluegame.game.definition;

import com.example.cluegame.game.board.GraphBoard;
import com.example.cluegame.game.domain.GameState;

public record LoadedGame(String name, GameState state, GraphBoard board) {
}
