package com.example.cluegame.game.view;

import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;

import java.util.List;

/**
 * 사람 플레이어 입력. 호출은 입력이 들어올 때까지 블록된다.
 */
public interface PlayerPrompt {

    Move promptMove(GamePlayerState player, List<Move> options);

    Location promptMovement(GamePlayerState player, List<MovementOption> options);

    CardTriple promptGuess(GamePlayerState player, Card room);

    CardTriple promptAccusation(GamePlayerState player);

    Card promptReveal(GamePlayerState player, List<Card> matches, String asker);

    String promptFilename();
}
