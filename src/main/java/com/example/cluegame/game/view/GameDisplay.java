package com.example.cluegame.game.view;

import com.example.cluegame.game.domain.GamePlayerState;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.card.Card;
import com.example.cluegame.game.domain.card.CardTriple;

import java.util.Optional;

/**
 * 게임 진행 출력. 상태를 돌려주지 않는 순수 표시 계층.
 */
public interface GameDisplay {

    /**
     * 누구의 턴인지 출력
     */
    void printTurn(PublicState publicState, GamePlayerState player);

    void printMove(GamePlayerState player, Move move);

    void printDiceRoll(GamePlayerState player, int roll);

    void printMovement(GamePlayerState player, Location location);

    void printGuess(GamePlayerState player, CardTriple guess);

    void printAccusation(GamePlayerState player, CardTriple accusation);

    /**
     * 추리 결과 출력. 카드 내용은 추리자가 사람일 때만 보여준다.
     */
    void printReveal(GamePlayerState guesser, Optional<String> revealer, Optional<Card> card);

    void printSheet(GamePlayerState player);

    void displayMessage(String message);

    void displayError(String message);

    void displayVictory(String winner, CardTriple envelope);
}
