package org.abstractica.guessinggame.impl.fsm;

/**
 * State of a guessing game.
 */
public enum GameState
{
    /**
     * No player has joined yet.
     */
    NEW_GAME,

    /**
     * One player has joined; waiting for the second.
     */
    WAITING_FOR_SECOND_PLAYER,

    /**
     * Both players have joined and are taking turns.
     */
    PLAYING,

    /**
     * The secret number has been found. Terminal.
     */
    OVER
}
