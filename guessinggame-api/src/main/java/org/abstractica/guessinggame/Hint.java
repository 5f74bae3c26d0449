package org.abstractica.guessinggame;

/**
 * Direction in which the next guess should move from an incorrect guess.
 */
public enum Hint
{
    /**
     * The secret number is higher than the guess.
     */
    HIGHER,

    /**
     * The secret number is lower than the guess.
     */
    LOWER
}
