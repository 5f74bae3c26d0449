package org.abstractica.guessinggame;

import java.util.Objects;

/**
 * Requests sent by a player to a game session.
 *
 * <p>Requests are immutable values with no identity beyond their fields.
 * Neither the player name nor the guessed value is validated: any string
 * and any integer are accepted.</p>
 */
public sealed interface Request permits
        Request.Introduce,
        Request.Guess
{
    /**
     * Returns the name of the player making the request.
     *
     * @return the player name
     */
    String playerName();

    /**
     * Introduces a player to the game.
     *
     * @param playerName the player name
     */
    record Introduce(String playerName) implements Request
    {
        public Introduce
        {
            Objects.requireNonNull(playerName, "playerName");
        }
    }

    /**
     * Attempts to guess the secret number.
     *
     * @param playerName the name of the player making the guess
     * @param value      the guessed value
     */
    record Guess(String playerName, int value) implements Request
    {
        public Guess
        {
            Objects.requireNonNull(playerName, "playerName");
        }
    }
}
