package org.abstractica.guessinggame;

/**
 * Draws the secret number for a new game.
 *
 * <p>Called exactly once per session, while the session is constructed.
 * An exception thrown here aborts the construction.</p>
 */
@FunctionalInterface
public interface SecretNumberGenerator
{
    /**
     * Draws a secret number.
     *
     * @return the secret number
     */
    int generate();
}
