package org.abstractica.guessinggame;

/**
 * Thrown when a game session cannot be constructed.
 *
 * <p>Construction either succeeds fully or produces no session; a failed
 * attempt is never registered with the host.</p>
 */
public class GameCreationException extends RuntimeException
{
    public GameCreationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
