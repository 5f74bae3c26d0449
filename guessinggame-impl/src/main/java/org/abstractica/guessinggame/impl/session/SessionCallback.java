package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.handlers.ErrorHandler;

/**
 * Callback interface from session to host.
 *
 * <p>Used by DefaultGameSession to report lifecycle events and to reach
 * host-wide settings.</p>
 */
public interface SessionCallback
{
    /**
     * Notifies that a session has been stopped.
     *
     * @param session the stopped session
     */
    void onSessionStopped(DefaultGameSession session);

    /**
     * Notifies that a game has been won.
     *
     * @param session the session of the won game
     * @param won     the response sent to the winner
     */
    void onGameWon(DefaultGameSession session, Response.Won won);

    /**
     * Gets the error handler for response handler exceptions.
     *
     * @return the error handler, or null if none set
     */
    ErrorHandler getErrorHandler();
}
