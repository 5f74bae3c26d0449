package org.abstractica.guessinggame.handlers;

import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.Response;

/**
 * Handles exceptions thrown by response handlers.
 *
 * <p>When a response handler throws, the host catches the exception and
 * invokes this handler. The session keeps its new state and goes on with
 * the next queued request.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a response handler.
     *
     * @param session   the session whose response was being delivered
     * @param response  the response that was being delivered
     * @param exception the exception thrown by the handler
     */
    void handle(GameSession session, Response response, Exception exception);
}
