package org.abstractica.guessinggame.handlers;

import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.Response;

/**
 * Receives the responses to a request submitted asynchronously.
 *
 * <p>Only the handler passed along with a request receives its responses.
 * Responses are delivered one at a time, in order, on the thread that
 * processes the session's requests. A handler may {@code submit} further
 * requests to the same session but must not {@code send} to it.</p>
 */
@FunctionalInterface
public interface ResponseHandler
{
    /**
     * Handles one response.
     *
     * @param session  the session that produced the response
     * @param response the response
     */
    void handle(GameSession session, Response response);
}
