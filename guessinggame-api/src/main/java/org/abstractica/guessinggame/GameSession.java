package org.abstractica.guessinggame;

import org.abstractica.guessinggame.handlers.ResponseHandler;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One two-player guessing game.
 *
 * <p>A session processes its requests strictly one at a time, in the order
 * they arrive. Each request yields zero or more responses, which go only to
 * the caller that made the request; the other player is never notified.</p>
 */
public interface GameSession
{
    /**
     * Returns the game id.
     *
     * @return game id, unique within the process
     */
    int getId();

    /**
     * Sends a request and waits for its responses.
     *
     * <p>If the waiting thread is interrupted, a request that has not been
     * taken from the queue yet is withdrawn. One already taken is still
     * applied to the game.</p>
     *
     * @param request the request
     * @return the responses, in the order they were produced
     * @throws IllegalStateException if the session has been stopped, if the
     *         wait is interrupted, or if called while the session is
     *         delivering responses (use {@link #submit} there)
     */
    List<Response> send(Request request);

    /**
     * Queues a request without waiting.
     *
     * <p>The responses are passed to {@code replyTo}, one at a time and in
     * order, once the request has been processed.</p>
     *
     * @param request the request
     * @param replyTo receives the responses to this request only
     * @return a future completed with all responses, or cancelled if the
     *         session is stopped before the request is processed
     * @throws IllegalStateException if the session has been stopped
     */
    CompletableFuture<List<Response>> submit(Request request, ResponseHandler replyTo);

    /**
     * Stops the session.
     *
     * <p>Requests still queued are cancelled. Calling this more than once
     * has no further effect.</p>
     */
    void stop();

    /**
     * Returns whether the session has been stopped.
     *
     * @return true once {@link #stop()} has been called
     */
    boolean isStopped();
}
