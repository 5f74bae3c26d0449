package org.abstractica.guessinggame;

import org.abstractica.guessinggame.handlers.ErrorHandler;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Creates, tracks and releases game sessions.
 *
 * <p>The host is the collaborator that delivers player requests to
 * sessions. It defines no transport; an application that puts games on a
 * network maps its own wire format onto {@link Request} and
 * {@link Response}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GameHost host = hostFactory.builder()
 *     .maxSecretNumber(10)
 *     .build();
 *
 * GameSession game = host.create();
 * host.send(game, new Request.Introduce("Bo"));
 * host.send(game, new Request.Introduce("Fee"));
 * List<Response> responses = host.send(game, new Request.Guess("Fee", 5));
 * }</pre>
 */
public interface GameHost extends AutoCloseable
{
    /**
     * Creates and registers a new session.
     *
     * <p>Allocates a game id and draws the secret number.</p>
     *
     * @return the new session, waiting for its first player
     * @throws GameCreationException if the secret number cannot be drawn
     * @throws IllegalStateException if the host has been closed
     */
    GameSession create();

    /**
     * Sends a request to a session and waits for its responses.
     *
     * @param session the session
     * @param request the request
     * @return the responses, in order
     */
    List<Response> send(GameSession session, Request request);

    /**
     * Sends a request to the session with the given id.
     *
     * @param gameId  the game id
     * @param request the request
     * @return the responses, in order
     * @throws IllegalArgumentException if no such session is registered
     */
    List<Response> send(int gameId, Request request);

    /**
     * Stops a session and releases it.
     *
     * @param session the session
     */
    void stop(GameSession session);

    /**
     * Stops the session with the given id and releases it.
     *
     * @param gameId the game id
     * @return true if a session was stopped
     */
    boolean stop(int gameId);

    /**
     * Finds a registered session.
     *
     * @param gameId the game id
     * @return the session, or empty if none is registered under that id
     */
    Optional<GameSession> getSession(int gameId);

    /**
     * Returns all registered sessions.
     *
     * @return unmodifiable collection of sessions
     */
    Collection<GameSession> getSessions();

    /**
     * Returns the id the next {@link #create()} would probably get.
     *
     * <p>Informational only; see {@link IdAllocator#peekNextId()}.</p>
     *
     * @return the next id
     */
    int peekNextId();

    /**
     * Returns the most recently allocated game id.
     *
     * @return the last allocated id
     */
    int lastAllocatedId();

    /**
     * Registers a callback for new sessions.
     *
     * @param handler called after a session has been registered
     */
    void onSessionCreated(Consumer<GameSession> handler);

    /**
     * Registers a callback for stopped sessions.
     *
     * @param handler called after a session has been stopped and released
     */
    void onSessionStopped(Consumer<GameSession> handler);

    /**
     * Registers a callback for won games.
     *
     * <p>Informs the host only. Players still receive nothing they did not
     * ask for. The callback runs on the thread that processes the session's
     * requests, so it must not {@code send} to that session.</p>
     *
     * @param handler called with the session and the winning response
     */
    void onGameWon(BiConsumer<GameSession, Response.Won> handler);

    /**
     * Registers an error handler for response handler exceptions.
     *
     * @param handler called when a response handler throws
     */
    void onError(ErrorHandler handler);

    /**
     * Stops all sessions and releases the host's threads.
     */
    @Override
    void close();
}
