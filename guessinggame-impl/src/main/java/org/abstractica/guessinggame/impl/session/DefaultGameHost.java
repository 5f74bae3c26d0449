package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.GameCreationException;
import org.abstractica.guessinggame.GameHost;
import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.IdAllocator;
import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.SecretNumberGenerator;
import org.abstractica.guessinggame.handlers.ErrorHandler;
import org.abstractica.guessinggame.impl.fsm.GameData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Default implementation of the GameHost interface.
 *
 * <p>Allocates ids and secrets for new sessions, keeps them in a registry
 * until they are stopped, and relays session events to registered
 * callbacks.</p>
 */
public class DefaultGameHost implements GameHost, SessionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultGameHost.class);

    private final IdAllocator idAllocator;
    private final SecretNumberGenerator secretNumberGenerator;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final SessionRegistry registry;
    private final Object lifecycleLock = new Object();

    private final List<Consumer<GameSession>> sessionCreatedCallbacks;
    private final List<Consumer<GameSession>> sessionStoppedCallbacks;
    private final List<BiConsumer<GameSession, Response.Won>> gameWonCallbacks;
    private volatile ErrorHandler errorHandler;

    private volatile boolean closed;

    /**
     * Creates a new host.
     *
     * <p>Use {@link DefaultGameHostFactory} to create instances.</p>
     *
     * @param idAllocator           source of game ids
     * @param secretNumberGenerator source of secret numbers
     * @param executor              runs session mailboxes
     * @param ownedExecutor         the same executor if the host must shut it down on close, otherwise null
     */
    DefaultGameHost(
            IdAllocator idAllocator,
            SecretNumberGenerator secretNumberGenerator,
            Executor executor,
            ExecutorService ownedExecutor
    )
    {
        this.idAllocator = Objects.requireNonNull(idAllocator, "idAllocator");
        this.secretNumberGenerator = Objects.requireNonNull(secretNumberGenerator, "secretNumberGenerator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = ownedExecutor;
        this.registry = new SessionRegistry();

        this.sessionCreatedCallbacks = new CopyOnWriteArrayList<>();
        this.sessionStoppedCallbacks = new CopyOnWriteArrayList<>();
        this.gameWonCallbacks = new CopyOnWriteArrayList<>();

        this.closed = false;
    }

    // ========== GameHost Interface ==========

    @Override
    public GameSession create()
    {
        DefaultGameSession session;
        synchronized (lifecycleLock)
        {
            if (closed)
            {
                throw new IllegalStateException("Host is closed");
            }

            int gameId = idAllocator.nextId();
            int secretNumber;
            try
            {
                secretNumber = secretNumberGenerator.generate();
            }
            catch (RuntimeException e)
            {
                LOG.error("Failed to draw secret number for game {}", gameId, e);
                throw new GameCreationException("Cannot draw secret number for game " + gameId, e);
            }

            // The generator runs on this thread and may have closed the host
            if (closed)
            {
                throw new IllegalStateException("Host closed while creating game " + gameId);
            }

            session = new DefaultGameSession(GameData.newGame(gameId, secretNumber), executor, this);
            registry.register(session);
        }
        LOG.info("Game created: id={}", session.getId());

        notifySessionCallbacks(sessionCreatedCallbacks, session, "Session created");
        return session;
    }

    @Override
    public List<Response> send(GameSession session, Request request)
    {
        Objects.requireNonNull(session, "session");
        return session.send(request);
    }

    @Override
    public List<Response> send(int gameId, Request request)
    {
        DefaultGameSession session = registry.find(gameId);
        if (session == null)
        {
            throw new IllegalArgumentException("Unknown game: " + gameId);
        }
        return session.send(request);
    }

    @Override
    public void stop(GameSession session)
    {
        Objects.requireNonNull(session, "session");
        session.stop();
    }

    @Override
    public boolean stop(int gameId)
    {
        DefaultGameSession session = registry.find(gameId);
        if (session == null)
        {
            return false;
        }
        session.stop();
        return true;
    }

    @Override
    public Optional<GameSession> getSession(int gameId)
    {
        return Optional.ofNullable(registry.find(gameId));
    }

    @Override
    public Collection<GameSession> getSessions()
    {
        return Collections.unmodifiableCollection(registry.getAll());
    }

    @Override
    public int peekNextId()
    {
        return idAllocator.peekNextId();
    }

    @Override
    public int lastAllocatedId()
    {
        return idAllocator.lastAllocatedId();
    }

    @Override
    public void onSessionCreated(Consumer<GameSession> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionCreatedCallbacks.add(handler);
    }

    @Override
    public void onSessionStopped(Consumer<GameSession> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionStoppedCallbacks.add(handler);
    }

    @Override
    public void onGameWon(BiConsumer<GameSession, Response.Won> handler)
    {
        Objects.requireNonNull(handler, "handler");
        gameWonCallbacks.add(handler);
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public void close()
    {
        synchronized (lifecycleLock)
        {
            if (closed)
            {
                return;
            }
            closed = true;
        }

        LOG.info("Closing host with {} games", registry.size());

        for (DefaultGameSession session : new ArrayList<>(registry.getAll()))
        {
            session.stop();
        }

        if (ownedExecutor != null)
        {
            ownedExecutor.shutdown();
        }

        LOG.info("Host closed");
    }

    /**
     * Returns whether the host has been closed.
     */
    public boolean isClosed()
    {
        return closed;
    }

    // ========== SessionCallback ==========

    @Override
    public void onSessionStopped(DefaultGameSession session)
    {
        registry.remove(session);
        notifySessionCallbacks(sessionStoppedCallbacks, session, "Session stopped");
    }

    @Override
    public void onGameWon(DefaultGameSession session, Response.Won won)
    {
        LOG.info("Game {} won by {} with {} after {} guesses",
                session.getId(), won.winningPlayerName(), won.winningGuess(), won.guessCount());

        for (BiConsumer<GameSession, Response.Won> callback : gameWonCallbacks)
        {
            try
            {
                callback.accept(session, won);
            }
            catch (Exception e)
            {
                LOG.error("Game won callback error", e);
            }
        }
    }

    @Override
    public ErrorHandler getErrorHandler()
    {
        return errorHandler;
    }

    // ========== Internal ==========

    private static void notifySessionCallbacks(List<Consumer<GameSession>> callbacks, GameSession session, String event)
    {
        for (Consumer<GameSession> callback : callbacks)
        {
            try
            {
                callback.accept(session);
            }
            catch (Exception e)
            {
                LOG.error("{} callback error", event, e);
            }
        }
    }
}
