package org.abstractica.guessinggame.impl.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered sessions of a host, by game id.
 *
 * <p>Thread-safe for concurrent creation and release of sessions.</p>
 */
public class SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Integer, DefaultGameSession> sessionsById;

    public SessionRegistry()
    {
        this.sessionsById = new ConcurrentHashMap<>();
    }

    /**
     * Finds a session by game id.
     *
     * @param gameId the game id
     * @return the session, or null if not found
     */
    public DefaultGameSession find(int gameId)
    {
        return sessionsById.get(gameId);
    }

    /**
     * Returns all registered sessions.
     *
     * @return unmodifiable view of the sessions
     */
    public Collection<DefaultGameSession> getAll()
    {
        return Collections.unmodifiableCollection(sessionsById.values());
    }

    /**
     * Returns the number of registered sessions.
     */
    public int size()
    {
        return sessionsById.size();
    }

    /**
     * Registers a session.
     *
     * @param session the session to register
     * @throws IllegalStateException if another session already uses the same id
     */
    public void register(DefaultGameSession session)
    {
        Objects.requireNonNull(session, "session");

        DefaultGameSession existing = sessionsById.putIfAbsent(session.getId(), session);
        if (existing != null)
        {
            throw new IllegalStateException("Duplicate game id: " + session.getId());
        }
        LOG.debug("Game registered: id={}", session.getId());
    }

    /**
     * Removes a session.
     *
     * @param session the session to remove
     * @return true if the session was registered
     */
    public boolean remove(DefaultGameSession session)
    {
        Objects.requireNonNull(session, "session");

        boolean removed = sessionsById.remove(session.getId(), session);
        if (removed)
        {
            LOG.debug("Game removed: id={}", session.getId());
        }
        return removed;
    }
}
