package org.abstractica.guessinggame;

/**
 * Source of unique game ids.
 *
 * <p>Implementations must be safe for concurrent use: ids returned by
 * {@link #nextId()} are strictly increasing and never repeat for the
 * lifetime of the allocator.</p>
 */
public interface IdAllocator
{
    /**
     * Allocates the next id.
     *
     * @return a new, unique id
     */
    int nextId();

    /**
     * Returns the id the next allocation would produce, without allocating it.
     *
     * <p>Informational only. When sessions are created concurrently another
     * caller may take this id first; do not rely on it for correctness.</p>
     *
     * @return the current counter value plus one
     */
    int peekNextId();

    /**
     * Returns the most recently allocated id.
     *
     * @return the last allocated id, or 0 if none has been allocated
     */
    int lastAllocatedId();
}
