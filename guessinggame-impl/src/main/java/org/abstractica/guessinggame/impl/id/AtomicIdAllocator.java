package org.abstractica.guessinggame.impl.id;

import org.abstractica.guessinggame.IdAllocator;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Id allocator backed by an atomic counter.
 *
 * <p>The first id handed out is one more than the starting value.
 * {@link #shared()} returns the process-wide allocator used by hosts that
 * are not given one explicitly, so ids stay unique across hosts.</p>
 */
public class AtomicIdAllocator implements IdAllocator
{
    private static final AtomicIdAllocator SHARED = new AtomicIdAllocator();

    private final AtomicInteger lastId;

    /**
     * Creates an allocator whose first id is 1.
     */
    public AtomicIdAllocator()
    {
        this(0);
    }

    /**
     * Creates an allocator continuing after the given id.
     *
     * @param lastAllocatedId the id considered already allocated
     */
    public AtomicIdAllocator(int lastAllocatedId)
    {
        if (lastAllocatedId < 0)
        {
            throw new IllegalArgumentException("lastAllocatedId must be >= 0: " + lastAllocatedId);
        }
        this.lastId = new AtomicInteger(lastAllocatedId);
    }

    /**
     * Returns the process-wide allocator.
     *
     * @return the shared allocator
     */
    public static AtomicIdAllocator shared()
    {
        return SHARED;
    }

    @Override
    public int nextId()
    {
        int id = lastId.incrementAndGet();
        if (id <= 0)
        {
            throw new IllegalStateException("Game id space exhausted");
        }
        return id;
    }

    @Override
    public int peekNextId()
    {
        return lastId.get() + 1;
    }

    @Override
    public int lastAllocatedId()
    {
        return lastId.get();
    }
}
