package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.handlers.ErrorHandler;
import org.abstractica.guessinggame.handlers.ResponseHandler;
import org.abstractica.guessinggame.impl.fsm.GameData;
import org.abstractica.guessinggame.impl.fsm.GameState;
import org.abstractica.guessinggame.impl.fsm.GuessingGameStateMachine;
import org.abstractica.guessinggame.impl.fsm.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of the GameSession interface.
 *
 * <p>Requests go into an unbounded mailbox that is drained by at most one
 * task at a time on the host's executor, so requests for one session are
 * processed one by one in arrival order while idle sessions hold no
 * thread. Game data is only replaced by the draining task.</p>
 */
public class DefaultGameSession implements GameSession
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultGameSession.class);

    private final int id;
    private final Executor executor;
    private final SessionCallback callback;
    private final Queue<QueuedRequest> mailbox;
    private final AtomicBoolean scheduled;
    private final AtomicBoolean stopped;

    private volatile GameData data;
    private volatile Thread drainingThread;

    /**
     * Creates a new session.
     *
     * @param initial  the initial game data
     * @param executor runs the mailbox
     * @param callback callback to the host
     */
    public DefaultGameSession(GameData initial, Executor executor, SessionCallback callback)
    {
        this.data = Objects.requireNonNull(initial, "initial");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.id = initial.gameId();

        this.mailbox = new ConcurrentLinkedQueue<>();
        this.scheduled = new AtomicBoolean(false);
        this.stopped = new AtomicBoolean(false);
    }

    // ========== GameSession Interface ==========

    @Override
    public int getId()
    {
        return id;
    }

    @Override
    public List<Response> send(Request request)
    {
        if (Thread.currentThread() == drainingThread)
        {
            throw new IllegalStateException("send from a response callback of game " + id + "; use submit");
        }

        QueuedRequest queued = enqueue(request, null);
        try
        {
            return queued.result().get();
        }
        catch (CancellationException e)
        {
            throw new IllegalStateException("Game " + id + " stopped before the request was processed", e);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            if (mailbox.remove(queued))
            {
                queued.result().cancel(false);
                throw new IllegalStateException("Interrupted while waiting for game " + id + "; request withdrawn", e);
            }
            throw new IllegalStateException("Interrupted while waiting for game " + id + "; request may still be applied", e);
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException)
            {
                throw runtimeException;
            }
            throw new IllegalStateException("Request to game " + id + " failed", cause);
        }
    }

    @Override
    public CompletableFuture<List<Response>> submit(Request request, ResponseHandler replyTo)
    {
        Objects.requireNonNull(replyTo, "replyTo");
        return enqueue(request, replyTo).result();
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true))
        {
            return;
        }

        int cancelled = cancelQueued();
        LOG.info("Game {} stopped in state {} ({} queued requests cancelled)", id, data.state(), cancelled);

        callback.onSessionStopped(this);
    }

    @Override
    public boolean isStopped()
    {
        return stopped.get();
    }

    // ========== Internal Methods ==========

    /**
     * Returns a snapshot of the game data.
     *
     * @return the game data after the last processed request
     */
    public GameData getData()
    {
        return data;
    }

    /**
     * Returns the current game state.
     */
    public GameState getState()
    {
        return data.state();
    }

    /**
     * Returns the number of requests waiting in the mailbox.
     */
    public int getQueuedCount()
    {
        return mailbox.size();
    }

    private QueuedRequest enqueue(Request request, ResponseHandler replyTo)
    {
        Objects.requireNonNull(request, "request");

        if (stopped.get())
        {
            LOG.warn("Request to stopped game {} rejected: {}", id, request);
            throw new IllegalStateException("Game " + id + " is stopped");
        }

        QueuedRequest queued = new QueuedRequest(request, replyTo, new CompletableFuture<>());
        mailbox.offer(queued);

        // stop() may have drained the mailbox between the check and the offer
        if (stopped.get())
        {
            cancelQueued();
            return queued;
        }

        schedule();
        return queued;
    }

    private void schedule()
    {
        if (!scheduled.compareAndSet(false, true))
        {
            return;
        }
        try
        {
            executor.execute(this::drain);
        }
        catch (RejectedExecutionException e)
        {
            scheduled.set(false);
            LOG.error("Executor rejected mailbox of game {}", id, e);
            cancelQueued();
            throw new IllegalStateException("Game " + id + " cannot process requests", e);
        }
    }

    private void drain()
    {
        drainingThread = Thread.currentThread();
        try
        {
            QueuedRequest queued;
            while ((queued = mailbox.poll()) != null)
            {
                if (stopped.get())
                {
                    queued.result().cancel(false);
                    continue;
                }
                process(queued);
            }
        }
        finally
        {
            drainingThread = null;
            scheduled.set(false);
        }

        // A request may have arrived after the last poll but before the flag was cleared
        if (!mailbox.isEmpty() && !stopped.get())
        {
            schedule();
        }
    }

    private void process(QueuedRequest queued)
    {
        Transition transition;
        try
        {
            transition = GuessingGameStateMachine.apply(data, queued.request());
        }
        catch (Exception e)
        {
            LOG.error("Error processing request in game {}: {}", id, queued.request(), e);
            queued.result().completeExceptionally(e);
            return;
        }

        data = transition.next();
        List<Response> responses = transition.responses();
        LOG.debug("Game {} processed {} -> {} {}", id, queued.request(), data.state(), responses);

        if (queued.replyTo() != null)
        {
            for (Response response : responses)
            {
                deliver(queued.replyTo(), response);
            }
        }
        for (Response response : responses)
        {
            if (response instanceof Response.Won won)
            {
                callback.onGameWon(this, won);
            }
        }

        queued.result().complete(responses);
    }

    private void deliver(ResponseHandler replyTo, Response response)
    {
        try
        {
            replyTo.handle(this, response);
        }
        catch (Exception e)
        {
            ErrorHandler errorHandler = callback.getErrorHandler();
            if (errorHandler != null)
            {
                try
                {
                    errorHandler.handle(this, response, e);
                }
                catch (Exception e2)
                {
                    LOG.error("Error handler threw exception", e2);
                }
            }
            else
            {
                LOG.error("Response handler exception: game={}, responseType={}",
                        id, response.getClass().getSimpleName(), e);
            }
        }
    }

    private int cancelQueued()
    {
        int count = 0;
        QueuedRequest queued;
        while ((queued = mailbox.poll()) != null)
        {
            queued.result().cancel(false);
            count++;
        }
        return count;
    }
}
