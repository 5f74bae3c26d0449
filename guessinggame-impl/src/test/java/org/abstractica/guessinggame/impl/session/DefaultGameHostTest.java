package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.GameCreationException;
import org.abstractica.guessinggame.GameHost;
import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.IdAllocator;
import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.impl.id.AtomicIdAllocator;
import org.abstractica.guessinggame.impl.secret.FixedSecretNumberGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultGameHost}.
 */
class DefaultGameHostTest
{
    private static final int SECRET = 5;
    private static final String PLAYER_1 = "Bo Diddly";
    private static final String PLAYER_2 = "Fee Fifofum";

    private GameHost host;

    @AfterEach
    void tearDown()
    {
        if (host != null)
        {
            host.close();
        }
    }

    private GameHost createHost(IdAllocator allocator)
    {
        return new DefaultGameHostFactory().builder()
                .idAllocator(allocator)
                .secretNumberGenerator(new FixedSecretNumberGenerator(SECRET))
                .build();
    }

    // ========== create ==========

    @Test
    void create_usesAllocatedIdAndRegistersSession()
    {
        AtomicIdAllocator allocator = new AtomicIdAllocator(100);
        host = createHost(allocator);

        assertEquals(101, host.peekNextId());
        GameSession session = host.create();

        assertEquals(101, session.getId());
        assertEquals(101, host.lastAllocatedId());
        assertEquals(102, host.peekNextId());
        assertSame(session, host.getSession(101).orElseThrow());
        assertEquals(1, host.getSessions().size());
    }

    @Test
    void create_deterministicAllocatorStub_isUsed()
    {
        IdAllocator stub = new IdAllocator()
        {
            @Override
            public int nextId()
            {
                return 7;
            }

            @Override
            public int peekNextId()
            {
                return 7;
            }

            @Override
            public int lastAllocatedId()
            {
                return 7;
            }
        };
        host = createHost(stub);

        GameSession session = host.create();
        assertEquals(7, session.getId());
        assertEquals(List.of(new Response.NotReady(7, 2)), session.send(new Request.Guess(PLAYER_1, 1)));
    }

    @Test
    void create_sharedAllocatorByDefault_idsIncreaseAcrossHosts()
    {
        GameHost first = new DefaultGameHostFactory().builder().build();
        GameHost second = new DefaultGameHostFactory().builder().build();
        try
        {
            int a = first.create().getId();
            int b = second.create().getId();
            int c = first.create().getId();

            assertTrue(a < b && b < c, "Expected increasing ids: " + a + ", " + b + ", " + c);
        }
        finally
        {
            first.close();
            second.close();
        }
    }

    @Test
    void create_concurrently_producesDistinctIncreasingIds() throws Exception
    {
        host = createHost(new AtomicIdAllocator());
        int threads = 8;
        int perThread = 125;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<List<Integer>>> futures = new ArrayList<>();

        try
        {
            for (int t = 0; t < threads; t++)
            {
                futures.add(pool.submit(() ->
                {
                    start.await();
                    List<Integer> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++)
                    {
                        ids.add(host.create().getId());
                    }
                    return ids;
                }));
            }
            start.countDown();

            List<Integer> all = new ArrayList<>();
            for (Future<List<Integer>> future : futures)
            {
                List<Integer> ids = future.get(10, TimeUnit.SECONDS);
                for (int i = 1; i < ids.size(); i++)
                {
                    assertTrue(ids.get(i) > ids.get(i - 1), "Ids from one caller must increase");
                }
                all.addAll(ids);
            }

            Collections.sort(all);
            for (int i = 0; i < all.size(); i++)
            {
                assertEquals(i + 1, all.get(i));
            }
            assertEquals(threads * perThread, host.getSessions().size());
        }
        finally
        {
            pool.shutdownNow();
        }
    }

    @Test
    void create_generatorFails_nothingRegistered()
    {
        host = new DefaultGameHostFactory().builder()
                .idAllocator(new AtomicIdAllocator())
                .secretNumberGenerator(() ->
                {
                    throw new IllegalStateException("entropy unavailable");
                })
                .build();

        List<GameSession> created = new ArrayList<>();
        host.onSessionCreated(created::add);

        GameCreationException e = assertThrows(GameCreationException.class, host::create);
        assertEquals("entropy unavailable", e.getCause().getMessage());
        assertTrue(host.getSessions().isEmpty());
        assertTrue(created.isEmpty());
    }

    @Test
    void create_hostClosedDuringCreation_sessionNotRegistered()
    {
        AtomicReference<GameHost> self = new AtomicReference<>();
        host = new DefaultGameHostFactory().builder()
                .idAllocator(new AtomicIdAllocator())
                .secretNumberGenerator(() ->
                {
                    self.get().close();
                    return SECRET;
                })
                .build();
        self.set(host);

        List<GameSession> created = new ArrayList<>();
        host.onSessionCreated(created::add);

        assertThrows(IllegalStateException.class, host::create);
        assertTrue(host.getSessions().isEmpty());
        assertTrue(created.isEmpty());
    }

    @Test
    void create_afterClose_throws()
    {
        host = createHost(new AtomicIdAllocator());
        host.close();

        assertThrows(IllegalStateException.class, host::create);
    }

    // ========== send ==========

    @Test
    void send_byId_reachesSession()
    {
        host = createHost(new AtomicIdAllocator());
        GameSession session = host.create();

        assertEquals(List.of(new Response.NotReady(session.getId(), 1)),
                host.send(session.getId(), new Request.Introduce(PLAYER_1)));
        assertEquals(List.of(new Response.Ready(session.getId()), new Response.YourTurn(session.getId(), PLAYER_2)),
                host.send(session, new Request.Introduce(PLAYER_2)));
    }

    @Test
    void send_unknownId_throws()
    {
        host = createHost(new AtomicIdAllocator());
        assertThrows(IllegalArgumentException.class, () -> host.send(12345, new Request.Introduce(PLAYER_1)));
    }

    @Test
    void send_sessionsAreIndependent()
    {
        host = createHost(new AtomicIdAllocator());
        GameSession first = host.create();
        GameSession second = host.create();

        host.send(first, new Request.Introduce(PLAYER_1));

        assertEquals(List.of(new Response.NotReady(first.getId(), 1)), host.send(first, new Request.Guess(PLAYER_1, 1)));
        assertEquals(List.of(new Response.NotReady(second.getId(), 2)), host.send(second, new Request.Guess(PLAYER_1, 1)));
    }

    // ========== stop ==========

    @Test
    void stop_releasesSessionAndNotifies()
    {
        host = createHost(new AtomicIdAllocator());
        List<GameSession> stopped = new ArrayList<>();
        host.onSessionStopped(stopped::add);

        GameSession session = host.create();
        host.stop(session);

        assertTrue(session.isStopped());
        assertTrue(host.getSession(session.getId()).isEmpty());
        assertEquals(List.of(session), stopped);
        assertThrows(IllegalStateException.class, () -> host.send(session, new Request.Introduce(PLAYER_1)));
    }

    @Test
    void stop_byId_returnsWhetherStopped()
    {
        host = createHost(new AtomicIdAllocator());
        GameSession session = host.create();

        assertTrue(host.stop(session.getId()));
        assertFalse(host.stop(session.getId()));
    }

    @Test
    void stop_sessionDirectly_unregistersFromHost()
    {
        host = createHost(new AtomicIdAllocator());
        GameSession session = host.create();

        session.stop();

        assertTrue(host.getSessions().isEmpty());
    }

    @Test
    void close_stopsAllSessions()
    {
        host = createHost(new AtomicIdAllocator());
        GameSession first = host.create();
        GameSession second = host.create();

        host.close();

        assertTrue(((DefaultGameHost) host).isClosed());
        assertTrue(first.isStopped());
        assertTrue(second.isStopped());
        assertTrue(host.getSessions().isEmpty());
    }

    // ========== callbacks ==========

    @Test
    void onSessionCreated_calledWithNewSession()
    {
        host = createHost(new AtomicIdAllocator());
        AtomicReference<GameSession> created = new AtomicReference<>();
        host.onSessionCreated(created::set);

        GameSession session = host.create();

        assertSame(session, created.get());
    }

    @Test
    void onGameWon_calledOnceForWinner() throws Exception
    {
        host = createHost(new AtomicIdAllocator());
        CountDownLatch wonLatch = new CountDownLatch(1);
        AtomicReference<Response.Won> won = new AtomicReference<>();
        host.onGameWon((session, response) ->
        {
            won.set(response);
            wonLatch.countDown();
        });

        GameSession session = host.create();
        host.send(session, new Request.Introduce(PLAYER_1));
        host.send(session, new Request.Introduce(PLAYER_2));
        host.send(session, new Request.Guess(PLAYER_2, SECRET));

        assertTrue(wonLatch.await(5, TimeUnit.SECONDS));
        assertEquals(new Response.Won(session.getId(), PLAYER_2, SECRET, 1), won.get());
    }

    @Test
    void onGameWon_callbackSendsToSameSession_winningSendReturns()
    {
        host = createHost(new AtomicIdAllocator());
        AtomicReference<Exception> nestedFailure = new AtomicReference<>();
        host.onGameWon((session, response) ->
        {
            try
            {
                session.send(new Request.Guess(PLAYER_1, 1));
            }
            catch (IllegalStateException e)
            {
                nestedFailure.set(e);
            }
        });

        GameSession session = host.create();
        host.send(session, new Request.Introduce(PLAYER_1));
        host.send(session, new Request.Introduce(PLAYER_2));

        assertEquals(List.of(new Response.Won(session.getId(), PLAYER_2, SECRET, 1)),
                host.send(session, new Request.Guess(PLAYER_2, SECRET)));
        assertInstanceOf(IllegalStateException.class, nestedFailure.get());
    }

    @Test
    void callbackThrows_hostKeepsWorking()
    {
        host = createHost(new AtomicIdAllocator());
        host.onSessionCreated(session ->
        {
            throw new IllegalStateException("callback failure");
        });

        GameSession session = host.create();

        assertEquals(1, host.getSessions().size());
        assertEquals(1, host.send(session, new Request.Introduce(PLAYER_1)).size());
    }

    @Test
    void onError_receivesResponseHandlerFailures() throws Exception
    {
        host = createHost(new AtomicIdAllocator());
        CountDownLatch errorLatch = new CountDownLatch(1);
        AtomicReference<Response> failed = new AtomicReference<>();
        host.onError((session, response, exception) ->
        {
            failed.set(response);
            errorLatch.countDown();
        });

        GameSession session = host.create();
        session.submit(new Request.Guess(PLAYER_1, 1), (s, r) ->
        {
            throw new IllegalArgumentException("handler failure");
        });

        assertTrue(errorLatch.await(5, TimeUnit.SECONDS));
        assertEquals(new Response.NotReady(session.getId(), 2), failed.get());
    }
}
