package org.abstractica.guessinggame.impl.session;

import org.abstractica.guessinggame.GameHost;
import org.abstractica.guessinggame.GameHostFactory;
import org.abstractica.guessinggame.IdAllocator;
import org.abstractica.guessinggame.SecretNumberGenerator;
import org.abstractica.guessinggame.impl.id.AtomicIdAllocator;
import org.abstractica.guessinggame.impl.secret.RandomSecretNumberGenerator;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of GameHostFactory.
 *
 * <p>Creates DefaultGameHost instances using a builder pattern.</p>
 */
public class DefaultGameHostFactory implements GameHostFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int maxSecretNumber = RandomSecretNumberGenerator.DEFAULT_MAX_SECRET_NUMBER;
        private IdAllocator idAllocator = AtomicIdAllocator.shared();
        private SecretNumberGenerator secretNumberGenerator; // null = random in [1, maxSecretNumber]
        private Executor executor; // null = pool owned by the host

        @Override
        public Builder maxSecretNumber(int maxSecretNumber)
        {
            if (maxSecretNumber <= 0)
            {
                throw new IllegalArgumentException("maxSecretNumber must be positive: " + maxSecretNumber);
            }
            this.maxSecretNumber = maxSecretNumber;
            return this;
        }

        @Override
        public Builder idAllocator(IdAllocator idAllocator)
        {
            this.idAllocator = Objects.requireNonNull(idAllocator, "idAllocator");
            return this;
        }

        @Override
        public Builder secretNumberGenerator(SecretNumberGenerator generator)
        {
            this.secretNumberGenerator = Objects.requireNonNull(generator, "generator");
            return this;
        }

        @Override
        public Builder executor(Executor executor)
        {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        @Override
        public GameHost build()
        {
            SecretNumberGenerator generator = secretNumberGenerator != null
                    ? secretNumberGenerator
                    : new RandomSecretNumberGenerator(maxSecretNumber);

            if (executor != null)
            {
                return new DefaultGameHost(idAllocator, generator, executor, null);
            }

            ExecutorService pool = Executors.newCachedThreadPool(new MailboxThreadFactory());
            return new DefaultGameHost(idAllocator, generator, pool, pool);
        }
    }

    private static class MailboxThreadFactory implements ThreadFactory
    {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task)
        {
            Thread thread = new Thread(task, "game-mailbox-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
