package org.abstractica.guessinggame;

import java.util.concurrent.Executor;

/**
 * Factory for creating GameHost instances.
 *
 * <p>Use the builder to configure the host before creation:</p>
 * <pre>{@code
 * GameHostFactory factory = new DefaultGameHostFactory();
 * GameHost host = factory.builder()
 *     .maxSecretNumber(10)
 *     .build();
 * }</pre>
 */
public interface GameHostFactory
{
    /**
     * Creates a new host builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a GameHost.
     */
    interface Builder
    {
        /**
         * Sets the largest secret number; secrets are drawn from 1 to this value.
         *
         * <p>Optional. Defaults to 10. Ignored when a custom generator is set.</p>
         *
         * @param maxSecretNumber the upper bound, inclusive
         * @return this builder
         */
        Builder maxSecretNumber(int maxSecretNumber);

        /**
         * Sets the source of game ids.
         *
         * <p>Optional. Defaults to the process-wide counter.</p>
         *
         * @param idAllocator the id allocator
         * @return this builder
         */
        Builder idAllocator(IdAllocator idAllocator);

        /**
         * Sets the source of secret numbers.
         *
         * <p>Optional. Defaults to a uniform random draw in
         * {@code [1, maxSecretNumber]}.</p>
         *
         * @param generator the secret number generator
         * @return this builder
         */
        Builder secretNumberGenerator(SecretNumberGenerator generator);

        /**
         * Sets the executor that processes session requests.
         *
         * <p>Optional. Defaults to a pool owned, and shut down, by the host.
         * A supplied executor is not shut down by the host.</p>
         *
         * @param executor the executor
         * @return this builder
         */
        Builder executor(Executor executor);

        /**
         * Builds the host.
         *
         * @return the configured host
         */
        GameHost build();
    }
}
