package org.abstractica.guessinggame.impl.secret;

import org.abstractica.guessinggame.SecretNumberGenerator;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Draws secret numbers uniformly from {@code [1, maxSecretNumber]}.
 */
public class RandomSecretNumberGenerator implements SecretNumberGenerator
{
    /**
     * Default largest secret number.
     */
    public static final int DEFAULT_MAX_SECRET_NUMBER = 10;

    private final int maxSecretNumber;
    private final Random random;

    /**
     * Creates a generator for {@code [1, 10]} backed by a SecureRandom.
     */
    public RandomSecretNumberGenerator()
    {
        this(DEFAULT_MAX_SECRET_NUMBER);
    }

    /**
     * Creates a generator backed by a SecureRandom.
     *
     * @param maxSecretNumber the largest secret number, inclusive
     */
    public RandomSecretNumberGenerator(int maxSecretNumber)
    {
        this(maxSecretNumber, new SecureRandom());
    }

    /**
     * Creates a generator backed by the given random source.
     *
     * @param maxSecretNumber the largest secret number, inclusive
     * @param random          the random source
     */
    public RandomSecretNumberGenerator(int maxSecretNumber, Random random)
    {
        if (maxSecretNumber <= 0)
        {
            throw new IllegalArgumentException("maxSecretNumber must be positive: " + maxSecretNumber);
        }
        this.maxSecretNumber = maxSecretNumber;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public int generate()
    {
        return random.nextInt(maxSecretNumber) + 1;
    }

    /**
     * Returns the largest number this generator can draw.
     *
     * @return the upper bound, inclusive
     */
    public int getMaxSecretNumber()
    {
        return maxSecretNumber;
    }
}
