package org.abstractica.guessinggame.impl.secret;

import org.abstractica.guessinggame.SecretNumberGenerator;

/**
 * Always yields the same secret number.
 *
 * <p>For tests and for demos that need a known secret.</p>
 */
public class FixedSecretNumberGenerator implements SecretNumberGenerator
{
    private final int secretNumber;

    public FixedSecretNumberGenerator(int secretNumber)
    {
        this.secretNumber = secretNumber;
    }

    @Override
    public int generate()
    {
        return secretNumber;
    }
}
