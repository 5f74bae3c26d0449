package org.abstractica.guessinggame.impl.fsm;

import org.abstractica.guessinggame.Response;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying one request to a game.
 *
 * @param next      the game data after the request
 * @param responses responses for the requesting player, in order
 */
public record Transition(GameData next, List<Response> responses)
{
    public Transition
    {
        Objects.requireNonNull(next, "next");
        responses = List.copyOf(responses);
    }
}
