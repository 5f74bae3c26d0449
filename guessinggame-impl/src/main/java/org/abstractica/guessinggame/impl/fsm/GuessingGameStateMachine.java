package org.abstractica.guessinggame.impl.fsm;

import org.abstractica.guessinggame.Hint;
import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;

import java.util.List;
import java.util.Objects;

/**
 * Transition function of the guessing game.
 *
 * <p>Pure and stateless: {@link #apply(GameData, Request)} computes the next
 * game data and the responses for the requesting player without touching
 * anything else. Callers must apply requests for one game one at a time.</p>
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>The first player to join waits for the second; the second player
 *       to join guesses first.</li>
 *   <li>Only accepted in-turn guesses are counted and pass the turn on.
 *       Out-of-turn guesses and guesses before both players joined change
 *       nothing.</li>
 *   <li>Once the secret is found every request, of any kind, gets the same
 *       {@code GameOver} response.</li>
 * </ul>
 */
public final class GuessingGameStateMachine
{
    private GuessingGameStateMachine()
    {
    }

    /**
     * Applies one request to a game.
     *
     * @param data    the current game data
     * @param request the request
     * @return the next game data and the responses for the requester
     */
    public static Transition apply(GameData data, Request request)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(request, "request");

        return switch (data.state())
        {
            case NEW_GAME -> newGame(data, request);
            case WAITING_FOR_SECOND_PLAYER -> waitingForSecondPlayer(data, request);
            case PLAYING -> playing(data, request);
            case OVER -> over(data);
        };
    }

    /**
     * Computes the hint for an incorrect guess.
     *
     * @param value        the guessed value
     * @param secretNumber the secret number, different from {@code value}
     * @return {@link Hint#LOWER} if the guess was too high, otherwise {@link Hint#HIGHER}
     */
    public static Hint hintFor(int value, int secretNumber)
    {
        return value > secretNumber ? Hint.LOWER : Hint.HIGHER;
    }

    private static Transition newGame(GameData data, Request request)
    {
        if (request instanceof Request.Introduce introduce)
        {
            GameData next = data.withPlayer(introduce.playerName(), GameState.WAITING_FOR_SECOND_PLAYER, GameData.NO_PLAYER);
            return new Transition(next, List.of(
                    new Response.NotReady(data.gameId(), next.stillWaitingForPlayers())
            ));
        }
        return stay(data, new Response.NotReady(data.gameId(), data.stillWaitingForPlayers()));
    }

    private static Transition waitingForSecondPlayer(GameData data, Request request)
    {
        if (request instanceof Request.Introduce introduce)
        {
            // Positional: the slot just appended, so duplicate names keep distinct turns
            int secondPlayer = data.playerNames().size();
            GameData next = data.withPlayer(introduce.playerName(), GameState.PLAYING, secondPlayer);
            return new Transition(next, List.of(
                    new Response.Ready(data.gameId()),
                    new Response.YourTurn(data.gameId(), next.currentPlayerName())
            ));
        }
        return stay(data, new Response.NotReady(data.gameId(), data.stillWaitingForPlayers()));
    }

    private static Transition playing(GameData data, Request request)
    {
        if (!(request instanceof Request.Guess guess))
        {
            return stay(data, new Response.GameInProgress(data.gameId()));
        }

        String currentPlayerName = data.currentPlayerName();
        if (!currentPlayerName.equals(guess.playerName()))
        {
            return stay(data, new Response.NotYourTurn(data.gameId(), currentPlayerName));
        }

        if (guess.value() == data.secretNumber())
        {
            GameData next = data.withWinner(currentPlayerName);
            return new Transition(next, List.of(
                    new Response.Won(data.gameId(), currentPlayerName, guess.value(), next.guessCount())
            ));
        }

        int nextPlayer = (data.currentPlayer() + 1) % GameData.PLAYER_COUNT;
        GameData next = data.withMissedGuess(nextPlayer);
        return new Transition(next, List.of(
                new Response.NopeTryAgain(
                        data.gameId(),
                        next.currentPlayerName(),
                        guess.value(),
                        hintFor(guess.value(), data.secretNumber())
                )
        ));
    }

    private static Transition over(GameData data)
    {
        return stay(data, new Response.GameOver(
                data.gameId(),
                data.winningPlayerName(),
                data.secretNumber(),
                data.guessCount()
        ));
    }

    private static Transition stay(GameData data, Response response)
    {
        return new Transition(data, List.of(response));
    }
}
