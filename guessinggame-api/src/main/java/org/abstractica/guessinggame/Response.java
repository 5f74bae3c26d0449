package org.abstractica.guessinggame;

import java.util.Objects;

/**
 * Responses sent by a game session to the player that made a request.
 *
 * <p>Every response carries the id of the game it relates to, so a caller
 * can multiplex many sessions over one channel.</p>
 */
public sealed interface Response permits
        Response.NotReady,
        Response.Ready,
        Response.YourTurn,
        Response.NotYourTurn,
        Response.GameInProgress,
        Response.Won,
        Response.Lose,
        Response.NopeTryAgain,
        Response.GameOver
{
    /**
     * Returns the id of the game this response relates to.
     *
     * @return game id
     */
    int gameId();

    /**
     * The game is not ready to play.
     *
     * @param gameId                 the game id
     * @param stillWaitingForPlayers players that still have to join before the game can start
     */
    record NotReady(int gameId, int stillWaitingForPlayers) implements Response {}

    /**
     * The game is ready for the first guess.
     *
     * @param gameId the game id
     */
    record Ready(int gameId) implements Response {}

    /**
     * It is the named player's turn to guess.
     *
     * @param gameId     the game id
     * @param playerName the player whose turn it is
     */
    record YourTurn(int gameId, String playerName) implements Response
    {
        public YourTurn
        {
            Objects.requireNonNull(playerName, "playerName");
        }
    }

    /**
     * It is not the requesting player's turn.
     *
     * @param gameId          the game id
     * @param otherPlayerName the player whose turn it is
     */
    record NotYourTurn(int gameId, String otherPlayerName) implements Response
    {
        public NotYourTurn
        {
            Objects.requireNonNull(otherPlayerName, "otherPlayerName");
        }
    }

    /**
     * The game has already started; no more players can join.
     *
     * @param gameId the game id
     */
    record GameInProgress(int gameId) implements Response {}

    /**
     * The requesting player guessed the secret number.
     *
     * @param gameId            the game id
     * @param winningPlayerName the winning player
     * @param winningGuess      the value of the winning guess
     * @param guessCount        accepted guesses made by both players, the winning one included
     */
    record Won(int gameId, String winningPlayerName, int winningGuess, int guessCount) implements Response
    {
        public Won
        {
            Objects.requireNonNull(winningPlayerName, "winningPlayerName");
        }
    }

    /**
     * The requesting player lost the game.
     *
     * <p>Part of the protocol vocabulary but never sent by a session: the
     * losing player is not notified when the game ends.</p>
     *
     * @param gameId            the game id
     * @param winningPlayerName the winning player
     * @param winningGuess      the value of the winning guess
     * @param guessCount        accepted guesses made by both players
     */
    record Lose(int gameId, String winningPlayerName, int winningGuess, int guessCount) implements Response
    {
        public Lose
        {
            Objects.requireNonNull(winningPlayerName, "winningPlayerName");
        }
    }

    /**
     * The guess was wrong.
     *
     * <p>{@code nextPlayerName} is informational; the next player is not
     * told that it is their turn.</p>
     *
     * @param gameId         the game id
     * @param nextPlayerName the player whose turn is next
     * @param incorrectValue the value that was guessed
     * @param hint           where the secret lies relative to the guess
     */
    record NopeTryAgain(int gameId, String nextPlayerName, int incorrectValue, Hint hint) implements Response
    {
        public NopeTryAgain
        {
            Objects.requireNonNull(nextPlayerName, "nextPlayerName");
            Objects.requireNonNull(hint, "hint");
        }
    }

    /**
     * The game is over; no one can join or guess any more.
     *
     * @param gameId            the game id
     * @param winningPlayerName the winning player
     * @param winningGuess      the secret number
     * @param guessCount        accepted guesses made by both players, the winning one included
     */
    record GameOver(int gameId, String winningPlayerName, int winningGuess, int guessCount) implements Response
    {
        public GameOver
        {
            Objects.requireNonNull(winningPlayerName, "winningPlayerName");
        }
    }
}
