package org.abstractica.guessinggame.impl.fsm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one game.
 *
 * @param gameId            the game id
 * @param secretNumber      the number the players have to guess
 * @param state             the game state
 * @param playerNames       the joined players, in joining order (at most two)
 * @param currentPlayer     index in {@code playerNames} of the player whose turn is next,
 *                          or {@link #NO_PLAYER} before both players have joined
 * @param guessCount        accepted guesses made by both players
 * @param winningPlayerName the winner once the game is over, otherwise null
 */
public record GameData(
        int gameId,
        int secretNumber,
        GameState state,
        List<String> playerNames,
        int currentPlayer,
        int guessCount,
        String winningPlayerName
)
{
    /**
     * Number of players in a game.
     */
    public static final int PLAYER_COUNT = 2;

    /**
     * Value of {@code currentPlayer} while nobody has the turn.
     */
    public static final int NO_PLAYER = -1;

    public GameData
    {
        Objects.requireNonNull(state, "state");
        playerNames = List.copyOf(playerNames);

        if (playerNames.size() > PLAYER_COUNT)
        {
            throw new IllegalArgumentException("At most " + PLAYER_COUNT + " players: " + playerNames);
        }
        if (guessCount < 0)
        {
            throw new IllegalArgumentException("guessCount must be >= 0: " + guessCount);
        }

        boolean started = state == GameState.PLAYING || state == GameState.OVER;
        if (started && playerNames.size() != PLAYER_COUNT)
        {
            throw new IllegalArgumentException(state + " requires " + PLAYER_COUNT + " players");
        }
        if (started ? currentPlayer < 0 || currentPlayer >= PLAYER_COUNT : currentPlayer != NO_PLAYER)
        {
            throw new IllegalArgumentException("Invalid current player " + currentPlayer + " in state " + state);
        }
        if ((state == GameState.OVER) != (winningPlayerName != null))
        {
            throw new IllegalArgumentException("A winner is set exactly when the game is over");
        }
    }

    /**
     * Creates the data for a game nobody has joined yet.
     *
     * @param gameId       the game id
     * @param secretNumber the secret number
     * @return the initial game data
     */
    public static GameData newGame(int gameId, int secretNumber)
    {
        return new GameData(gameId, secretNumber, GameState.NEW_GAME, List.of(), NO_PLAYER, 0, null);
    }

    /**
     * Returns the name of the player whose turn is next.
     *
     * @return the current player's name
     * @throws IllegalStateException if the game has not started
     */
    public String currentPlayerName()
    {
        if (currentPlayer == NO_PLAYER)
        {
            throw new IllegalStateException("No current player in state " + state);
        }
        return playerNames.get(currentPlayer);
    }

    /**
     * Returns how many players still have to join.
     *
     * @return missing player count
     */
    public int stillWaitingForPlayers()
    {
        return PLAYER_COUNT - playerNames.size();
    }

    GameData withPlayer(String playerName, GameState newState, int newCurrentPlayer)
    {
        List<String> names = new ArrayList<>(playerNames);
        names.add(playerName);
        return new GameData(gameId, secretNumber, newState, names, newCurrentPlayer, guessCount, null);
    }

    GameData withMissedGuess(int nextPlayer)
    {
        return new GameData(gameId, secretNumber, state, playerNames, nextPlayer, guessCount + 1, null);
    }

    GameData withWinner(String winner)
    {
        return new GameData(gameId, secretNumber, GameState.OVER, playerNames, currentPlayer, guessCount + 1, winner);
    }
}
