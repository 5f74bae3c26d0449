package org.abstractica.demo.console;

import java.util.Objects;

/**
 * Commands typed at the console.
 *
 * <p>A command may be prefixed with {@code @<id>} to address a specific
 * game; without it the most recently created game is used.</p>
 */
public sealed interface ConsoleCommand permits
        ConsoleCommand.NewGame,
        ConsoleCommand.Introduce,
        ConsoleCommand.Guess,
        ConsoleCommand.ListGames,
        ConsoleCommand.StopGame,
        ConsoleCommand.Help,
        ConsoleCommand.Quit,
        ConsoleCommand.Empty,
        ConsoleCommand.Invalid
{
    /**
     * Marker for "no game given, use the current one".
     */
    int CURRENT_GAME = -1;

    String USAGE = String.join(System.lineSeparator(),
            "Commands:",
            "  new                        create a game",
            "  [@id] intro <name>         introduce a player",
            "  [@id] guess <name> <n>     guess the secret number",
            "  list                       list games",
            "  stop <id>                  stop a game",
            "  help                       show this text",
            "  quit                       exit");

    record NewGame() implements ConsoleCommand {}

    /**
     * @param gameId     target game, or {@link #CURRENT_GAME}
     * @param playerName the player to introduce
     */
    record Introduce(int gameId, String playerName) implements ConsoleCommand {}

    /**
     * @param gameId     target game, or {@link #CURRENT_GAME}
     * @param playerName the guessing player
     * @param value      the guess
     */
    record Guess(int gameId, String playerName, int value) implements ConsoleCommand {}

    record ListGames() implements ConsoleCommand {}

    /**
     * @param gameId the game to stop
     */
    record StopGame(int gameId) implements ConsoleCommand {}

    record Help() implements ConsoleCommand {}

    record Quit() implements ConsoleCommand {}

    record Empty() implements ConsoleCommand {}

    /**
     * @param message what was wrong with the input
     */
    record Invalid(String message) implements ConsoleCommand {}

    /**
     * Parses one line of input.
     *
     * @param line the input line
     * @return the command; never null
     */
    static ConsoleCommand parse(String line)
    {
        Objects.requireNonNull(line, "line");
        String rest = line.trim();
        if (rest.isEmpty())
        {
            return new Empty();
        }

        int gameId = CURRENT_GAME;
        if (rest.startsWith("@"))
        {
            String[] prefixed = rest.split("\\s+", 2);
            Integer parsed = parseInt(prefixed[0].substring(1));
            if (parsed == null || parsed <= 0)
            {
                return new Invalid("Invalid game id: " + prefixed[0]);
            }
            gameId = parsed;
            rest = prefixed.length > 1 ? prefixed[1] : "";
            if (rest.isEmpty())
            {
                return new Invalid("Missing command after " + prefixed[0]);
            }
        }

        String[] parts = rest.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String args = parts.length > 1 ? parts[1].trim() : "";

        return switch (command)
        {
            case "new" -> noArgs(command, args, gameId, new NewGame());
            case "intro", "introduce" -> args.isEmpty()
                    ? new Invalid("Usage: intro <name>")
                    : new Introduce(gameId, args);
            case "guess" -> parseGuess(gameId, args);
            case "list" -> noArgs(command, args, gameId, new ListGames());
            case "stop" -> parseStop(gameId, args);
            case "help", "?" -> new Help();
            case "quit", "exit", "q" -> new Quit();
            default -> new Invalid("Unknown command: " + command);
        };
    }

    private static ConsoleCommand parseGuess(int gameId, String args)
    {
        int split = args.lastIndexOf(' ');
        if (split < 0)
        {
            return new Invalid("Usage: guess <name> <n>");
        }
        String playerName = args.substring(0, split).trim();
        Integer value = parseInt(args.substring(split + 1));
        if (playerName.isEmpty() || value == null)
        {
            return new Invalid("Usage: guess <name> <n>");
        }
        return new Guess(gameId, playerName, value);
    }

    private static ConsoleCommand parseStop(int gameId, String args)
    {
        if (args.isEmpty())
        {
            return gameId != CURRENT_GAME ? new StopGame(gameId) : new Invalid("Usage: stop <id>");
        }
        Integer stopId = parseInt(args);
        if (stopId == null || stopId <= 0 || gameId != CURRENT_GAME)
        {
            return new Invalid("Usage: stop <id>");
        }
        return new StopGame(stopId);
    }

    private static ConsoleCommand noArgs(String command, String args, int gameId, ConsoleCommand parsed)
    {
        if (!args.isEmpty() || gameId != CURRENT_GAME)
        {
            return new Invalid("'" + command + "' takes no arguments");
        }
        return parsed;
    }

    private static Integer parseInt(String text)
    {
        try
        {
            return Integer.parseInt(text.trim());
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }
}
