package org.abstractica.demo.console;

import org.abstractica.guessinggame.GameHost;
import org.abstractica.guessinggame.GameHostFactory;
import org.abstractica.guessinggame.GameSession;
import org.abstractica.guessinggame.Request;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.impl.secret.FixedSecretNumberGenerator;
import org.abstractica.guessinggame.impl.session.DefaultGameHostFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hot-seat console host for the guessing game.
 *
 * <p>Both players share one terminal and take turns typing commands. Each
 * command is one request; its responses are printed straight away, which
 * is the console's way of delivering them to the player who asked.</p>
 */
public class GuessingGameConsole
{
    private static final Logger LOG = LoggerFactory.getLogger(GuessingGameConsole.class);

    private final GameHost host;
    private final PrintStream out;
    private int currentGameId = ConsoleCommand.CURRENT_GAME;

    public GuessingGameConsole(GameHost host, PrintStream out)
    {
        this.host = host;
        this.out = out;
    }

    /**
     * Reads and executes commands until {@code quit} or end of input.
     *
     * @param in the command source
     */
    public void runCommandLoop(BufferedReader in)
    {
        out.println(ConsoleCommand.USAGE);

        try
        {
            String line;
            while ((line = in.readLine()) != null)
            {
                if (!execute(ConsoleCommand.parse(line)))
                {
                    out.println("Bye");
                    return;
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    /**
     * Executes one command.
     *
     * @param command the command
     * @return false if the console should exit
     */
    boolean execute(ConsoleCommand command)
    {
        if (command instanceof ConsoleCommand.NewGame)
        {
            GameSession session = host.create();
            currentGameId = session.getId();
            out.println("Created game " + session.getId());
        }
        else if (command instanceof ConsoleCommand.Introduce introduce)
        {
            sendAndPrint(introduce.gameId(), new Request.Introduce(introduce.playerName()));
        }
        else if (command instanceof ConsoleCommand.Guess guess)
        {
            sendAndPrint(guess.gameId(), new Request.Guess(guess.playerName(), guess.value()));
        }
        else if (command instanceof ConsoleCommand.ListGames)
        {
            listGames();
        }
        else if (command instanceof ConsoleCommand.StopGame stop)
        {
            stopGame(stop.gameId());
        }
        else if (command instanceof ConsoleCommand.Help)
        {
            out.println(ConsoleCommand.USAGE);
        }
        else if (command instanceof ConsoleCommand.Invalid invalid)
        {
            out.println(invalid.message());
        }
        else if (command instanceof ConsoleCommand.Quit)
        {
            return false;
        }
        return true;
    }

    private void sendAndPrint(int requestedGameId, Request request)
    {
        int gameId = requestedGameId == ConsoleCommand.CURRENT_GAME ? currentGameId : requestedGameId;
        Optional<GameSession> session = host.getSession(gameId);
        if (session.isEmpty())
        {
            out.println(gameId == ConsoleCommand.CURRENT_GAME
                    ? "No game yet, type 'new' first"
                    : "No such game: " + gameId);
            return;
        }

        for (Response response : host.send(session.get(), request))
        {
            out.println(describe(response));
        }
    }

    private void listGames()
    {
        List<GameSession> sessions = new ArrayList<>(host.getSessions());
        if (sessions.isEmpty())
        {
            out.println("No games");
            return;
        }
        sessions.sort(Comparator.comparingInt(GameSession::getId));
        out.println("Games:");
        for (GameSession session : sessions)
        {
            out.printf("  %d%s%n", session.getId(), session.getId() == currentGameId ? " (current)" : "");
        }
    }

    private void stopGame(int gameId)
    {
        if (host.stop(gameId))
        {
            out.println("Stopped game " + gameId);
            if (gameId == currentGameId)
            {
                currentGameId = ConsoleCommand.CURRENT_GAME;
            }
        }
        else
        {
            out.println("No such game: " + gameId);
        }
    }

    /**
     * Renders a response for the console.
     *
     * @param response the response
     * @return one line of text
     */
    static String describe(Response response)
    {
        String prefix = "[game " + response.gameId() + "] ";
        if (response instanceof Response.NotReady notReady)
        {
            return prefix + "Not ready, waiting for " + notReady.stillWaitingForPlayers()
                    + (notReady.stillWaitingForPlayers() == 1 ? " more player" : " more players");
        }
        if (response instanceof Response.Ready)
        {
            return prefix + "Ready!";
        }
        if (response instanceof Response.YourTurn yourTurn)
        {
            return prefix + yourTurn.playerName() + ", your turn";
        }
        if (response instanceof Response.NotYourTurn notYourTurn)
        {
            return prefix + "Not your turn, it is " + notYourTurn.otherPlayerName() + "'s turn";
        }
        if (response instanceof Response.GameInProgress)
        {
            return prefix + "Game already in progress";
        }
        if (response instanceof Response.NopeTryAgain nope)
        {
            return prefix + "Nope, " + nope.incorrectValue() + " is wrong. Go "
                    + nope.hint().name().toLowerCase() + ". Next: " + nope.nextPlayerName();
        }
        if (response instanceof Response.Won won)
        {
            return prefix + won.winningPlayerName() + " wins with " + won.winningGuess()
                    + " after " + won.guessCount() + " guesses";
        }
        if (response instanceof Response.GameOver over)
        {
            return prefix + "Game over: " + over.winningPlayerName() + " won with " + over.winningGuess()
                    + " after " + over.guessCount() + " guesses";
        }
        return prefix + response;
    }

    public static void main(String[] args)
    {
        GameHostFactory.Builder builder = new DefaultGameHostFactory().builder();

        for (int i = 0; i < args.length; i++)
        {
            String option = args[i];
            if ((option.equals("--max") || option.equals("--secret")) && i + 1 < args.length)
            {
                int value;
                try
                {
                    value = Integer.parseInt(args[++i]);
                }
                catch (NumberFormatException e)
                {
                    System.err.println("Invalid number for " + option + ": " + args[i]);
                    System.exit(1);
                    return;
                }

                if (option.equals("--max"))
                {
                    builder.maxSecretNumber(value);
                }
                else
                {
                    builder.secretNumberGenerator(new FixedSecretNumberGenerator(value));
                }
            }
            else
            {
                System.err.println("Usage: GuessingGameConsole [--max <n>] [--secret <n>]");
                System.exit(1);
                return;
            }
        }

        try (GameHost host = builder.build())
        {
            GuessingGameConsole console = new GuessingGameConsole(host, System.out);
            console.runCommandLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
    }
}
