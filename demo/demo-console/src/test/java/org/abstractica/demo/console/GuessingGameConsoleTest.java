package org.abstractica.demo.console;

import org.abstractica.guessinggame.GameHost;
import org.abstractica.guessinggame.Hint;
import org.abstractica.guessinggame.Response;
import org.abstractica.guessinggame.impl.id.AtomicIdAllocator;
import org.abstractica.guessinggame.impl.secret.FixedSecretNumberGenerator;
import org.abstractica.guessinggame.impl.session.DefaultGameHostFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the console with scripted input.
 */
class GuessingGameConsoleTest
{
    private GameHost host;
    private ByteArrayOutputStream output;
    private GuessingGameConsole console;

    @BeforeEach
    void setUp()
    {
        host = new DefaultGameHostFactory().builder()
                .idAllocator(new AtomicIdAllocator())
                .secretNumberGenerator(new FixedSecretNumberGenerator(5))
                .build();
        output = new ByteArrayOutputStream();
        console = new GuessingGameConsole(host, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown()
    {
        host.close();
    }

    private String run(String... lines)
    {
        console.runCommandLoop(new BufferedReader(new StringReader(String.join("\n", lines))));
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void fullGame_printsResponsesInOrder()
    {
        String text = run(
                "new",
                "intro Bo",
                "intro Fee",
                "guess Fee 3",
                "guess Bo 5",
                "guess Fee 1",
                "quit");

        assertTrue(text.contains("Created game 1"));
        assertTrue(text.contains("[game 1] Not ready, waiting for 1 more player"));
        assertTrue(text.contains("[game 1] Ready!"));
        assertTrue(text.contains("[game 1] Fee, your turn"));
        assertTrue(text.contains("[game 1] Nope, 3 is wrong. Go higher. Next: Bo"));
        assertTrue(text.contains("[game 1] Bo wins with 5 after 2 guesses"));
        assertTrue(text.contains("[game 1] Game over: Bo won with 5 after 2 guesses"));
        assertTrue(text.endsWith("Bye" + System.lineSeparator()));
    }

    @Test
    void commandsWithoutGame_askForNew()
    {
        String text = run("intro Bo");

        assertTrue(text.contains("No game yet, type 'new' first"));
    }

    @Test
    void prefix_addressesOlderGame()
    {
        String text = run("new", "new", "@1 intro Bo", "@7 intro Bo");

        assertTrue(text.contains("Created game 2"));
        assertTrue(text.contains("[game 1] Not ready, waiting for 1 more player"));
        assertTrue(text.contains("No such game: 7"));
    }

    @Test
    void listAndStop_manageGames()
    {
        String text = run("new", "new", "list", "stop 2", "stop 2", "list");

        assertTrue(text.contains("  2 (current)"));
        assertTrue(text.contains("Stopped game 2"));
        assertTrue(text.contains("No such game: 2"));
        assertTrue(host.getSession(2).isEmpty());
        assertTrue(host.getSession(1).isPresent());
    }

    @Test
    void stoppedCurrentGame_isForgotten()
    {
        String text = run("new", "stop 1", "intro Bo", "list");

        assertTrue(text.contains("No game yet, type 'new' first"));
        assertTrue(text.contains("No games"));
    }

    @Test
    void invalidInput_printsReason()
    {
        String text = run("dance");

        assertTrue(text.contains("Unknown command: dance"));
    }

    @Test
    void describe_coversRejections()
    {
        assertEquals("[game 3] Not your turn, it is Bo's turn",
                GuessingGameConsole.describe(new Response.NotYourTurn(3, "Bo")));
        assertEquals("[game 3] Game already in progress",
                GuessingGameConsole.describe(new Response.GameInProgress(3)));
        assertEquals("[game 3] Not ready, waiting for 2 more players",
                GuessingGameConsole.describe(new Response.NotReady(3, 2)));
        assertEquals("[game 3] Nope, 9 is wrong. Go lower. Next: Fee",
                GuessingGameConsole.describe(new Response.NopeTryAgain(3, "Fee", 9, Hint.LOWER)));
    }
}
