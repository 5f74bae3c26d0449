/**
 * Guessing game API module.
 *
 * <p>Defines the request/response protocol of a two-player guessing game
 * and the interfaces for hosting game sessions.</p>
 */
module guessinggame.api
{
    exports org.abstractica.guessinggame;
    exports org.abstractica.guessinggame.handlers;
}
