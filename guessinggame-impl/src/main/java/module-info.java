/**
 * Guessing game implementation module.
 *
 * <p>Provides the default implementation of the guessing game API.</p>
 */
module guessinggame.impl
{
    requires guessinggame.api;
    requires org.slf4j;

    exports org.abstractica.guessinggame.impl.id;
    exports org.abstractica.guessinggame.impl.secret;
    exports org.abstractica.guessinggame.impl.fsm;
    exports org.abstractica.guessinggame.impl.session;
}
