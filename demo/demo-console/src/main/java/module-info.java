/**
 * Console demo module.
 *
 * <p>Hosts guessing games for players sharing one terminal.</p>
 */
module demo.console
{
    requires guessinggame.api;
    requires guessinggame.impl;
    requires org.slf4j;
}
