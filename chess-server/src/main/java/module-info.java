/**
 * Chess session and matchmaking server module.
 *
 * <p>Pairs waiting connections into games, relays moves between the two
 * players and referees each game with the rules engine.</p>
 */
module chess.server
{
    requires transitive chess.api;
    requires chess.engine;
    requires org.slf4j;

    exports org.abstractica.chess.server;
}
