/**
 * Chess rules engine module.
 *
 * <p>Board representation, move legality, the game state machine, FEN
 * import/export and end-of-game detection.</p>
 */
module chess.engine
{
    requires transitive chess.api;
    requires org.slf4j;

    exports org.abstractica.chess.engine.board;
    exports org.abstractica.chess.engine.rules;
    exports org.abstractica.chess.engine.end;
}
