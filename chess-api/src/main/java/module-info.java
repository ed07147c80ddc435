/**
 * Chess API module.
 *
 * <p>Board model value types, the client/server message protocol and the
 * game server interfaces shared by the engine, the server and the
 * transport that embeds them.</p>
 */
module chess.api
{
    exports org.abstractica.chess;
    exports org.abstractica.chess.handlers;
    exports org.abstractica.chess.protocol;
}
