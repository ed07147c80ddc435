package org.abstractica.chess.engine.rules;

/**
 * Thrown when a promotion is requested while none is pending, or to a
 * piece kind a pawn cannot become.
 */
public class InvalidPromotionException extends RuntimeException
{
    public InvalidPromotionException(String message)
    {
        super(message);
    }
}
