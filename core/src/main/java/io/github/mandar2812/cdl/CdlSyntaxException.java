package io.github.mandar2812.cdl;

/**
 * Exception thrown when CDL text does not conform to the grammar:
 * an unexpected token, a missing required construct such as the
 * dataset name, or (when lexing strictly) an unrecognised character.
 *
 * @since    14 Oct 2026
 */
public class CdlSyntaxException extends CdlException {

    /**
     * Constructs an exception with a message.
     *
     * @param  msg  message
     */
    public CdlSyntaxException( String msg ) {
        super( msg );
    }

    /**
     * Constructs an exception with a message and source line.
     *
     * @param  msg  message
     * @param  line  1-based source line, or -1
     */
    public CdlSyntaxException( String msg, int line ) {
        super( msg, line );
    }
}
