package io.github.mandar2812.cdl;

/**
 * Exception thrown when CDL text is grammatical but its content is
 * not acceptable, for instance a duplicate dimension name,
 * a numeric literal out of range for its type, or a reference to a
 * variable that has not been declared.
 *
 * @since    14 Oct 2026
 */
public class CdlContentException extends CdlException {

    /**
     * Constructs an exception with a message.
     *
     * @param  msg  message
     */
    public CdlContentException( String msg ) {
        super( msg );
    }

    /**
     * Constructs an exception with a message and source line.
     *
     * @param  msg  message
     * @param  line  1-based source line, or -1
     */
    public CdlContentException( String msg, int line ) {
        super( msg, line );
    }

    /**
     * Constructs an exception with a message and a cause.
     *
     * @param  msg  message
     * @param  cause  upstream exception
     */
    public CdlContentException( String msg, Throwable cause ) {
        super( msg, cause );
    }
}
