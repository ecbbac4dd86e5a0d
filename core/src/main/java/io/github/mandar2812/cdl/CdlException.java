package io.github.mandar2812.cdl;

import java.io.IOException;

/**
 * Superclass of the exceptions thrown when CDL text cannot be turned
 * into a dataset, either because it is not grammatical or because
 * it describes content that violates the netCDF-3 data model.
 *
 * <p>Failures of the dataset backend itself are not reported using
 * this class; they are passed on as the backend's own IOExceptions.
 *
 * @since    14 Oct 2026
 */
public class CdlException extends IOException {

    private final int line_;

    /**
     * Constructs an exception with a message and no line information.
     *
     * @param  msg  message
     */
    public CdlException( String msg ) {
        this( msg, -1 );
    }

    /**
     * Constructs an exception with a message and source line.
     *
     * @param  msg  message
     * @param  line  1-based line number in the CDL source,
     *               or -1 if not known
     */
    public CdlException( String msg, int line ) {
        super( line > 0 ? msg + " (line " + line + ")" : msg );
        line_ = line;
    }

    /**
     * Constructs an exception with a message and a cause.
     *
     * @param  msg  message
     * @param  cause   upstream exception
     */
    public CdlException( String msg, Throwable cause ) {
        this( msg );
        initCause( cause );
    }

    /**
     * Returns the source line at which the problem was found.
     *
     * @return  1-based line number, or -1 if not known
     */
    public int getLine() {
        return line_;
    }
}
