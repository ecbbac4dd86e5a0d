package io.github.mandar2812.cdl.util;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Utilities for controlling the logging output of the command-line tools.
 *
 * @since    17 Oct 2026
 */
public class LogUtil {

    /**
     * Private constructor prevents instantiation.
     */
    private LogUtil() {
    }

    /**
     * Returns the logging level corresponding to a verbosity count.
     * Each step is one standard level, so +1 is CONFIG, +2 is FINE,
     * -1 is WARNING and -2 is SEVERE.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     * @return  logging level
     */
    public static Level getLevel( int verbose ) {
        int ilevel = Level.INFO.intValue() - ( verbose * 100 );
        return Level.parse( Integer.toString( ilevel ) );
    }

    /**
     * Sets the logging verbosity of the root logger and ensures that
     * logging messages at that level are reported to the console
     * one line at a time.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, -1=WARNING)
     */
    public static void setVerbosity( int verbose ) {
        Level level = getLevel( verbose );
        Logger rootLogger = Logger.getLogger( "" );
        rootLogger.setLevel( level );

        // The default console handler squashes anything below INFO,
        // so its level has to be lowered as well as the logger's.
        Handler[] rootHandlers = rootLogger.getHandlers();
        for ( int i = 0; i < rootHandlers.length; i++ ) {
            Handler handler = rootHandlers[ i ];
            handler.setLevel( level );
            if ( handler instanceof ConsoleHandler ) {
                handler.setFormatter( new LineFormatter( verbose > 1 ) );
            }
        }
    }

    /**
     * Compact log record formatter.  Unlike the default
     * {@link java.util.logging.SimpleFormatter} this uses a single line
     * for each record.  If the record carries an exception, its
     * message is appended.
     */
    public static class LineFormatter extends Formatter {

        private final boolean debug_;

        /**
         * Constructor.
         *
         * @param   debug  iff true, appends the logging class and method
         *                 to each message
         */
        public LineFormatter( boolean debug ) {
            debug_ = debug;
        }

        public String format( LogRecord record ) {
            StringBuffer sbuf = new StringBuffer();
            sbuf.append( record.getLevel().toString() )
                .append( ": " )
                .append( formatMessage( record ) );
            Throwable error = record.getThrown();
            if ( error != null ) {
                sbuf.append( " [" )
                    .append( error.getMessage() == null
                           ? error.toString()
                           : error.getMessage() )
                    .append( ']' );
            }
            if ( debug_ ) {
                sbuf.append( " (" )
                    .append( record.getSourceClassName() )
                    .append( '.' )
                    .append( record.getSourceMethodName() )
                    .append( ')' );
            }
            sbuf.append( '\n' );
            return sbuf.toString();
        }
    }
}
