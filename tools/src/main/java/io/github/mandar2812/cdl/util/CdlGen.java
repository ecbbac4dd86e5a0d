package io.github.mandar2812.cdl.util;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.CdlException;
import io.github.mandar2812.cdl.CdlParser;
import io.github.mandar2812.cdl.FileFormat;
import io.github.mandar2812.cdl.backend.MemoryBackend;
import io.github.mandar2812.cdl.backend.MemoryDataset;

/**
 * Command-line CDL compiler.
 * Parses a CDL file into an in-memory dataset, reporting any errors,
 * and optionally lists the resulting dataset as CDL text.
 * Intended to be used from the commandline via the <code>main</code> method.
 *
 * @since    17 Oct 2026
 */
public class CdlGen {

    private static final Logger logger_ =
        Logger.getLogger( CdlGen.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private CdlGen() {
    }

    /**
     * Does the work for the command line tool, handling arguments.
     * Success is indicated by the return value.
     *
     * @param  args   command-line arguments
     * @return   0 for success, non-zero for failure
     */
    public static int runMain( String[] args ) throws IOException {
        return runMain( args, System.out, System.err );
    }

    /**
     * Does the work for the command line tool with given output streams.
     *
     * @param  args   command-line arguments
     * @param  out   destination for listing and usage output
     * @param  err   destination for error messages
     * @return   0 for success, 1 for bad usage, 2 for a CDL error
     */
    static int runMain( String[] args, PrintStream out, PrintStream err )
            throws IOException {

        // Usage string.
        String usage = new StringBuffer()
           .append( "\n   Usage: " )
           .append( CdlGen.class.getName() )
           .append( " [-help]" )
           .append( " [-verbose|-v]" )
           .append( " [+verbose|+v]" )
           .append( " [-strict]" )
           .append( " [-format <name>]" )
           .append( " [-o <ncfile>]" )
           .append( " [-list]" )
           .append( " <cdl-file>" )
           .append( "\n" )
           .toString();

        // Process arguments.
        List<String> argList = new ArrayList<String>( Arrays.asList( args ) );
        File file = null;
        String outPath = null;
        FileFormat format = CdlParser.DEFAULT_FORMAT;
        boolean strict = false;
        boolean list = false;
        int verb = 0;
        for ( Iterator<String> it = argList.iterator(); it.hasNext(); ) {
            String arg = it.next();
            if ( arg.startsWith( "-h" ) ) {
                it.remove();
                out.println( usage );
                return 0;
            }
            else if ( arg.equals( "-verbose" ) || arg.equals( "-v" ) ) {
                it.remove();
                verb++;
            }
            else if ( arg.equals( "+verbose" ) || arg.equals( "+v" ) ) {
                it.remove();
                verb--;
            }
            else if ( arg.equals( "-strict" ) ) {
                it.remove();
                strict = true;
            }
            else if ( arg.equals( "-list" ) ) {
                it.remove();
                list = true;
            }
            else if ( arg.equals( "-format" ) && it.hasNext() ) {
                it.remove();
                String fname = it.next();
                it.remove();
                try {
                    format = FileFormat.forName( fname );
                }
                catch ( IllegalArgumentException e ) {
                    err.println( e.getMessage() );
                    err.println( usage );
                    return 1;
                }
            }
            else if ( arg.equals( "-o" ) && it.hasNext() ) {
                it.remove();
                outPath = it.next();
                it.remove();
            }
            else if ( file == null && ! arg.startsWith( "-" ) ) {
                it.remove();
                file = new File( arg );
            }
        }

        // Validate arguments.
        if ( ! argList.isEmpty() ) {
            err.println( "Unused args: " + argList );
            err.println( usage );
            return 1;
        }
        if ( file == null ) {
            err.println( usage );
            return 1;
        }

        // Configure and run.
        LogUtil.setVerbosity( verb );
        String path = outPath == null ? CdlParser.getDefaultOutputPath( file )
                                      : outPath;
        MemoryBackend backend = new MemoryBackend();
        CdlParser parser = new CdlParser( backend, format, strict );
        try {
            parser.parse( file, path );
        }
        catch ( CdlException e ) {
            err.println( file + ": " + e.getMessage() );
            return 2;
        }
        logger_.info( "Compiled " + file + " to " + path + " ("
                    + format.getFormatName() + ")" );
        if ( list ) {
            MemoryDataset dataset = backend.getDataset( path );
            new CdlList( dataset, out, true ).run();
        }
        return 0;
    }

    /**
     * Main method.  Use -help for arguments.
     */
    public static void main( String[] args ) throws IOException {
        int status = runMain( args );
        if ( status != 0 ) {
            System.exit( status );
        }
    }
}
