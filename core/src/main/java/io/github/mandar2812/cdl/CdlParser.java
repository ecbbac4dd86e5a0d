package io.github.mandar2812.cdl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.backend.DatasetBackend;
import io.github.mandar2812.cdl.backend.WritableDataset;
import io.github.mandar2812.cdl.lex.Lexer;

/**
 * Compiles CDL text into a dataset held by a pluggable backend.
 *
 * <p>This is the main entry point.  Each call to one of the parse
 * methods lexes and parses the text in a single pass, issuing
 * creation and write requests to the backend as declarations are
 * read.  The output dataset is closed before the method returns,
 * whether or not the parse succeeded.
 *
 * <p>Instances may be reused sequentially but are not thread-safe.
 *
 * <p>Example:
 * <pre>
 *    MemoryBackend backend = new MemoryBackend();
 *    new CdlParser( backend ).parseText( cdlText, "out.nc" );
 *    MemoryDataset ds = backend.getDataset( "out.nc" );
 * </pre>
 *
 * @since    16 Oct 2026
 */
public class CdlParser {

    private final DatasetBackend backend_;
    private final FileFormat format_;
    private final boolean strict_;
    private int nLexError_;

    /** Format used if none is specified. */
    public static final FileFormat DEFAULT_FORMAT = FileFormat.CLASSIC;

    private static final Logger logger_ =
        Logger.getLogger( CdlParser.class.getName() );

    /**
     * Constructs a permissive parser writing classic format datasets.
     *
     * @param  backend  dataset backend
     */
    public CdlParser( DatasetBackend backend ) {
        this( backend, DEFAULT_FORMAT, false );
    }

    /**
     * Constructor.
     *
     * @param  backend  dataset backend
     * @param  format   container format for output datasets
     * @param  strict   if true, unrecognised characters in the input
     *                  are fatal; if false they are logged and skipped
     */
    public CdlParser( DatasetBackend backend, FileFormat format,
                      boolean strict ) {
        backend_ = backend;
        format_ = format;
        strict_ = strict;
    }

    /**
     * Returns the output format.
     *
     * @return  format
     */
    public FileFormat getFormat() {
        return format_;
    }

    /**
     * Indicates whether lexical errors are fatal.
     *
     * @return  true for strict parsing
     */
    public boolean isStrict() {
        return strict_;
    }

    /**
     * Parses CDL text into a new dataset.
     *
     * @param  cdlText  complete CDL source
     * @param  outPath  location of the dataset to create
     * @return  the dataset handle obtained from the backend, now closed
     * @throws  CdlSyntaxException  if the text is not grammatical
     * @throws  CdlContentException  if the text describes invalid content
     * @throws  IOException  if the backend fails
     */
    public WritableDataset parseText( String cdlText, String outPath )
            throws IOException {
        Lexer lexer = new Lexer( cdlText, strict_ );
        DatasetBuilder builder =
            new DatasetBuilder( backend_, outPath, format_ );
        boolean ok = false;
        try {
            new GrammarParser( lexer, builder ).parseDataset();
            ok = true;
        }
        finally {
            nLexError_ = lexer.getErrorCount();
            if ( ok ) {
                builder.endDataset();
            }
            else {
                closeAfterError( builder );
            }
        }
        if ( nLexError_ > 0 ) {
            logger_.warning( nLexError_ + " illegal character"
                           + ( nLexError_ == 1 ? "" : "s" )
                           + " skipped in input for " + outPath );
        }
        return builder.getWritableDataset();
    }

    /**
     * Parses a CDL file into a new dataset.
     * The file is read as UTF-8.
     *
     * @param  cdlFile  CDL source file
     * @param  outPath  location of the dataset to create,
     *                  or null to use {@link #getDefaultOutputPath}
     * @return  the dataset handle obtained from the backend, now closed
     */
    public WritableDataset parse( File cdlFile, String outPath )
            throws IOException {
        String text = new String( Files.readAllBytes( cdlFile.toPath() ),
                                  StandardCharsets.UTF_8 );
        String path = outPath == null ? getDefaultOutputPath( cdlFile )
                                      : outPath;
        logger_.config( "Parsing " + cdlFile + " to " + path );
        return parseText( text, path );
    }

    /**
     * Returns the number of unrecognised characters skipped
     * during the most recent parse.
     *
     * @return  lexical error count
     */
    public int getLexicalErrorCount() {
        return nLexError_;
    }

    /**
     * Returns the output location conventionally associated with a
     * CDL file: the file's extension, if it has one, is replaced by
     * ".nc".  Leading dots of the file name do not start an extension.
     *
     * @param  cdlFile  CDL source file
     * @return  output path
     */
    public static String getDefaultOutputPath( File cdlFile ) {
        String path = cdlFile.getPath();
        int iname = path.lastIndexOf( File.separatorChar ) + 1;
        int istart = iname;
        while ( istart < path.length() && path.charAt( istart ) == '.' ) {
            istart++;
        }
        int idot = path.lastIndexOf( '.' );
        String base = idot > istart ? path.substring( 0, idot ) : path;
        return base + ".nc";
    }

    /**
     * Closes the builder's dataset while another exception is on its way
     * out, so that a failure to close does not hide the original error.
     */
    private static void closeAfterError( DatasetBuilder builder ) {
        try {
            builder.endDataset();
        }
        catch ( IOException | RuntimeException e ) {
            logger_.log( Level.WARNING,
                         "Failed to close dataset after parse error", e );
        }
    }
}
