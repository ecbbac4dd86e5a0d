package io.github.mandar2812.cdl.backend;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.FileFormat;

/**
 * Backend which keeps its datasets in memory, keyed by path.
 * Datasets remain available for reading after they have been closed.
 *
 * @since    15 Oct 2026
 */
public class MemoryBackend implements DatasetBackend {

    private final boolean clobber_;
    private final Map<String,MemoryDataset> datasets_;

    private static final Logger logger_ =
        Logger.getLogger( MemoryBackend.class.getName() );

    /**
     * Constructs a backend which overwrites existing datasets.
     */
    public MemoryBackend() {
        this( true );
    }

    /**
     * Constructor.
     *
     * @param  clobber  true to allow an existing dataset to be replaced
     *                  by a new one at the same path, false to fail
     */
    public MemoryBackend( boolean clobber ) {
        clobber_ = clobber;
        datasets_ = new LinkedHashMap<String,MemoryDataset>();
    }

    public MemoryDataset create( String path, FileFormat format )
            throws IOException {
        if ( path == null || path.trim().length() == 0 ) {
            throw new IOException( "No path given for dataset" );
        }
        if ( format == null ) {
            throw new IOException( "No format given for dataset " + path );
        }
        if ( datasets_.containsKey( path ) && ! clobber_ ) {
            throw new IOException( "Dataset " + path + " already exists" );
        }
        MemoryDataset dataset = new MemoryDataset( path, format );
        datasets_.put( path, dataset );
        logger_.config( "Created in-memory dataset " + path + " ("
                      + format.getFormatName() + ")" );
        return dataset;
    }

    /**
     * Returns the dataset most recently created at a given path.
     *
     * @param  path  dataset location
     * @return  dataset, or null if none
     */
    public MemoryDataset getDataset( String path ) {
        return datasets_.get( path );
    }

    /**
     * Returns the paths of all the datasets created by this backend.
     *
     * @return  path array, in order of first creation
     */
    public String[] getPaths() {
        return datasets_.keySet().toArray( new String[ 0 ] );
    }
}
