package io.github.mandar2812.cdl.backend;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.AttributeValue;
import io.github.mandar2812.cdl.DataType;
import io.github.mandar2812.cdl.FileFormat;

/**
 * Dataset held entirely in memory.
 * As well as accepting write requests, it provides read access to
 * the dimensions, variables, attributes and data it has been given,
 * both while open and after it has been closed.
 *
 * <p>Requests which the netCDF library would reject, such as
 * references to unknown dimensions or variables, a second
 * unlimited dimension, or writes after closing, fail with an
 * IOException.  So do variables whose element count would not fit
 * in a java array, since their data could not be held.
 *
 * @since    15 Oct 2026
 */
public class MemoryDataset implements WritableDataset {

    private final String path_;
    private final FileFormat format_;
    private final Map<String,Dimension> dimMap_;
    private final Map<String,Variable> varMap_;
    private final Map<String,Attribute> attMap_;
    private boolean closed_;

    private static final Logger logger_ =
        Logger.getLogger( MemoryDataset.class.getName() );

    /**
     * Constructor.
     *
     * @param  path  dataset location
     * @param  format  container format
     */
    public MemoryDataset( String path, FileFormat format ) {
        path_ = path;
        format_ = format;
        dimMap_ = new LinkedHashMap<String,Dimension>();
        varMap_ = new LinkedHashMap<String,Variable>();
        attMap_ = new LinkedHashMap<String,Attribute>();
    }

    public String getPath() {
        return path_;
    }

    /**
     * Returns the format this dataset was created with.
     *
     * @return  format
     */
    public FileFormat getFormat() {
        return format_;
    }

    /**
     * Indicates whether this dataset has been closed.
     *
     * @return  true iff closed
     */
    public boolean isClosed() {
        return closed_;
    }

    public void createDimension( String name, int length )
            throws IOException {
        checkOpen();
        if ( dimMap_.containsKey( name ) ) {
            throw new IOException( "Dimension " + name + " already exists" );
        }
        if ( length < 0 ) {
            throw new IOException( "Negative length " + length
                                 + " for dimension " + name );
        }
        if ( length == 0 && getUnlimitedDimension() != null ) {
            throw new IOException( "Unlimited dimension already exists" );
        }
        dimMap_.put( name, new Dimension( name, length ) );
    }

    public void createVariable( String name, DataType dataType,
                                String[] dimNames ) throws IOException {
        checkOpen();
        if ( varMap_.containsKey( name ) ) {
            throw new IOException( "Variable " + name + " already exists" );
        }
        Dimension[] dims = new Dimension[ dimNames.length ];
        for ( int i = 0; i < dimNames.length; i++ ) {
            Dimension dim = dimMap_.get( dimNames[ i ] );
            if ( dim == null ) {
                throw new IOException( "No such dimension " + dimNames[ i ] );
            }
            if ( dim.isUnlimited() && i > 0 ) {
                throw new IOException( "Unlimited dimension " + dim.getName()
                                     + " must be first for variable "
                                     + name );
            }
            dims[ i ] = dim;
        }
        Variable var = new Variable( name, dataType, dims );
        try {
            var.getElementCount();
            var.getRecordSize();
        }
        catch ( ArithmeticException e ) {
            throw new IOException( "Variable " + name + " is too large"
                                 + " to hold in memory", e );
        }
        varMap_.put( name, var );
    }

    public void setAttribute( String varName, String attName,
                              AttributeValue value ) throws IOException {
        checkOpen();
        Attribute att = new Attribute( attName, value );
        if ( varName == null ) {
            attMap_.put( attName, att );
        }
        else {
            getExistingVariable( varName ).setAttribute( att );
        }
    }

    public void writeVariableData( String varName, Object rawValues )
            throws IOException {
        checkOpen();
        Variable var = getExistingVariable( varName );
        if ( rawValues.getClass().getComponentType()
             != var.getDataType().getArrayElementClass() ) {
            throw new IOException( "Wrong array type for " + var.getDataType()
                                 + " variable " + varName );
        }
        int count = Array.getLength( rawValues );
        if ( var.isRecordVariable() ) {
            int recSize = var.getRecordSize();
            int nrec = recSize == 0 ? 0 : ( count + recSize - 1 ) / recSize;
            checkRecordCount( nrec );
            var.getDimensions()[ 0 ].growTo( nrec );
        }
        else if ( count > var.getElementCount() ) {
            throw new IOException( "Too many values (" + count + " > "
                                 + var.getElementCount() + ") for variable "
                                 + varName );
        }
        Object copy = var.getDataType().createArray( count );
        System.arraycopy( rawValues, 0, copy, 0, count );
        var.setData( copy );
    }

    /**
     * Checks that every record variable could hold a given number
     * of records.
     *
     * @param  nrec  record count
     * @throws  IOException  if some record variable would be too large
     */
    private void checkRecordCount( int nrec ) throws IOException {
        for ( Variable var : varMap_.values() ) {
            if ( var.isRecordVariable() ) {
                try {
                    Math.multiplyExact( nrec, var.getRecordSize() );
                }
                catch ( ArithmeticException e ) {
                    throw new IOException( "Too many records (" + nrec
                                         + ") to hold variable "
                                         + var.getName() + " in memory",
                                           e );
                }
            }
        }
    }

    public void close() {
        if ( ! closed_ ) {
            closed_ = true;
            logger_.config( "Closed in-memory dataset " + path_ );
        }
    }

    /**
     * Returns the dimensions of this dataset.
     *
     * @return  dimension array, in order of definition
     */
    public Dimension[] getDimensions() {
        return dimMap_.values().toArray( new Dimension[ 0 ] );
    }

    /**
     * Returns a named dimension.
     *
     * @param  name  dimension name
     * @return  dimension, or null if none
     */
    public Dimension getDimension( String name ) {
        return dimMap_.get( name );
    }

    /**
     * Returns the unlimited dimension, if any.
     *
     * @return  unlimited dimension, or null
     */
    public Dimension getUnlimitedDimension() {
        for ( Dimension dim : dimMap_.values() ) {
            if ( dim.isUnlimited() ) {
                return dim;
            }
        }
        return null;
    }

    /**
     * Returns the variables of this dataset.
     *
     * @return  variable array, in order of definition
     */
    public Variable[] getVariables() {
        return varMap_.values().toArray( new Variable[ 0 ] );
    }

    /**
     * Returns a named variable.
     *
     * @param  name  variable name
     * @return  variable, or null if none
     */
    public Variable getVariable( String name ) {
        return varMap_.get( name );
    }

    /**
     * Returns the global attributes of this dataset.
     *
     * @return  attribute array, in order of first definition
     */
    public Attribute[] getGlobalAttributes() {
        return attMap_.values().toArray( new Attribute[ 0 ] );
    }

    /**
     * Returns a named global attribute.
     *
     * @param  name  attribute name
     * @return  attribute, or null if none
     */
    public Attribute getGlobalAttribute( String name ) {
        return attMap_.get( name );
    }

    private Variable getExistingVariable( String name ) throws IOException {
        Variable var = varMap_.get( name );
        if ( var == null ) {
            throw new IOException( "No such variable " + name );
        }
        return var;
    }

    private void checkOpen() throws IOException {
        if ( closed_ ) {
            throw new IOException( "Dataset " + path_ + " is closed" );
        }
    }
}
