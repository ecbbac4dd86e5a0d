package io.github.mandar2812.cdl;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.backend.DatasetBackend;
import io.github.mandar2812.cdl.backend.WritableDataset;

/**
 * Turns recognised CDL declarations into requests on a dataset backend.
 *
 * <p>The parser calls the methods of this class as soon as each
 * declaration has been read, so there is no intermediate syntax tree.
 * The builder enforces the netCDF-3 data model constraints
 * (unique names, at most one unlimited dimension, declared references,
 * values in range) and throws a {@link CdlContentException} when
 * they are violated.  Failures reported by the backend itself
 * are passed on unchanged.
 *
 * <p>An instance is good for a single dataset.
 *
 * @since    16 Oct 2026
 */
public class DatasetBuilder {

    private final DatasetBackend backend_;
    private final String path_;
    private final FileFormat format_;
    private final Map<String,Integer> dimMap_;
    private final Map<String,VarInfo> varMap_;
    private WritableDataset dataset_;
    private String datasetName_;
    private String unlimitedDim_;
    private VarInfo currentVar_;
    private DataType pendingType_;
    private boolean ended_;

    private static final String FILL_VALUE_ATT = "_FillValue";

    private static final Logger logger_ =
        Logger.getLogger( DatasetBuilder.class.getName() );

    /**
     * Constructor.
     *
     * @param  backend  backend which will store the dataset
     * @param  path     location of the dataset to create
     * @param  format   container format of the dataset to create
     */
    public DatasetBuilder( DatasetBackend backend, String path,
                           FileFormat format ) {
        backend_ = backend;
        path_ = path;
        format_ = format;
        dimMap_ = new LinkedHashMap<String,Integer>();
        varMap_ = new LinkedHashMap<String,VarInfo>();
    }

    /**
     * Opens the output dataset.
     *
     * @param  name  dataset name given after the <code>netcdf</code> keyword
     * @throws  IOException  if the backend cannot create the dataset
     */
    public void beginDataset( String name ) throws IOException {
        if ( dataset_ != null ) {
            throw new IllegalStateException( "Dataset already begun" );
        }
        datasetName_ = name;
        dataset_ = backend_.create( path_, format_ );
        logger_.info( "Initialised dataset " + name + " at " + path_ );
    }

    /**
     * Declares a fixed-length dimension.
     *
     * @param  name  dimension name
     * @param  length   dimension length, which must be positive
     */
    public void declareDimension( String name, long length )
            throws IOException {
        checkNewDimension( name );
        if ( length <= 0 ) {
            throw new CdlContentException( "Length of dimension '" + name
                                         + "' must be positive" );
        }
        if ( length > Integer.MAX_VALUE ) {
            throw new CdlContentException( "Length " + length
                                         + " of dimension '" + name
                                         + "' is too large" );
        }
        getDataset().createDimension( name, (int) length );
        dimMap_.put( name, Integer.valueOf( (int) length ) );
        logger_.info( "Created dimension " + name + " with length "
                    + length );
    }

    /**
     * Declares the unlimited (record) dimension.
     *
     * @param  name  dimension name
     */
    public void declareUnlimitedDimension( String name ) throws IOException {
        checkNewDimension( name );
        if ( unlimitedDim_ != null ) {
            throw new CdlContentException( "Only one UNLIMITED dimension "
                                         + "is allowed (already have '"
                                         + unlimitedDim_ + "')" );
        }
        getDataset().createDimension( name, 0 );
        dimMap_.put( name, Integer.valueOf( 0 ) );
        unlimitedDim_ = name;
        logger_.info( "Created dimension " + name + " with length 0"
                    + " (unlimited)" );
    }

    /**
     * Sets the data type used by subsequent calls to
     * {@link #declareVariable(java.lang.String,java.lang.String[])}.
     *
     * @param  type  data type from a type keyword
     */
    public void setPendingType( DataType type ) {
        pendingType_ = type;
    }

    /**
     * Declares a variable with the pending data type.
     *
     * @param  name  variable name
     * @param  dimNames  names of already-declared dimensions,
     *                   slowest varying first; empty for a scalar
     */
    public void declareVariable( String name, String[] dimNames )
            throws IOException {
        if ( pendingType_ == null ) {
            throw new IllegalStateException( "No data type set for variable "
                                           + name );
        }
        declareVariable( pendingType_, name, dimNames );
    }

    /**
     * Declares a variable with a given data type.
     * It becomes the current variable.
     *
     * @param  type  data type
     * @param  name  variable name
     * @param  dimNames  names of already-declared dimensions,
     *                   slowest varying first; empty for a scalar
     */
    public void declareVariable( DataType type, String name,
                                 String[] dimNames ) throws IOException {
        if ( varMap_.containsKey( name ) ) {
            throw new CdlContentException( "Duplicate declaration of "
                                         + "variable '" + name + "'" );
        }
        int[] dimLengths = new int[ dimNames.length ];
        for ( int i = 0; i < dimNames.length; i++ ) {
            String dimName = dimNames[ i ];
            Integer leng = dimMap_.get( dimName );
            if ( leng == null ) {
                throw new CdlContentException( "Dimension '" + dimName
                                             + "' of variable '" + name
                                             + "' has not been declared" );
            }
            if ( dimName.equals( unlimitedDim_ ) && i > 0 ) {
                throw new CdlContentException( "Unlimited dimension '"
                                             + dimName + "' must be first"
                                             + " for variable '" + name
                                             + "'" );
            }
            dimLengths[ i ] = leng.intValue();
        }
        getDataset().createVariable( name, type, dimNames.clone() );
        VarInfo var = new VarInfo( name, type, dimLengths,
                                   dimNames.length > 0 &&
                                   dimNames[ 0 ].equals( unlimitedDim_ ) );
        varMap_.put( name, var );
        currentVar_ = var;
        logger_.info( "Created variable " + name + " with data type "
                    + type + " and dimensions "
                    + Arrays.toString( dimNames ) );
    }

    /**
     * Sets a global attribute.
     *
     * @param  name  attribute name
     * @param  constants   attribute values as supplied by the lexer
     */
    public void setGlobalAttribute( String name, List<Object> constants )
            throws IOException {
        AttributeValue value = AttributeValue.fromConstants( constants );
        getDataset().setAttribute( null, name, value );
        logger_.info( "Created global attribute " + name + "=" + value );
    }

    /**
     * Sets an attribute on a declared variable, which becomes
     * the current variable.
     * A <code>_FillValue</code> attribute must be a single item of the
     * variable's data type, and becomes its effective fill value.
     *
     * @param  varName  variable name
     * @param  name  attribute name
     * @param  constants   attribute values as supplied by the lexer
     */
    public void setVariableAttribute( String varName, String name,
                                      List<Object> constants )
            throws IOException {
        VarInfo var = getVariable( varName );
        currentVar_ = var;
        AttributeValue value = AttributeValue.fromConstants( constants );
        if ( FILL_VALUE_ATT.equals( name ) ) {
            if ( value.getDataType() != var.type_ ||
                 value.getItemCount() != 1 ) {
                throw new CdlContentException( FILL_VALUE_ATT + " for "
                                             + var.type_ + " variable '"
                                             + varName + "' must be a"
                                             + " single " + var.type_
                                             + " value, not " + value );
            }
            var.fillValue_ = value.getItem( 0 );
        }
        getDataset().setAttribute( varName, name, value );
        logger_.info( "Created attribute " + varName + ":" + name + "="
                    + value );
    }

    /**
     * Writes the data values for a declared variable, which becomes
     * the current variable.  If fewer values are supplied than the
     * variable holds, the backend fills the rest.
     *
     * @param  varName  variable name
     * @param  constants  values as supplied by the lexer, in row-major
     *                    order; may include {@link FillMarker#INSTANCE}
     */
    public void writeData( String varName, List<Object> constants )
            throws IOException {
        VarInfo var = getVariable( varName );
        currentVar_ = var;
        Object array = var.type_ == DataType.CHAR
                     ? toCharArray( var, constants )
                     : toNumericArray( var, constants );
        int count = Array.getLength( array );
        if ( ! var.isRecord_ && count > var.getElementCount() ) {
            throw new CdlContentException( "Too many values (" + count
                                         + ") for variable '" + varName
                                         + "' of size "
                                         + var.getElementCount() );
        }
        getDataset().writeVariableData( varName, array );
        logger_.info( "Set data values for variable " + varName );
    }

    /**
     * Closes the output dataset.  Calling this more than once,
     * or before the dataset has been begun, has no effect.
     */
    public void endDataset() throws IOException {
        if ( dataset_ != null && ! ended_ ) {
            ended_ = true;
            dataset_.close();
            logger_.info( "Closed dataset " + datasetName_ );
        }
    }

    /**
     * Returns the dataset being written.
     *
     * @return  output dataset, or null if not yet begun
     */
    public WritableDataset getWritableDataset() {
        return dataset_;
    }

    /**
     * Returns the number of dimensions declared so far.
     *
     * @return  dimension count
     */
    public int getDimensionCount() {
        return dimMap_.size();
    }

    /**
     * Returns the name of the variable most recently declared or
     * referred to.
     *
     * @return  current variable name, or null
     */
    public String getCurrentVariable() {
        return currentVar_ == null ? null : currentVar_.name_;
    }

    /**
     * Returns the name of the unlimited dimension.
     *
     * @return  unlimited dimension name, or null if none declared
     */
    public String getUnlimitedDimension() {
        return unlimitedDim_;
    }

    /**
     * Returns the fill value currently in effect for a declared variable.
     *
     * @param  varName  variable name
     * @return  fill value, an instance of the variable type's scalar class
     */
    public Object getFillValue( String varName ) throws CdlContentException {
        return getVariable( varName ).fillValue_;
    }

    private WritableDataset getDataset() {
        if ( dataset_ == null ) {
            throw new IllegalStateException( "Dataset not begun" );
        }
        if ( ended_ ) {
            throw new IllegalStateException( "Dataset already ended" );
        }
        return dataset_;
    }

    private void checkNewDimension( String name )
            throws CdlContentException {
        if ( dimMap_.containsKey( name ) ) {
            throw new CdlContentException( "Duplicate declaration for "
                                         + "dimension '" + name + "'" );
        }
    }

    private VarInfo getVariable( String name ) throws CdlContentException {
        VarInfo var = varMap_.get( name );
        if ( var == null ) {
            throw new CdlContentException( "Variable '" + name
                                         + "' has not been declared" );
        }
        return var;
    }

    /**
     * Converts data constants for a numeric variable.
     * The fill marker stands for the effective fill value.
     */
    private static Object toNumericArray( VarInfo var, List<Object> constants )
            throws CdlContentException {
        int n = constants.size();
        Object array = var.type_.createArray( n );
        for ( int i = 0; i < n; i++ ) {
            Object c = constants.get( i );
            if ( c instanceof FillMarker ) {
                var.type_.fill( array, i, i + 1, var.fillValue_ );
            }
            else {
                try {
                    var.type_.setValue( array, i, c );
                }
                catch ( CdlContentException e ) {
                    throw new CdlContentException( e.getMessage()
                                                 + " in data for variable '"
                                                 + var.name_ + "'", e );
                }
            }
        }
        return array;
    }

    /**
     * Converts data constants for a character variable.
     * Strings of a variable with two or more dimensions are each
     * padded with NULs to a multiple of the last dimension length;
     * otherwise they are simply concatenated.  Byte constants supply
     * single characters and the fill marker is a literal underscore.
     */
    private static char[] toCharArray( VarInfo var, List<Object> constants )
            throws CdlContentException {
        int rank = var.dimLengths_.length;
        int rowLeng = rank >= 2 ? var.dimLengths_[ rank - 1 ] : 0;
        StringBuilder sbuf = new StringBuilder();
        for ( Object c : constants ) {
            if ( c instanceof String ) {
                String s = (String) c;
                sbuf.append( s );
                if ( rowLeng > 0 ) {
                    int rem = s.length() % rowLeng;
                    if ( rem > 0 || s.length() == 0 ) {
                        int npad = s.length() == 0 ? rowLeng : rowLeng - rem;
                        for ( int i = 0; i < npad; i++ ) {
                            sbuf.append( DataType.FILL_CHAR );
                        }
                    }
                }
            }
            else if ( c instanceof FillMarker ) {
                sbuf.append( FillMarker.TEXT );
            }
            else {
                char[] single = new char[ 1 ];
                try {
                    DataType.CHAR.setValue( single, 0, c );
                }
                catch ( CdlContentException e ) {
                    throw new CdlContentException( e.getMessage()
                                                 + " in data for variable '"
                                                 + var.name_ + "'", e );
                }
                sbuf.append( single[ 0 ] );
            }
        }
        return sbuf.toString().toCharArray();
    }

    /**
     * Builder's record of a declared variable.
     */
    private static class VarInfo {
        final String name_;
        final DataType type_;
        final int[] dimLengths_;
        final boolean isRecord_;
        Object fillValue_;

        VarInfo( String name, DataType type, int[] dimLengths,
                 boolean isRecord ) {
            name_ = name;
            type_ = type;
            dimLengths_ = dimLengths;
            isRecord_ = isRecord;
            fillValue_ = type.getDefaultFillValue();
        }

        /**
         * Returns the number of elements of a fixed-size variable.
         * Classic-format variables may exceed the int range.
         */
        long getElementCount() {
            long count = 1;
            for ( int leng : dimLengths_ ) {
                count *= leng;
            }
            return count;
        }
    }
}
