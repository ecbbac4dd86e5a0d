package io.github.mandar2812.cdl;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Enumerates the storage types supported by netCDF-3 datasets,
 * and knows how to store CDL constants in arrays of each type.
 *
 * <p>Each type has a corresponding primitive array class which holds
 * raw values (<code>byte[]</code>, <code>char[]</code>,
 * <code>short[]</code>, <code>int[]</code>, <code>float[]</code>
 * or <code>double[]</code>), and a default fill value as defined
 * by the netCDF library.
 *
 * @since    14 Oct 2026
 */
public abstract class DataType {

    private final String name_;
    private final int byteCount_;
    private final Class<?> arrayElementClass_;
    private final Class<?> scalarClass_;
    private final Object dfltFillValue_;

    /** Default fill value for byte data. */
    public static final byte FILL_BYTE = -127;

    /** Default fill value for character data. */
    public static final char FILL_CHAR = '\0';

    /** Default fill value for short data. */
    public static final short FILL_SHORT = -32767;

    /** Default fill value for int data. */
    public static final int FILL_INT = -2147483647;

    /** Default fill value for float data. */
    public static final float FILL_FLOAT = 9.9692099683868690e+36f;

    /** Default fill value for double data. */
    public static final double FILL_DOUBLE = 9.9692099683868690e+36;

    public static final DataType BYTE = new ByteDataType();
    public static final DataType CHAR = new CharDataType();
    public static final DataType SHORT = new ShortDataType();
    public static final DataType INT = new IntDataType();
    public static final DataType FLOAT = new FloatDataType();
    public static final DataType DOUBLE = new DoubleDataType();

    private static final DataType[] ALL_TYPES = {
        BYTE, CHAR, SHORT, INT, FLOAT, DOUBLE,
    };

    /**
     * Constructor.
     *
     * @param  name  type name, as used in CDL type declarations
     * @param  byteCount  number of bytes to store one item
     * @param  arrayElementClass  component class of the raw value array
     * @param  scalarClass   object type returned by <code>getScalar</code>
     * @param  dfltFillValue  default fill value, of type scalarClass
     */
    private DataType( String name, int byteCount, Class<?> arrayElementClass,
                      Class<?> scalarClass, Object dfltFillValue ) {
        name_ = name;
        byteCount_ = byteCount;
        arrayElementClass_ = arrayElementClass;
        scalarClass_ = scalarClass;
        dfltFillValue_ = dfltFillValue;
    }

    /**
     * Returns the canonical CDL name for this data type.
     *
     * @return  data type name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the number of bytes used to store a single item of this type.
     *
     * @return  size in bytes
     */
    public int getByteCount() {
        return byteCount_;
    }

    /**
     * Returns the primitive element class of the raw value arrays
     * used for this type.
     *
     * @return   array raw value element class
     */
    public Class<?> getArrayElementClass() {
        return arrayElementClass_;
    }

    /**
     * Returns the type of objects obtained by the <code>getScalar</code>
     * method.
     *
     * @return   scalar type associated with this data type
     */
    public Class<?> getScalarClass() {
        return scalarClass_;
    }

    /**
     * Returns the fill value used for unwritten items of this type
     * when no explicit <code>_FillValue</code> attribute is present.
     *
     * @return  default fill value, an instance of the scalar class
     */
    public Object getDefaultFillValue() {
        return dfltFillValue_;
    }

    /**
     * Indicates whether this is a numeric type.  Only CHAR is not.
     *
     * @return  true for numeric types
     */
    public boolean isNumeric() {
        return this != CHAR;
    }

    /**
     * Creates a new raw value array for this type.
     *
     * @param  n  number of items
     * @return   new primitive array of length <code>n</code>
     */
    public Object createArray( int n ) {
        return Array.newInstance( arrayElementClass_, n );
    }

    /**
     * Fills part of a raw value array with a given value.
     *
     * @param  array  raw value array of this type
     * @param  from   first index to fill (inclusive)
     * @param  to     last index to fill (exclusive)
     * @param  value  fill value, an instance of the scalar class
     */
    public abstract void fill( Object array, int from, int to, Object value );

    /**
     * Stores a CDL constant in a raw value array of this type,
     * converting it as required.
     *
     * @param  array  raw value array of this type
     * @param  index  index at which to store the value
     * @param  constant  constant value (Byte, Short, Integer, Float,
     *                   Double, Character or String)
     * @throws  CdlContentException  if the constant cannot be represented
     *                               in this type
     */
    public abstract void setValue( Object array, int index, Object constant )
            throws CdlContentException;

    /**
     * Reads a single item from a raw value array of this type.
     *
     * @param  array  raw value array
     * @param  index  index into array
     * @return  wrapper object of the scalar class
     */
    public abstract Object getScalar( Object array, int index );

    /**
     * Checks that an integer value can be stored in this type.
     * Floating point types accept anything.
     *
     * @param  value  value to test
     * @throws  CdlContentException  if out of range
     */
    public void checkRange( long value ) throws CdlContentException {
    }

    /**
     * Returns the suffix appended to a numeric literal in CDL text
     * to give a constant of this type.
     *
     * @return  type suffix, or the empty string if none is needed
     */
    public String getCdlSuffix() {
        return "";
    }

    /**
     * Formats a scalar value of this type as a CDL constant,
     * including any type suffix required to read it back as this type.
     *
     * @param  value   value returned by <code>getScalar</code>
     * @return   CDL representation
     */
    public String formatScalarValue( Object value ) {
        return String.valueOf( value ) + getCdlSuffix();
    }

    @Override
    public String toString() {
        return name_;
    }

    /**
     * Returns the data type named by a CDL type keyword.
     * Synonyms <code>integer</code>, <code>long</code> (for int)
     * and <code>real</code> (for float) are recognised.
     * Matching is case-insensitive.
     *
     * @param  keyword  type keyword
     * @return  data type
     * @throws  CdlContentException  if the keyword names no data type
     */
    public static DataType forKeyword( String keyword )
            throws CdlContentException {
        String kw = keyword == null ? "" : keyword.toLowerCase();
        switch ( kw ) {
            case "byte":
                return BYTE;
            case "char":
                return CHAR;
            case "short":
                return SHORT;
            case "int":
            case "integer":
            case "long":
                return INT;
            case "float":
            case "real":
                return FLOAT;
            case "double":
                return DOUBLE;
            default:
                throw new CdlContentException( "Unrecognised data type '"
                                             + keyword + "'" );
        }
    }

    /**
     * Returns the data type naturally associated with a CDL constant
     * value as produced by the lexer.  Strings are CHAR.
     *
     * @param  constant  constant value
     * @return  data type
     * @throws  CdlContentException  if the object is not a CDL constant
     */
    public static DataType forConstant( Object constant )
            throws CdlContentException {
        if ( constant instanceof Byte ) {
            return BYTE;
        }
        else if ( constant instanceof Short ) {
            return SHORT;
        }
        else if ( constant instanceof Integer ) {
            return INT;
        }
        else if ( constant instanceof Float ) {
            return FLOAT;
        }
        else if ( constant instanceof Double ) {
            return DOUBLE;
        }
        else if ( constant instanceof String ||
                  constant instanceof Character ) {
            return CHAR;
        }
        else {
            throw new CdlContentException( "Not a CDL constant: " + constant );
        }
    }

    /**
     * Returns all the known data types.
     *
     * @return  data types in order of increasing width (CHAR second)
     */
    public static DataType[] getDataTypes() {
        return ALL_TYPES.clone();
    }

    /**
     * Converts a numeric constant to an integer value for storage in
     * an integer-typed array.  Floating point values are truncated.
     *
     * @param  constant  constant value
     * @param  type   destination type, used for range checking
     * @return  integer value within range for <code>type</code>
     */
    private static long toIntegral( Object constant, DataType type )
            throws CdlContentException {
        final long lval;
        if ( constant instanceof Byte || constant instanceof Short ||
             constant instanceof Integer || constant instanceof Long ) {
            lval = ((Number) constant).longValue();
        }
        else if ( constant instanceof Float || constant instanceof Double ) {
            double dval = ((Number) constant).doubleValue();
            if ( Double.isNaN( dval ) || Double.isInfinite( dval ) ) {
                throw new CdlContentException( "Value " + constant
                                             + " not representable as "
                                             + type );
            }
            lval = (long) dval;
            if ( lval != Math.floor( dval ) && lval != Math.ceil( dval ) ) {
                throw new CdlContentException( "Value " + constant
                                             + " out of range for "
                                             + type );
            }
        }
        else {
            throw new CdlContentException( "Can't store "
                                         + describeConstant( constant )
                                         + " in " + type + " data" );
        }
        type.checkRange( lval );
        return lval;
    }

    /**
     * Converts a numeric constant to a double value.
     *
     * @param  constant  constant value
     * @param  type   destination type, used for error messages
     * @return  double value
     */
    private static double toReal( Object constant, DataType type )
            throws CdlContentException {
        if ( constant instanceof Number ) {
            return ((Number) constant).doubleValue();
        }
        else {
            throw new CdlContentException( "Can't store "
                                         + describeConstant( constant )
                                         + " in " + type + " data" );
        }
    }

    /**
     * Returns a short description of a constant for error messages.
     *
     * @param  constant  constant
     * @return   description
     */
    private static String describeConstant( Object constant ) {
        return constant instanceof String
             ? "string \"" + constant + "\""
             : String.valueOf( constant );
    }

    /**
     * Throws a range exception if a value falls outside given bounds.
     */
    private static void checkBounds( long value, long min, long max,
                                     DataType type )
            throws CdlContentException {
        if ( value < min || value > max ) {
            throw new CdlContentException( type.getName()
                                         + " value outside valid range ("
                                         + min + " -> " + max + "): "
                                         + value );
        }
    }

    /**
     * DataType for signed 1-byte integer.
     */
    private static final class ByteDataType extends DataType {
        ByteDataType() {
            super( "byte", 1, byte.class, Byte.class,
                   Byte.valueOf( FILL_BYTE ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (byte[]) array, from, to,
                         ((Number) value).byteValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            ((byte[]) array)[ index ] = (byte) toIntegral( constant, this );
        }
        public Object getScalar( Object array, int index ) {
            return Byte.valueOf( ((byte[]) array)[ index ] );
        }
        @Override
        public void checkRange( long value ) throws CdlContentException {
            checkBounds( value, Byte.MIN_VALUE, Byte.MAX_VALUE, this );
        }
        @Override
        public String getCdlSuffix() {
            return "b";
        }
    }

    /**
     * DataType for 1-byte character.
     * Numeric constants are not accepted, except for byte constants
     * which may be written as quoted character literals.
     */
    private static final class CharDataType extends DataType {
        CharDataType() {
            super( "char", 1, char.class, Character.class,
                   Character.valueOf( FILL_CHAR ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (char[]) array, from, to,
                         ((Character) value).charValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            final char c;
            if ( constant instanceof Character ) {
                c = ((Character) constant).charValue();
            }
            else if ( constant instanceof Byte ) {
                c = (char) ( ((Byte) constant).byteValue() & 0xff );
            }
            else if ( constant instanceof String &&
                      ((String) constant).length() == 1 ) {
                c = ((String) constant).charAt( 0 );
            }
            else {
                throw new CdlContentException( "Can't store "
                                             + describeConstant( constant )
                                             + " as a single char" );
            }
            ((char[]) array)[ index ] = c;
        }
        public Object getScalar( Object array, int index ) {
            return Character.valueOf( ((char[]) array)[ index ] );
        }
    }

    /**
     * DataType for signed 2-byte integer.
     */
    private static final class ShortDataType extends DataType {
        ShortDataType() {
            super( "short", 2, short.class, Short.class,
                   Short.valueOf( FILL_SHORT ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (short[]) array, from, to,
                         ((Number) value).shortValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            ((short[]) array)[ index ] = (short) toIntegral( constant, this );
        }
        public Object getScalar( Object array, int index ) {
            return Short.valueOf( ((short[]) array)[ index ] );
        }
        @Override
        public void checkRange( long value ) throws CdlContentException {
            checkBounds( value, Short.MIN_VALUE, Short.MAX_VALUE, this );
        }
        @Override
        public String getCdlSuffix() {
            return "s";
        }
    }

    /**
     * DataType for signed 4-byte integer.
     */
    private static final class IntDataType extends DataType {
        IntDataType() {
            super( "int", 4, int.class, Integer.class,
                   Integer.valueOf( FILL_INT ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (int[]) array, from, to,
                         ((Number) value).intValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            ((int[]) array)[ index ] = (int) toIntegral( constant, this );
        }
        public Object getScalar( Object array, int index ) {
            return Integer.valueOf( ((int[]) array)[ index ] );
        }
        @Override
        public void checkRange( long value ) throws CdlContentException {
            checkBounds( value, Integer.MIN_VALUE, Integer.MAX_VALUE, this );
        }
    }

    /**
     * DataType for 4-byte floating point.
     */
    private static final class FloatDataType extends DataType {
        FloatDataType() {
            super( "float", 4, float.class, Float.class,
                   Float.valueOf( FILL_FLOAT ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (float[]) array, from, to,
                         ((Number) value).floatValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            ((float[]) array)[ index ] = (float) toReal( constant, this );
        }
        public Object getScalar( Object array, int index ) {
            return Float.valueOf( ((float[]) array)[ index ] );
        }
        @Override
        public String getCdlSuffix() {
            return "f";
        }
    }

    /**
     * DataType for 8-byte floating point.
     */
    private static final class DoubleDataType extends DataType {
        DoubleDataType() {
            super( "double", 8, double.class, Double.class,
                   Double.valueOf( FILL_DOUBLE ) );
        }
        public void fill( Object array, int from, int to, Object value ) {
            Arrays.fill( (double[]) array, from, to,
                         ((Number) value).doubleValue() );
        }
        public void setValue( Object array, int index, Object constant )
                throws CdlContentException {
            ((double[]) array)[ index ] = toReal( constant, this );
        }
        public Object getScalar( Object array, int index ) {
            return Double.valueOf( ((double[]) array)[ index ] );
        }
    }
}
