package io.github.mandar2812.cdl.backend;

import java.lang.reflect.Array;
import java.util.LinkedHashMap;
import java.util.Map;

import io.github.mandar2812.cdl.DataType;

/**
 * Variable of an in-memory dataset, with its attributes and data.
 *
 * <p>Data is held as a flat row-major primitive array.
 * Elements which have not been written read as the variable's
 * fill value: the value of its <code>_FillValue</code> attribute
 * if it has one, otherwise the default for its data type.
 *
 * @since    15 Oct 2026
 */
public class Variable {

    private final String name_;
    private final DataType dataType_;
    private final Dimension[] dims_;
    private final Map<String,Attribute> attMap_;
    private Object data_;

    /** Name of the attribute which overrides the default fill value. */
    public static final String FILL_VALUE_ATT = "_FillValue";

    /**
     * Constructor.
     *
     * @param  name  variable name
     * @param  dataType  data type
     * @param  dims   dimensions, slowest varying first
     */
    Variable( String name, DataType dataType, Dimension[] dims ) {
        name_ = name;
        dataType_ = dataType;
        dims_ = dims;
        attMap_ = new LinkedHashMap<String,Attribute>();
    }

    /**
     * Returns this variable's name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns this variable's data type.
     *
     * @return  data type
     */
    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the dimensions of this variable.
     *
     * @return  dimension array, slowest varying first; empty for scalar
     */
    public Dimension[] getDimensions() {
        return dims_.clone();
    }

    /**
     * Returns the current shape of this variable.
     *
     * @return   current dimension lengths
     */
    public int[] getShape() {
        int[] shape = new int[ dims_.length ];
        for ( int i = 0; i < dims_.length; i++ ) {
            shape[ i ] = dims_[ i ].getLength();
        }
        return shape;
    }

    /**
     * Indicates whether this variable's first dimension is the
     * unlimited one.
     *
     * @return  true for a record variable
     */
    public boolean isRecordVariable() {
        return dims_.length > 0 && dims_[ 0 ].isUnlimited();
    }

    /**
     * Returns the number of elements in one record of this variable;
     * for a non-record variable this is the total element count.
     *
     * @return  elements per record
     */
    public int getRecordSize() {
        int size = 1;
        for ( int i = isRecordVariable() ? 1 : 0; i < dims_.length; i++ ) {
            size = Math.multiplyExact( size, dims_[ i ].getLength() );
        }
        return size;
    }

    /**
     * Returns the total number of elements in this variable
     * at its current shape.
     *
     * @return  element count
     * @throws  ArithmeticException  if the count exceeds the int range;
     *          the owning dataset does not permit this
     */
    public int getElementCount() {
        int count = 1;
        for ( int i = 0; i < dims_.length; i++ ) {
            count = Math.multiplyExact( count, dims_[ i ].getLength() );
        }
        return count;
    }

    /**
     * Returns the attributes of this variable.
     *
     * @return   attribute array, in order of first definition
     */
    public Attribute[] getAttributes() {
        return attMap_.values().toArray( new Attribute[ 0 ] );
    }

    /**
     * Returns a named attribute of this variable.
     *
     * @param  name  attribute name
     * @return  attribute, or null if none
     */
    public Attribute getAttribute( String name ) {
        return attMap_.get( name );
    }

    /**
     * Returns the value used for elements that have not been written.
     *
     * @return  fill value, an instance of the data type's scalar class
     */
    public Object getFillValue() {
        Attribute fillAtt = attMap_.get( FILL_VALUE_ATT );
        if ( fillAtt != null &&
             fillAtt.getValue().getDataType() == dataType_ &&
             fillAtt.getValue().getItemCount() > 0 ) {
            return fillAtt.getValue().getItem( 0 );
        }
        else {
            return dataType_.getDefaultFillValue();
        }
    }

    /**
     * Returns the number of data elements which have been written.
     *
     * @return   written element count
     */
    public int getWrittenCount() {
        return data_ == null ? 0 : Array.getLength( data_ );
    }

    /**
     * Reads all the data of this variable at its current shape.
     * Elements which have not been written hold the fill value.
     *
     * @return   new primitive array of length
     *           {@link #getElementCount}, row-major order
     */
    public Object readValues() {
        int count = getElementCount();
        Object array = dataType_.createArray( count );
        int nw = Math.min( getWrittenCount(), count );
        if ( nw > 0 ) {
            System.arraycopy( data_, 0, array, 0, nw );
        }
        dataType_.fill( array, nw, count, getFillValue() );
        return array;
    }

    /**
     * Reads a single element.
     *
     * @param  index  row-major element index
     * @return   wrapper object for the value
     */
    public Object readValue( int index ) {
        return dataType_.getScalar( readValues(), index );
    }

    void setAttribute( Attribute att ) {
        attMap_.put( att.getName(), att );
    }

    void setData( Object data ) {
        data_ = data;
    }

    @Override
    public String toString() {
        StringBuffer sbuf = new StringBuffer()
            .append( dataType_.getName() )
            .append( ' ' )
            .append( name_ );
        if ( dims_.length > 0 ) {
            sbuf.append( '(' );
            for ( int i = 0; i < dims_.length; i++ ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                sbuf.append( dims_[ i ].getName() );
            }
            sbuf.append( ')' );
        }
        return sbuf.toString();
    }
}
