package io.github.mandar2812.cdl;

import java.util.List;

/**
 * Represents the value of a global or variable attribute:
 * one or more items of a single data type.
 *
 * <p>Character attributes are held as a <code>char[]</code> array
 * with one element per character; their shaped value is a String.
 *
 * @since    14 Oct 2026
 */
public class AttributeValue {

    private final DataType dataType_;
    private final Object rawValue_;
    private final int nitem_;

    /**
     * Constructor.
     *
     * @param  dataType  data type
     * @param  rawValue  primitive array of the type's array element class
     * @param  nitem     number of items represented by the array
     */
    public AttributeValue( DataType dataType, Object rawValue, int nitem ) {
        dataType_ = dataType;
        rawValue_ = rawValue;
        nitem_ = nitem;
    }

    /**
     * Returns the data type of this value.
     *
     * @return  data type
     */
    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the primitive array holding the items.
     *
     * @return  raw array value
     */
    public Object getRawValue() {
        return rawValue_;
    }

    /**
     * Returns the number of items in this value.
     * For character values this is the number of characters.
     *
     * @return  item count
     */
    public int getItemCount() {
        return nitem_;
    }

    /**
     * Returns an object representing one of the items.
     *
     * @param  itemIndex  item index
     * @return  wrapper object for the item
     */
    public Object getItem( int itemIndex ) {
        return dataType_.getScalar( rawValue_, itemIndex );
    }

    /**
     * Returns the value as a convenient object.
     * Character values are returned as a String; otherwise
     * if the item count is 1 it's the same as <code>getItem(0)</code>,
     * and if the item count is &gt;1 it's the same as the raw value.
     *
     * @return  shaped value
     */
    public Object getShapedValue() {
        if ( dataType_ == DataType.CHAR ) {
            return new String( (char[]) rawValue_, 0, nitem_ );
        }
        else if ( nitem_ == 0 ) {
            return null;
        }
        else if ( nitem_ == 1 ) {
            return getItem( 0 );
        }
        else {
            return rawValue_;
        }
    }

    /**
     * Constructs an attribute value from a list of CDL constants.
     * All the constants must have the same type.  A sequence of
     * string constants is concatenated to form a single character value.
     *
     * @param  constants   non-empty list of constant values as supplied
     *                     by the lexer
     * @return  attribute value
     * @throws  CdlContentException  if the constants are of mixed types
     */
    public static AttributeValue fromConstants( List<?> constants )
            throws CdlContentException {
        if ( constants.isEmpty() ) {
            throw new CdlContentException( "No values for attribute" );
        }
        DataType type = DataType.forConstant( constants.get( 0 ) );
        for ( Object c : constants ) {
            if ( DataType.forConstant( c ) != type ) {
                throw new CdlContentException( "Values for attribute must "
                                             + "all be of same type ("
                                             + type + " and "
                                             + DataType.forConstant( c )
                                             + ")" );
            }
        }
        if ( type == DataType.CHAR ) {
            StringBuilder sbuf = new StringBuilder();
            for ( Object c : constants ) {
                sbuf.append( c );
            }
            char[] chars = sbuf.toString().toCharArray();
            return new AttributeValue( type, chars, chars.length );
        }
        else {
            int n = constants.size();
            Object array = type.createArray( n );
            for ( int i = 0; i < n; i++ ) {
                type.setValue( array, i, constants.get( i ) );
            }
            return new AttributeValue( type, array, n );
        }
    }

    /**
     * Formats the value as a CDL constant list.
     */
    @Override
    public String toString() {
        if ( dataType_ == DataType.CHAR ) {
            return "\"" + getShapedValue() + "\"";
        }
        StringBuilder sbuf = new StringBuilder();
        for ( int i = 0; i < nitem_; i++ ) {
            if ( i > 0 ) {
                sbuf.append( ", " );
            }
            sbuf.append( dataType_.formatScalarValue( getItem( i ) ) );
        }
        return sbuf.toString();
    }
}
