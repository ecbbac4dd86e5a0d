package io.github.mandar2812.cdl.util;

import java.io.File;
import java.io.PrintStream;
import java.lang.reflect.Array;

import io.github.mandar2812.cdl.AttributeValue;
import io.github.mandar2812.cdl.DataType;
import io.github.mandar2812.cdl.backend.Attribute;
import io.github.mandar2812.cdl.backend.Dimension;
import io.github.mandar2812.cdl.backend.MemoryDataset;
import io.github.mandar2812.cdl.backend.Variable;

/**
 * Writes the content of an in-memory dataset as CDL text.
 * The layout is reminiscent of the output of <code>ncdump</code>,
 * and the text can be read back by the CDL parser.
 *
 * <p>Unwritten and fill-valued data elements are written as the
 * fill marker <code>_</code>.  Variables which have had no data
 * written are omitted from the data section.
 *
 * @since    17 Oct 2026
 */
public class CdlList {

    private final MemoryDataset dataset_;
    private final PrintStream out_;
    private final boolean writeData_;

    /** Characters which must be escaped in a name. */
    private static final String NAME_SPECIALS = " !\"#$%&'()*,:;<=>?[\\]^`{|}~";

    /**
     * Constructor.
     *
     * @param   dataset   dataset to list
     * @param   out   output stream for listing
     * @param   writeData  true if data values as well as metadata are to
     *                     be written
     */
    public CdlList( MemoryDataset dataset, PrintStream out,
                    boolean writeData ) {
        dataset_ = dataset;
        out_ = out;
        writeData_ = writeData;
    }

    /**
     * Does the work, writing output.
     */
    public void run() {
        out_.println( "netcdf " + formatName( getDatasetName() ) + " {" );

        Dimension[] dims = dataset_.getDimensions();
        if ( dims.length > 0 ) {
            out_.println( "dimensions:" );
            for ( Dimension dim : dims ) {
                StringBuffer sbuf = new StringBuffer()
                    .append( '\t' )
                    .append( formatName( dim.getName() ) )
                    .append( " = " );
                if ( dim.isUnlimited() ) {
                    sbuf.append( "UNLIMITED ; // (" )
                        .append( dim.getLength() )
                        .append( " currently)" );
                }
                else {
                    sbuf.append( dim.getLength() )
                        .append( " ;" );
                }
                out_.println( sbuf.toString() );
            }
        }

        Variable[] vars = dataset_.getVariables();
        Attribute[] gAtts = dataset_.getGlobalAttributes();
        if ( vars.length > 0 ) {
            out_.println( "variables:" );
            for ( Variable var : vars ) {
                out_.println( "\t" + formatDeclaration( var ) + " ;" );
                for ( Attribute att : var.getAttributes() ) {
                    out_.println( "\t\t" + formatName( var.getName() )
                                + formatAttribute( att ) );
                }
            }
        }
        if ( gAtts.length > 0 ) {
            if ( vars.length > 0 ) {
                out_.println();
                out_.println( "// global attributes:" );
            }
            for ( Attribute att : gAtts ) {
                out_.println( "\t\t" + formatAttribute( att ) );
            }
        }

        if ( writeData_ && hasData( vars ) ) {
            out_.println( "data:" );
            for ( Variable var : vars ) {
                if ( var.getWrittenCount() > 0 ) {
                    out_.println();
                    out_.println( " " + formatName( var.getName() ) + " = "
                                + formatData( var ) + " ;" );
                }
            }
        }
        out_.println( "}" );
    }

    /**
     * Returns the name to write after the <code>netcdf</code> keyword,
     * which is the file name of the dataset path without its extension.
     *
     * @return  dataset name
     */
    private String getDatasetName() {
        String name = new File( dataset_.getPath() ).getName();
        int idot = name.lastIndexOf( '.' );
        return idot > 0 ? name.substring( 0, idot ) : name;
    }

    private static boolean hasData( Variable[] vars ) {
        for ( Variable var : vars ) {
            if ( var.getWrittenCount() > 0 ) {
                return true;
            }
        }
        return false;
    }

    private static String formatDeclaration( Variable var ) {
        StringBuffer sbuf = new StringBuffer()
            .append( var.getDataType().getName() )
            .append( ' ' )
            .append( formatName( var.getName() ) );
        Dimension[] dims = var.getDimensions();
        if ( dims.length > 0 ) {
            sbuf.append( '(' );
            for ( int i = 0; i < dims.length; i++ ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                sbuf.append( formatName( dims[ i ].getName() ) );
            }
            sbuf.append( ')' );
        }
        return sbuf.toString();
    }

    /**
     * Formats an attribute as it appears after the owning variable name.
     */
    private static String formatAttribute( Attribute att ) {
        AttributeValue value = att.getValue();
        DataType type = value.getDataType();
        StringBuffer sbuf = new StringBuffer()
            .append( ':' )
            .append( formatName( att.getName() ) )
            .append( " = " );
        if ( type == DataType.CHAR ) {
            sbuf.append( quote( (String) value.getShapedValue() ) );
        }
        else {
            for ( int i = 0; i < value.getItemCount(); i++ ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                sbuf.append( type.formatScalarValue( value.getItem( i ) ) );
            }
        }
        return sbuf.append( " ;" ).toString();
    }

    /**
     * Formats the data of a variable as a CDL data list.
     * Character data is written as one string per row for variables
     * with two or more dimensions, otherwise as a single string.
     */
    private static String formatData( Variable var ) {
        DataType type = var.getDataType();
        Object values = var.readValues();
        int count = Array.getLength( values );
        StringBuffer sbuf = new StringBuffer();
        if ( type == DataType.CHAR ) {
            char[] chars = (char[]) values;
            int rank = var.getDimensions().length;
            int[] shape = var.getShape();
            int rowLeng = rank >= 2 ? shape[ rank - 1 ] : count;
            for ( int i0 = 0; i0 < count; i0 += Math.max( rowLeng, 1 ) ) {
                if ( i0 > 0 ) {
                    sbuf.append( ", " );
                }
                int i1 = Math.min( i0 + rowLeng, count );
                while ( i1 > i0 && chars[ i1 - 1 ] == DataType.FILL_CHAR ) {
                    i1--;
                }
                sbuf.append( quote( new String( chars, i0, i1 - i0 ) ) );
            }
            if ( count == 0 ) {
                sbuf.append( "\"\"" );
            }
        }
        else {
            Object fill = var.getFillValue();
            for ( int i = 0; i < count; i++ ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                Object value = type.getScalar( values, i );
                sbuf.append( value.equals( fill )
                           ? "_"
                           : type.formatScalarValue( value ) );
            }
        }
        return sbuf.toString();
    }

    /**
     * Returns a CDL string literal for a given string.
     *
     * @param  txt  string content
     * @return  quoted and escaped text
     */
    static String quote( String txt ) {
        StringBuffer sbuf = new StringBuffer( txt.length() + 2 );
        sbuf.append( '"' );
        for ( int i = 0; i < txt.length(); i++ ) {
            char c = txt.charAt( i );
            switch ( c ) {
                case '"':
                    sbuf.append( "\\\"" );
                    break;
                case '\\':
                    sbuf.append( "\\\\" );
                    break;
                case '\n':
                    sbuf.append( "\\n" );
                    break;
                case '\t':
                    sbuf.append( "\\t" );
                    break;
                default:
                    if ( c < 0x20 || c == 0x7f ) {
                        sbuf.append( '\\' )
                            .append( Integer.toOctalString( 0x200 | c )
                                            .substring( 1 ) );
                    }
                    else {
                        sbuf.append( c );
                    }
            }
        }
        sbuf.append( '"' );
        return sbuf.toString();
    }

    /**
     * Escapes a name so that it is read back as an identifier.
     *
     * @param  name  unescaped name
     * @return  name as it should appear in CDL text
     */
    static String formatName( String name ) {
        StringBuffer sbuf = new StringBuffer( name.length() );
        for ( int i = 0; i < name.length(); i++ ) {
            char c = name.charAt( i );
            if ( ( i == 0 && c >= '0' && c <= '9' ) ||
                 NAME_SPECIALS.indexOf( c ) >= 0 ) {
                sbuf.append( '\\' );
            }
            sbuf.append( c );
        }
        return sbuf.toString();
    }
}
