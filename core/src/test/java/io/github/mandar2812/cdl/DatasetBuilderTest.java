package io.github.mandar2812.cdl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import io.github.mandar2812.cdl.backend.MemoryBackend;
import io.github.mandar2812.cdl.backend.MemoryDataset;
import io.github.mandar2812.cdl.backend.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DatasetBuilderTest {

    private MemoryBackend backend_;
    private DatasetBuilder builder_;

    @BeforeEach
    public void setUp() throws IOException {
        backend_ = new MemoryBackend();
        builder_ = new DatasetBuilder( backend_, "test.nc",
                                       FileFormat.CLASSIC );
        builder_.beginDataset( "test" );
    }

    @Test
    public void testDimensions() throws IOException {
        builder_.declareDimension( "x", 3 );
        builder_.declareUnlimitedDimension( "t" );
        assertEquals( 2, builder_.getDimensionCount() );
        assertEquals( "t", builder_.getUnlimitedDimension() );

        assertThrows( CdlContentException.class,
                      () -> builder_.declareDimension( "x", 4 ) );
        CdlContentException err =
            assertThrows( CdlContentException.class,
                          () -> builder_.declareUnlimitedDimension( "t2" ) );
        assertTrue( err.getMessage().contains( "UNLIMITED" ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.declareDimension( "z", 0 ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.declareDimension( "z", -2 ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.declareDimension( "z", 1L << 32 ) );
        assertEquals( 2, builder_.getDimensionCount() );

        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertEquals( 3, ds.getDimension( "x" ).getLength() );
        assertTrue( ds.getDimension( "t" ).isUnlimited() );
        assertNull( ds.getDimension( "z" ) );
    }

    @Test
    public void testVariables() throws IOException {
        builder_.declareDimension( "x", 2 );
        builder_.declareUnlimitedDimension( "t" );
        builder_.setPendingType( DataType.DOUBLE );
        builder_.declareVariable( "a", new String[] { "x" } );
        builder_.declareVariable( "b", new String[] { "t", "x" } );
        assertEquals( "b", builder_.getCurrentVariable() );
        builder_.declareVariable( DataType.BYTE, "c", new String[ 0 ] );

        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertEquals( 3, ds.getVariables().length );
        assertEquals( DataType.DOUBLE, ds.getVariable( "b" ).getDataType() );
        assertEquals( DataType.BYTE, ds.getVariable( "c" ).getDataType() );
        assertEquals( 0, ds.getVariable( "c" ).getDimensions().length );

        assertThrows( CdlContentException.class,
                      () -> builder_.declareVariable( "a",
                                                      new String[ 0 ] ) );
        CdlContentException err =
            assertThrows( CdlContentException.class,
                          () -> builder_.declareVariable( "d",
                                             new String[] { "x", "y" } ) );
        assertTrue( err.getMessage().contains( "'y'" ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.declareVariable( "e",
                                             new String[] { "x", "t" } ) );
    }

    @Test
    public void testAttributes() throws IOException {
        builder_.declareDimension( "x", 2 );
        builder_.declareVariable( DataType.INT, "v", new String[] { "x" } );
        builder_.declareVariable( DataType.INT, "w", new String[] { "x" } );
        builder_.setVariableAttribute( "v", "units", constants( "m", "/s" ) );
        assertEquals( "v", builder_.getCurrentVariable() );
        builder_.setGlobalAttribute( "version", constants( 1, 2 ) );

        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertEquals( "m/s", ds.getVariable( "v" ).getAttribute( "units" )
                                .getValue().getShapedValue() );
        assertArrayEquals( new int[] { 1, 2 },
                           (int[]) ds.getGlobalAttribute( "version" )
                                     .getValue().getRawValue() );

        assertThrows( CdlContentException.class,
                      () -> builder_.setVariableAttribute( "nope", "units",
                                                           constants( "m" ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.setGlobalAttribute( "mixed",
                                                         constants( 1, "a" ) ) );
    }

    @Test
    public void testFillValueAttribute() throws IOException {
        builder_.declareDimension( "x", 4 );
        builder_.declareVariable( DataType.SHORT, "s", new String[] { "x" } );
        assertEquals( Short.valueOf( DataType.FILL_SHORT ),
                      builder_.getFillValue( "s" ) );
        builder_.setVariableAttribute( "s", "_FillValue",
                                       constants( (short) -1 ) );
        assertEquals( Short.valueOf( (short) -1 ),
                      builder_.getFillValue( "s" ) );
        builder_.writeData( "s", constants( (short) 5, FillMarker.INSTANCE ) );
        Variable var = backend_.getDataset( "test.nc" ).getVariable( "s" );
        assertArrayEquals( new short[] { 5, -1, -1, -1 },
                           (short[]) var.readValues() );

        assertThrows( CdlContentException.class,
                      () -> builder_.setVariableAttribute( "s", "_FillValue",
                                                           constants( 1 ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.setVariableAttribute( "s", "_FillValue",
                                             constants( (short) 1,
                                                        (short) 2 ) ) );
    }

    @Test
    public void testNumericData() throws IOException {
        builder_.declareDimension( "x", 3 );
        builder_.declareVariable( DataType.INT, "v", new String[] { "x" } );
        builder_.writeData( "v", constants( (byte) 1, 2.0, (short) 3 ) );
        assertEquals( "v", builder_.getCurrentVariable() );
        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertArrayEquals( new int[] { 1, 2, 3 },
                           (int[]) ds.getVariable( "v" ).readValues() );

        builder_.declareVariable( DataType.BYTE, "b", new String[] { "x" } );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "b", constants( 200 ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "b", constants( "abc" ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "v", constants( 1, 2, 3,
                                                                4 ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "undeclared",
                                                constants( 1 ) ) );
    }

    @Test
    public void testRecordData() throws IOException {
        builder_.declareUnlimitedDimension( "t" );
        builder_.declareDimension( "x", 2 );
        builder_.declareVariable( DataType.FLOAT, "f",
                                  new String[] { "t", "x" } );
        builder_.writeData( "f", constants( 1f, 2f, 3f, 4f, 5f ) );
        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertEquals( 3, ds.getDimension( "t" ).getLength() );
        assertArrayEquals( new float[] { 1f, 2f, 3f, 4f, 5f,
                                         DataType.FILL_FLOAT },
                           (float[]) ds.getVariable( "f" ).readValues() );
    }

    @Test
    public void testCharData() throws IOException {
        builder_.declareDimension( "n", 3 );
        builder_.declareDimension( "len", 4 );
        builder_.declareVariable( DataType.CHAR, "names",
                                  new String[] { "n", "len" } );
        builder_.declareVariable( DataType.CHAR, "word",
                                  new String[] { "len" } );
        builder_.declareVariable( DataType.CHAR, "letter", new String[ 0 ] );
        builder_.writeData( "names", constants( "ab", "", "cdef" ) );
        builder_.writeData( "word", constants( "a", FillMarker.INSTANCE,
                                               (byte) 'b' ) );
        builder_.writeData( "letter", constants( "X" ) );

        MemoryDataset ds = backend_.getDataset( "test.nc" );
        assertArrayEquals( "ab\0\0\0\0\0\0cdef".toCharArray(),
                           (char[]) ds.getVariable( "names" ).readValues() );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "names",
                                                constants( "abcde", "fghij",
                                                           "k" ) ) );
        assertArrayEquals( "a_b\0".toCharArray(),
                           (char[]) ds.getVariable( "word" ).readValues() );
        assertArrayEquals( new char[] { 'X' },
                           (char[]) ds.getVariable( "letter" ).readValues() );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "word", constants( 3 ) ) );
        assertThrows( CdlContentException.class,
                      () -> builder_.writeData( "letter",
                                                constants( "XY" ) ) );
    }

    @Test
    public void testEndDataset() throws IOException {
        MemoryDataset ds = backend_.getDataset( "test.nc" );
        builder_.endDataset();
        builder_.endDataset();
        assertTrue( ds.isClosed() );
        assertThrows( IllegalStateException.class,
                      () -> builder_.declareDimension( "x", 1 ) );

        DatasetBuilder unbegun =
            new DatasetBuilder( backend_, "other.nc", FileFormat.CLASSIC );
        unbegun.endDataset();
        assertNull( unbegun.getWritableDataset() );
    }

    @Test
    public void testHugeVariable() throws IOException {
        DiscardingBackend discarder = new DiscardingBackend();
        DatasetBuilder builder =
            new DatasetBuilder( discarder, "big.nc", FileFormat.CLASSIC );
        builder.beginDataset( "big" );
        builder.declareDimension( "x", 50000 );
        builder.declareDimension( "y", 50000 );
        builder.declareVariable( DataType.BYTE, "v",
                                 new String[] { "x", "y" } );
        builder.writeData( "v", constants( (byte) 1 ) );
        builder.endDataset();
        assertEquals( 1, discarder.getWrittenCount() );

        builder_.declareDimension( "x", 50000 );
        builder_.declareDimension( "y", 50000 );
        IOException err =
            assertThrows( IOException.class,
                          () -> builder_.declareVariable( DataType.BYTE, "v",
                                                 new String[] { "x", "y" } ) );
        assertTrue( err.getMessage().contains( "too large" ) );
    }

    private static List<Object> constants( Object... values ) {
        return Arrays.asList( values );
    }
}
