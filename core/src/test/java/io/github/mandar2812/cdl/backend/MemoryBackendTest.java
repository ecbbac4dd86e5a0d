package io.github.mandar2812.cdl.backend;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import io.github.mandar2812.cdl.AttributeValue;
import io.github.mandar2812.cdl.DataType;
import io.github.mandar2812.cdl.FileFormat;
import org.junit.jupiter.api.Test;

public class MemoryBackendTest {

    @Test
    public void testFixedVariable() throws IOException {
        MemoryBackend backend = new MemoryBackend();
        MemoryDataset ds = backend.create( "a.nc", FileFormat.CLASSIC );
        assertSame( ds, backend.getDataset( "a.nc" ) );
        assertEquals( FileFormat.CLASSIC, ds.getFormat() );
        ds.createDimension( "x", 2 );
        ds.createDimension( "y", 3 );
        ds.createVariable( "v", DataType.SHORT, new String[] { "x", "y" } );
        ds.writeVariableData( "v", new short[] { 1, 2, 3, 4 } );
        ds.close();
        assertTrue( ds.isClosed() );

        Variable v = ds.getVariable( "v" );
        assertArrayEquals( new int[] { 2, 3 }, v.getShape() );
        assertFalse( v.isRecordVariable() );
        assertEquals( 6, v.getElementCount() );
        assertEquals( 4, v.getWrittenCount() );
        assertArrayEquals( new short[] { 1, 2, 3, 4, -32767, -32767 },
                           (short[]) v.readValues() );
        assertEquals( Short.valueOf( (short) 3 ), v.readValue( 2 ) );
        assertEquals( "short v(x, y)", v.toString() );
    }

    @Test
    public void testRecordVariable() throws IOException {
        MemoryDataset ds =
            new MemoryBackend().create( "r.nc", FileFormat.OFFSET_64BIT );
        ds.createDimension( "time", 0 );
        ds.createDimension( "n", 2 );
        ds.createVariable( "t", DataType.FLOAT, new String[] { "time", "n" } );
        Dimension time = ds.getDimension( "time" );
        assertTrue( time.isUnlimited() );
        assertEquals( 0, time.getLength() );
        assertSame( time, ds.getUnlimitedDimension() );

        ds.setAttribute( "t", Variable.FILL_VALUE_ATT,
                         new AttributeValue( DataType.FLOAT,
                                             new float[] { -1f }, 1 ) );
        ds.writeVariableData( "t", new float[] { 1f, 2f, 3f } );
        assertEquals( 2, time.getLength() );
        Variable t = ds.getVariable( "t" );
        assertTrue( t.isRecordVariable() );
        assertEquals( 2, t.getRecordSize() );
        assertEquals( Float.valueOf( -1f ), t.getFillValue() );
        assertArrayEquals( new float[] { 1f, 2f, 3f, -1f },
                           (float[]) t.readValues() );
    }

    @Test
    public void testAttributes() throws IOException {
        MemoryDataset ds = new MemoryBackend().create( "g.nc",
                                                       FileFormat.CLASSIC );
        AttributeValue title =
            new AttributeValue( DataType.CHAR, "hello".toCharArray(), 5 );
        ds.setAttribute( null, "title", title );
        assertEquals( 1, ds.getGlobalAttributes().length );
        assertSame( title, ds.getGlobalAttribute( "title" ).getValue() );
        assertNull( ds.getGlobalAttribute( "history" ) );
        assertEquals( "title = \"hello\"",
                      ds.getGlobalAttribute( "title" ).toString() );
        assertThrows( IOException.class,
                      () -> ds.setAttribute( "nope", "units", title ) );
    }

    @Test
    public void testRejections() throws IOException {
        MemoryDataset ds = new MemoryBackend().create( "e.nc",
                                                       FileFormat.CLASSIC );
        ds.createDimension( "x", 2 );
        ds.createDimension( "rec", 0 );
        assertThrows( IOException.class, () -> ds.createDimension( "x", 3 ) );
        assertThrows( IOException.class,
                      () -> ds.createDimension( "rec2", 0 ) );
        assertThrows( IOException.class,
                      () -> ds.createVariable( "v", DataType.INT,
                                               new String[] { "z" } ) );
        assertThrows( IOException.class,
                      () -> ds.createVariable( "v", DataType.INT,
                                               new String[] { "x", "rec" } ) );
        ds.createVariable( "v", DataType.INT, new String[] { "x" } );
        assertThrows( IOException.class,
                      () -> ds.createVariable( "v", DataType.INT,
                                               new String[ 0 ] ) );
        assertThrows( IOException.class,
                      () -> ds.writeVariableData( "v", new int[ 3 ] ) );
        assertThrows( IOException.class,
                      () -> ds.writeVariableData( "v", new float[ 1 ] ) );
        ds.close();
        assertThrows( IOException.class,
                      () -> ds.createDimension( "y", 1 ) );
    }

    @Test
    public void testClobber() throws IOException {
        MemoryBackend backend = new MemoryBackend( false );
        MemoryDataset ds1 = backend.create( "c.nc", FileFormat.CLASSIC );
        assertThrows( IOException.class,
                      () -> backend.create( "c.nc", FileFormat.CLASSIC ) );
        assertSame( ds1, backend.getDataset( "c.nc" ) );

        MemoryBackend clobberer = new MemoryBackend();
        MemoryDataset ds2 = clobberer.create( "c.nc", FileFormat.CLASSIC );
        MemoryDataset ds3 = clobberer.create( "c.nc",
                                              FileFormat.DATA_64BIT );
        assertNotSame( ds2, ds3 );
        assertSame( ds3, clobberer.getDataset( "c.nc" ) );
        assertArrayEquals( new String[] { "c.nc" }, clobberer.getPaths() );
        assertThrows( IOException.class,
                      () -> clobberer.create( "", FileFormat.CLASSIC ) );
    }

    @Test
    public void testOversizedShapes() throws IOException {
        MemoryDataset ds = new MemoryBackend().create( "o.nc",
                                                       FileFormat.CLASSIC );
        ds.createDimension( "rec", 0 );
        ds.createDimension( "big", 65536 );
        ds.createDimension( "mega", 1 << 20 );
        assertThrows( IOException.class,
                      () -> ds.createVariable( "fixed", DataType.BYTE,
                                               new String[] { "big",
                                                              "big" } ) );
        assertThrows( IOException.class,
                      () -> ds.createVariable( "recs", DataType.BYTE,
                                               new String[] { "rec", "big",
                                                              "big" } ) );
        assertNull( ds.getVariable( "fixed" ) );

        ds.createVariable( "wide", DataType.BYTE,
                           new String[] { "rec", "mega" } );
        ds.createVariable( "t", DataType.INT, new String[] { "rec" } );
        ds.writeVariableData( "t", new int[ 1024 ] );
        assertEquals( 1024, ds.getDimension( "rec" ).getLength() );
        IOException err =
            assertThrows( IOException.class,
                          () -> ds.writeVariableData( "t", new int[ 4096 ] ) );
        assertTrue( err.getMessage().contains( "wide" ) );
        assertEquals( 1024, ds.getDimension( "rec" ).getLength() );
    }
}
