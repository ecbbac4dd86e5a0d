package io.github.mandar2812.cdl.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import io.github.mandar2812.cdl.CdlParser;
import io.github.mandar2812.cdl.backend.Attribute;
import io.github.mandar2812.cdl.backend.MemoryBackend;
import io.github.mandar2812.cdl.backend.MemoryDataset;
import io.github.mandar2812.cdl.backend.Variable;
import org.junit.jupiter.api.Test;

public class CdlListTest {

    private static final String CDL = String.join( "\n",
        "netcdf orig {",
        "dimensions:",
        "  x = 2 ;",
        "  len = 5 ;",
        "  t = unlimited ;",
        "variables:",
        "  float tas(t, x) ;",
        "    tas:_FillValue = -1.0e30f ;",
        "    tas:units = \"K\" ;",
        "  char names(x, len) ;",
        "  short s ;",
        "    s:valid = 1s, 2s ;",
        "  double \\5d(x) ;",
        "  int unwritten(x) ;",
        "  :title = \"say \\\"hi\\\"\\n\" ;",
        "  :b = 3b ;",
        "data:",
        "  tas = 1.0f, _, 3.5f ;",
        "  names = \"ab\", \"cde\" ;",
        "  s = -3s ;",
        "  \\5d = 0.5, 1e300 ;",
        "}" );

    @Test
    public void testListing() throws IOException {
        List<String> lines =
            Arrays.asList( list( parse( CDL, "first.nc" ) ).split( "\n" ) );
        assertEquals( "netcdf first {", lines.get( 0 ) );
        assertTrue( lines.contains( "\tx = 2 ;" ) );
        assertTrue( lines.contains( "\tt = UNLIMITED ; // (2 currently)" ) );
        assertTrue( lines.contains( "\tfloat tas(t, x) ;" ) );
        assertTrue( lines.contains( "\t\ttas:_FillValue = -1.0E30f ;" ) );
        assertTrue( lines.contains( "\t\ts:valid = 1s, 2s ;" ) );
        assertTrue( lines.contains( "\tdouble \\5d(x) ;" ) );
        assertTrue( lines.contains( "// global attributes:" ) );
        assertTrue( lines.contains( "\t\t:title = \"say \\\"hi\\\"\\n\" ;" ) );
        assertTrue( lines.contains( "\t\t:b = 3b ;" ) );
        assertTrue( lines.contains( " tas = 1.0f, _, 3.5f, _ ;" ) );
        assertTrue( lines.contains( " names = \"ab\", \"cde\" ;" ) );
        assertTrue( lines.contains( " s = -3s ;" ) );
        assertTrue( lines.contains( " \\5d = 0.5, 1.0E300 ;" ) );
        for ( String line : lines ) {
            assertFalse( line.startsWith( " unwritten =" ) );
        }
        assertEquals( "}", lines.get( lines.size() - 1 ) );
    }

    @Test
    public void testRoundTrip() throws IOException {
        MemoryDataset ds1 = parse( CDL, "first.nc" );
        MemoryDataset ds2 = parse( list( ds1 ), "second.nc" );

        assertEquals( ds1.getDimensions().length, ds2.getDimensions().length );
        assertEquals( 2, ds2.getDimension( "t" ).getLength() );
        assertTrue( ds2.getDimension( "t" ).isUnlimited() );

        Variable[] vars1 = ds1.getVariables();
        assertEquals( vars1.length, ds2.getVariables().length );
        for ( Variable v1 : vars1 ) {
            Variable v2 = ds2.getVariable( v1.getName() );
            assertEquals( v1.toString(), v2.toString() );
            assertArrayEquals( v1.getShape(), v2.getShape() );
            assertTrue( Arrays.deepEquals( new Object[] { v1.readValues() },
                                           new Object[] { v2.readValues() } ),
                        v1.getName() );
            assertEquals( v1.getAttributes().length,
                          v2.getAttributes().length );
        }

        for ( Attribute att : ds1.getGlobalAttributes() ) {
            Object val1 = att.getValue().getShapedValue();
            Object val2 = ds2.getGlobalAttribute( att.getName() ).getValue()
                             .getShapedValue();
            assertEquals( val1, val2, att.getName() );
        }
        assertEquals( "say \"hi\"\n",
                      ds2.getGlobalAttribute( "title" ).getValue()
                         .getShapedValue() );
    }

    @Test
    public void testQuoting() {
        assertEquals( "\"a\\\\b\"", CdlList.quote( "a\\b" ) );
        assertEquals( "\"\\0011\"", CdlList.quote( "\u00011" ) );
        assertEquals( "\"tab\\there\"", CdlList.quote( "tab\there" ) );
        assertEquals( "\\5d", CdlList.formatName( "5d" ) );
        assertEquals( "a\\ b\\:c", CdlList.formatName( "a b:c" ) );
        assertEquals( "lat.bnds_2", CdlList.formatName( "lat.bnds_2" ) );
    }

    private static MemoryDataset parse( String text, String path )
            throws IOException {
        MemoryBackend backend = new MemoryBackend();
        new CdlParser( backend ).parseText( text, path );
        return backend.getDataset( path );
    }

    private static String list( MemoryDataset ds ) {
        ByteArrayOutputStream bout = new ByteArrayOutputStream();
        PrintStream out = new PrintStream( bout, true );
        new CdlList( ds, out, true ).run();
        out.flush();
        return new String( bout.toByteArray(), StandardCharsets.UTF_8 );
    }
}
