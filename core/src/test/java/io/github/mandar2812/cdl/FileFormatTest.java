package io.github.mandar2812.cdl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class FileFormatTest {

    @Test
    public void testNames() {
        assertSame( FileFormat.CLASSIC, FileFormat.forName( "NETCDF3_CLASSIC" ) );
        assertSame( FileFormat.OFFSET_64BIT,
                    FileFormat.forName( "netcdf3_64bit_offset" ) );
        assertSame( FileFormat.OFFSET_64BIT,
                    FileFormat.forName( "NETCDF3_64BIT" ) );
        assertSame( FileFormat.DATA_64BIT,
                    FileFormat.forName( "NETCDF3_64BIT_DATA" ) );
        assertSame( FileFormat.NETCDF4_CLASSIC,
                    FileFormat.forName( "netcdf4_classic" ) );
        assertSame( FileFormat.CLASSIC, FileFormat.forName( "classic" ) );
        assertEquals( "NETCDF3_CLASSIC", FileFormat.CLASSIC.getFormatName() );
    }

    @Test
    public void testUnknown() {
        IllegalArgumentException err =
            assertThrows( IllegalArgumentException.class,
                          () -> FileFormat.forName( "HDF5" ) );
        assertTrue( err.getMessage().contains( "NETCDF3_CLASSIC" ) );
    }
}
