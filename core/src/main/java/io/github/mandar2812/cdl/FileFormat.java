package io.github.mandar2812.cdl;

/**
 * Variants of the classic netCDF container format that a dataset
 * may be created in.  The choice is passed through to the backend
 * when the dataset is opened; the parser itself does not depend on it.
 *
 * @since    14 Oct 2026
 */
public enum FileFormat {

    /** Classic format, 32-bit offsets. */
    CLASSIC( "NETCDF3_CLASSIC" ),

    /** 64-bit offset format. */
    OFFSET_64BIT( "NETCDF3_64BIT_OFFSET", "NETCDF3_64BIT" ),

    /** 64-bit data (CDF-5) format. */
    DATA_64BIT( "NETCDF3_64BIT_DATA" ),

    /** HDF5-based format restricted to the classic data model. */
    NETCDF4_CLASSIC( "NETCDF4_CLASSIC" );

    private final String name_;
    private final String[] aliases_;

    /**
     * Constructor.
     *
     * @param  name  canonical format name
     * @param  aliases  other accepted names
     */
    FileFormat( String name, String... aliases ) {
        name_ = name;
        aliases_ = aliases;
    }

    /**
     * Returns the canonical name of this format, as used by the netCDF
     * library (for instance "NETCDF3_CLASSIC").
     *
     * @return  format name
     */
    public String getFormatName() {
        return name_;
    }

    /**
     * Returns the format with a given name.  Matching is case-insensitive,
     * and the enum constant names are accepted as well as the
     * netCDF library names.
     *
     * @param  name  format name
     * @return  format
     * @throws  IllegalArgumentException  if no format has that name
     */
    public static FileFormat forName( String name ) {
        for ( FileFormat fmt : values() ) {
            if ( fmt.name_.equalsIgnoreCase( name ) ||
                 fmt.name().equalsIgnoreCase( name ) ) {
                return fmt;
            }
            for ( String alias : fmt.aliases_ ) {
                if ( alias.equalsIgnoreCase( name ) ) {
                    return fmt;
                }
            }
        }
        StringBuffer sbuf = new StringBuffer()
            .append( "Unknown format \"" )
            .append( name )
            .append( "\"; known formats are" );
        for ( FileFormat fmt : values() ) {
            sbuf.append( ' ' )
                .append( fmt.name_ );
        }
        throw new IllegalArgumentException( sbuf.toString() );
    }
}
