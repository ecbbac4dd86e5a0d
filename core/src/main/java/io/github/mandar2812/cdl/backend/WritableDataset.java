package io.github.mandar2812.cdl.backend;

import java.io.Closeable;
import java.io.IOException;

import io.github.mandar2812.cdl.AttributeValue;
import io.github.mandar2812.cdl.DataType;

/**
 * Handle on a dataset being populated.
 * Requests are issued in CDL order: dimensions, then variables and
 * attributes, then data.
 *
 * @since    15 Oct 2026
 */
public interface WritableDataset extends Closeable {

    /**
     * Returns the location at which this dataset was created.
     *
     * @return  path
     */
    String getPath();

    /**
     * Creates a dimension.
     *
     * @param  name  dimension name
     * @param  length  dimension length, or 0 for the unlimited dimension
     */
    void createDimension( String name, int length ) throws IOException;

    /**
     * Creates a variable.
     *
     * @param  name  variable name
     * @param  dataType  storage type
     * @param  dimNames  names of existing dimensions giving the shape,
     *                   slowest varying first; empty for a scalar
     */
    void createVariable( String name, DataType dataType, String[] dimNames )
            throws IOException;

    /**
     * Sets an attribute, replacing any existing one of the same name.
     *
     * @param  varName  name of the owning variable,
     *                  or null for a global attribute
     * @param  attName  attribute name
     * @param  value   attribute value
     */
    void setAttribute( String varName, String attName, AttributeValue value )
            throws IOException;

    /**
     * Writes data values to a variable, starting at its first element
     * in row-major order.  Elements beyond the end of the supplied
     * array are left at the variable's fill value.
     * For a record variable, the unlimited dimension grows to
     * accommodate the data.
     *
     * @param  varName  variable name
     * @param  rawValues  primitive array of the variable's data type
     */
    void writeVariableData( String varName, Object rawValues )
            throws IOException;

    /**
     * Finishes writing.  Further requests will fail.
     */
    void close() throws IOException;
}
