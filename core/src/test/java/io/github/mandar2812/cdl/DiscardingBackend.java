package io.github.mandar2812.cdl;

import java.io.IOException;
import java.lang.reflect.Array;

import io.github.mandar2812.cdl.backend.DatasetBackend;
import io.github.mandar2812.cdl.backend.WritableDataset;

/**
 * Backend which accepts every request and stores nothing,
 * so that datasets too large for memory can be compiled.
 */
class DiscardingBackend implements DatasetBackend {

    private long nWritten_;

    public WritableDataset create( final String path, FileFormat format ) {
        return new WritableDataset() {
            public String getPath() {
                return path;
            }
            public void createDimension( String name, int length ) {
            }
            public void createVariable( String name, DataType type,
                                        String[] dimNames ) {
            }
            public void setAttribute( String varName, String attName,
                                      AttributeValue value ) {
            }
            public void writeVariableData( String varName, Object values )
                    throws IOException {
                nWritten_ += Array.getLength( values );
            }
            public void close() {
            }
        };
    }

    /**
     * Returns the total number of data elements written to datasets
     * from this backend.
     */
    long getWrittenCount() {
        return nWritten_;
    }
}
