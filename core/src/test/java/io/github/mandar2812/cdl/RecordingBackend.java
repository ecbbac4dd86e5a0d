package io.github.mandar2812.cdl;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

import io.github.mandar2812.cdl.backend.DatasetBackend;
import io.github.mandar2812.cdl.backend.MemoryBackend;
import io.github.mandar2812.cdl.backend.MemoryDataset;
import io.github.mandar2812.cdl.backend.WritableDataset;

/**
 * Backend which logs each request it receives before passing it on
 * to an in-memory backend.
 */
class RecordingBackend implements DatasetBackend {

    private final MemoryBackend base_;
    private final List<String> calls_;

    RecordingBackend() {
        base_ = new MemoryBackend();
        calls_ = new ArrayList<String>();
    }

    public WritableDataset create( String path, FileFormat format )
            throws IOException {
        calls_.add( "create " + path + " " + format );
        final MemoryDataset ds = base_.create( path, format );
        return new WritableDataset() {
            public String getPath() {
                return ds.getPath();
            }
            public void createDimension( String name, int length )
                    throws IOException {
                calls_.add( "dim " + name + " " + length );
                ds.createDimension( name, length );
            }
            public void createVariable( String name, DataType type,
                                        String[] dimNames )
                    throws IOException {
                calls_.add( "var " + name + " " + type + " "
                          + String.join( ",", dimNames ) );
                ds.createVariable( name, type, dimNames );
            }
            public void setAttribute( String varName, String attName,
                                      AttributeValue value )
                    throws IOException {
                calls_.add( "att " + varName + ":" + attName );
                ds.setAttribute( varName, attName, value );
            }
            public void writeVariableData( String varName, Object values )
                    throws IOException {
                calls_.add( "data " + varName + " "
                          + Array.getLength( values ) );
                ds.writeVariableData( varName, values );
            }
            public void close() {
                calls_.add( "close" );
                ds.close();
            }
        };
    }

    List<String> getCalls() {
        return calls_;
    }

    MemoryDataset getDataset( String path ) {
        return base_.getDataset( path );
    }
}
