package io.github.mandar2812.cdl.backend;

import java.io.IOException;

import io.github.mandar2812.cdl.FileFormat;

/**
 * Persistence capability to which parsed CDL content is delivered.
 * The parser only ever issues well-formed creation and write requests;
 * how they are stored is up to the implementation.
 *
 * @since    15 Oct 2026
 */
public interface DatasetBackend {

    /**
     * Creates a new empty dataset open for writing.
     *
     * @param  path  location of the new dataset
     * @param  format  container format variant
     * @return  writable dataset handle
     * @throws  IOException  if the dataset cannot be created
     */
    WritableDataset create( String path, FileFormat format )
            throws IOException;
}
