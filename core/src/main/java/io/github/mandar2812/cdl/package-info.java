/**
 * Pure java compiler front end for CDL, the text notation of netCDF-3
 * datasets.
 *
 * <p>To compile CDL text, construct a
 * {@link io.github.mandar2812.cdl.CdlParser} with a
 * {@link io.github.mandar2812.cdl.backend.DatasetBackend} and call one of
 * its <code>parse</code> methods.  The parser checks the grammar and
 * content of the text and passes dimensions, variables, attributes
 * and data on to the backend, which is responsible for actually storing
 * them.  An in-memory backend is supplied; file-writing backends can be
 * plugged in by implementing the backend interfaces.
 */
package io.github.mandar2812.cdl;
