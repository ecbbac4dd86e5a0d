/**
 * Storage interfaces for compiled datasets, and an in-memory
 * implementation of them.
 */
package io.github.mandar2812.cdl.backend;
