/**
 * Tokenizer for CDL text.
 */
package io.github.mandar2812.cdl.lex;
