/**
 * String timestamp parsing: built-in formats, the runtime custom-format registry and the parser
 * chain that combines them.
 */
package io.github.yok.gettime.parser;
