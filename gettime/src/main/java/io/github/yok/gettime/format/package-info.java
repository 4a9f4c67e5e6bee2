/**
 * Rendering of zoned date-times with strftime-style format strings.
 */
package io.github.yok.gettime.format;
