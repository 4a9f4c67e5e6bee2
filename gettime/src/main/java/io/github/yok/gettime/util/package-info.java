/**
 * CLI support utilities.
 */
package io.github.yok.gettime.util;
