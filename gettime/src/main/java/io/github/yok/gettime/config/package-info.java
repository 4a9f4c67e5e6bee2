/**
 * Configuration model package for Gettime.
 *
 * <p>
 * Holds values bound from {@code application.yml} under the {@code gettime} prefix and the
 * per-call snapshot derived from them.
 * </p>
 */
package io.github.yok.gettime.config;
