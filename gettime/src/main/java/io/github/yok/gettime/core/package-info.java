/**
 * Conversion pipeline stages: normalization, timezone shift and rendering.
 *
 * <p>
 * Every stage returns a {@link io.github.yok.gettime.model.ConversionResult}; exceptions raised by
 * external collaborators are caught at the stage boundary.
 * </p>
 */
package io.github.yok.gettime.core;
