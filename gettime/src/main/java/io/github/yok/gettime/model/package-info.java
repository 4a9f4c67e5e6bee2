/**
 * Value types exchanged by the conversion pipeline: tagged timestamp inputs and typed results.
 */
package io.github.yok.gettime.model;
