/**
 * Root package of Gettime.
 *
 * <p>
 * Converts timestamps read from a database (date-time values, Unix epoch numbers and common text
 * formats) into a user's timezone and renders them with a strftime-style format.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.gettime.config}: configuration models</li>
 * <li>{@code io.github.yok.gettime.core}: conversion pipeline stages</li>
 * <li>{@code io.github.yok.gettime.parser}: string parsers and the custom-format registry</li>
 * <li>{@code io.github.yok.gettime.zone}: timezone database access</li>
 * <li>{@code io.github.yok.gettime.format}: strftime rendering</li>
 * </ul>
 */
package io.github.yok.gettime;
