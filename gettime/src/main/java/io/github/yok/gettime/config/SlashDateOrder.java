package io.github.yok.gettime.config;

/**
 * How {@code NN/NN/NNNN HH:mm:ss} strings are read, since US ({@code MM/dd}) and EU
 * ({@code dd/MM}) order share the same shape.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SlashDateOrder {

    /**
     * Both readings are tried; a string that is valid in both orders with different results is
     * rejected as ambiguous.
     */
    STRICT,

    /**
     * US order first, EU order as fallback.
     */
    US_FIRST,

    /**
     * EU order first, US order as fallback.
     */
    EU_FIRST
}
