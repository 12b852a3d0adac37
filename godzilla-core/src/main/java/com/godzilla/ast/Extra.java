package com.godzilla.ast;

/**
 * Verbatim literal text kept next to the normalized value, e.g. {@code 'hi'}
 * (raw) for the value {@code hi}. {@code rawValue} is whatever JSON scalar the
 * document carried: a String for strings, a Number for numbers.
 */
public record Extra(Object rawValue, String raw) {}
