package de.htwsaar.urlmap.mapping.content;

/**
 * Aufrufform einer registrierten View.
 */
public enum ViewKind {
    /** erst mit {@code initkwargs} instanziieren, dann mit den übrigen Optionen aufrufen */
    CLASS,
    /** direkt mit allen Optionen aufrufen */
    FUNCTION
}
