package com.txlens.domain;

/**
 * Human-readable signature found for a function selector or an event topic the built-in catalogue does not know.
 *
 * @param source lookup service that supplied it, e.g. {@code 4byte}
 */
public record ResolvedSignature(String hexSignature, String textSignature, Kind kind, String source) {

    public enum Kind {
        FUNCTION,
        EVENT
    }

    /** Name without the argument list, e.g. {@code transfer}. */
    public String shortName() {
        int paren = textSignature.indexOf('(');
        return paren > 0 ? textSignature.substring(0, paren) : textSignature;
    }
}
