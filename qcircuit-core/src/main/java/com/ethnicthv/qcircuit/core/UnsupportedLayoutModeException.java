package com.ethnicthv.qcircuit.core;

/**
 * Thrown when a layout selector does not name a supported layout mode.
 * There is no silent fallback to a default mode.
 */
public class UnsupportedLayoutModeException extends RuntimeException {
    private final String selector;

    public UnsupportedLayoutModeException(String selector) {
        super("Unsupported layout mode: '" + selector + "' (expected one of serial, horizontal, packed, parallel, vertical)");
        this.selector = selector;
    }

    /**
     * The rejected selector, as passed by the caller (may be null).
     */
    public String getSelector() {
        return selector;
    }
}
