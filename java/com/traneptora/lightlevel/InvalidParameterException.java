package com.traneptora.lightlevel;

/**
 * A configuration value that makes the whole batch meaningless.
 * Thrown before any file is analyzed.
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 0x5f1c2b7a90d3e441L;

    public InvalidParameterException(String s) {
        super(s);
    }

    public InvalidParameterException(String s, Throwable t) {
        super(s, t);
    }

    public InvalidParameterException(Throwable t) {
        super(t);
    }

    public InvalidParameterException() {
        super();
    }
}
