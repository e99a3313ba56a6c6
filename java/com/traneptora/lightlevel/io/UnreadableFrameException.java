package com.traneptora.lightlevel.io;

import java.io.IOException;

public class UnreadableFrameException extends IOException {

    private static final long serialVersionUID = 0x2e8a4c19b7f06d53L;

    public UnreadableFrameException(String s) {
        super(s);
    }

    public UnreadableFrameException(String s, Throwable t) {
        super(s, t);
    }

    public UnreadableFrameException(Throwable t) {
        super(t);
    }

    public UnreadableFrameException() {
        super();
    }
}
