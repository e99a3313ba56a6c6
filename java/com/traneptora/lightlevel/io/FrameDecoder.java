package com.traneptora.lightlevel.io;

import java.io.IOException;
import java.nio.file.Path;

import com.traneptora.lightlevel.util.PixelBuffer;

/**
 * Turns a file into 16-bit RGB samples. Implementations must be safe to call
 * from several worker threads at once.
 */
@FunctionalInterface
public interface FrameDecoder {
    public PixelBuffer decode(Path path) throws IOException;
}
