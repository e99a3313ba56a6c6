package com.traneptora.lightlevel.io;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import com.traneptora.lightlevel.util.PixelBuffer;

/**
 * Reads frames with the JDK's image readers (TIFF included since Java 9).
 * Samples narrower than 16 bits are rescaled to the full 16-bit range. Gray
 * images are expanded to three equal channels and any alpha channel is
 * dropped. Palette images are refused.
 */
public class TiffFrameDecoder implements FrameDecoder {

    @Override
    public PixelBuffer decode(Path path) throws IOException {
        if (!Files.isRegularFile(path))
            throw new UnreadableFrameException("No such file: " + path);
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException ex) {
            throw new UnreadableFrameException("Unable to decode " + path, ex);
        }
        if (image == null)
            throw new UnreadableFrameException("No image reader for " + path);
        return toPixelBuffer(image);
    }

    /**
     * Palette images are rejected, since their samples are indices and not levels.
     */
    public static PixelBuffer toPixelBuffer(BufferedImage image) throws UnreadableFrameException {
        if (image.getColorModel() instanceof IndexColorModel)
            throw new UnreadableFrameException("Palette images are not supported");
        return toPixelBuffer(image.getRaster());
    }

    public static PixelBuffer toPixelBuffer(Raster raster) throws UnreadableFrameException {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = raster.getNumBands();
        if (bands < 1)
            throw new UnreadableFrameException("Image has no channels");
        int colors = bands < PixelBuffer.CHANNELS ? 1 : PixelBuffer.CHANNELS;
        int[] sampleSizes = raster.getSampleModel().getSampleSize();
        for (int c = 0; c < colors; c++) {
            if (sampleSizes[c] > 16)
                throw new UnreadableFrameException("Unsupported sample size: " + sampleSizes[c]);
        }

        short[] samples = new short[width * height * PixelBuffer.CHANNELS];
        int[] row = new int[width * bands];
        for (int y = 0; y < height; y++) {
            raster.getPixels(raster.getMinX(), raster.getMinY() + y, width, 1, row);
            int out = y * width * PixelBuffer.CHANNELS;
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < PixelBuffer.CHANNELS; c++) {
                    int band = colors == 1 ? 0 : c;
                    samples[out++] = (short)scaleTo16(row[x * bands + band], sampleSizes[band]);
                }
            }
        }
        return new PixelBuffer(width, height, samples, false);
    }

    private static int scaleTo16(int value, int bits) {
        if (bits == 16)
            return value;
        int max = ~(~0 << bits);
        return (int)((value * (long)PixelBuffer.MAX_VALUE + max / 2) / max);
    }
}
