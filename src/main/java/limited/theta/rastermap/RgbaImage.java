// RgbaImage.java
// 8-bit RGBA pixels of a colorized layer plus the value range used to stretch it.

package limited.theta.rastermap;

import java.awt.image.BufferedImage;
import java.io.IOException;

public final class RgbaImage
{
    private final int width, height;
    private final byte[] pixels; // r,g,b,a per pixel, row-major
    private final double min, max;

    RgbaImage(int width, int height, byte[] pixels, double min, double max)
    {
        if (pixels.length != width * height * 4) {
            throw new IllegalArgumentException("Expected " + (width * height * 4) + " bytes, got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
        this.min = min;
        this.max = max;
    }

    public int getWidth()  { return width; }
    public int getHeight() { return height; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    /** Component 0..3 (r,g,b,a) of pixel (row,col) as 0..255. */
    public int getComponent(int row, int col, int component)
    {
        return pixels[(row * width + col) * 4 + component] & 0xff;
    }

    public BufferedImage toBufferedImage()
    {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int i = (row * width + col) * 4;
                int argb = ((pixels[i+3] & 0xff) << 24) | ((pixels[i] & 0xff) << 16)
                         | ((pixels[i+1] & 0xff) << 8) | (pixels[i+2] & 0xff);
                img.setRGB(col, row, argb);
            }
        }
        return img;
    }

    public byte[] toPng() throws IOException
    {
        return ImageEncoding.toPng(toBufferedImage());
    }
}
