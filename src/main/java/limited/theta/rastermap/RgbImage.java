// RgbImage.java
// Opaque 8-bit RGB composite; no alpha channel.

package limited.theta.rastermap;

import java.awt.image.BufferedImage;
import java.io.IOException;

public final class RgbImage
{
    private final int width, height;
    private final byte[] pixels; // r,g,b per pixel, row-major

    RgbImage(int width, int height, byte[] pixels)
    {
        if (pixels.length != width * height * 3) {
            throw new IllegalArgumentException("Expected " + (width * height * 3) + " bytes, got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public int getWidth()  { return width; }
    public int getHeight() { return height; }

    public int getComponent(int row, int col, int component)
    {
        return pixels[(row * width + col) * 3 + component] & 0xff;
    }

    public BufferedImage toBufferedImage()
    {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int i = (row * width + col) * 3;
                img.setRGB(col, row, ((pixels[i] & 0xff) << 16) | ((pixels[i+1] & 0xff) << 8) | (pixels[i+2] & 0xff));
            }
        }
        return img;
    }

    public byte[] toPng() throws IOException
    {
        return ImageEncoding.toPng(toBufferedImage());
    }
}
