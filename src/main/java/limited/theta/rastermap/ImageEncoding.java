// ImageEncoding.java
// PNG encoding of overlay images for embedding in the map document.

package limited.theta.rastermap;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

import javax.imageio.ImageIO;

final class ImageEncoding
{
    private ImageEncoding() {}

    static byte[] toPng(BufferedImage image) throws IOException
    {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", bos)) {
            throw new IOException("No PNG writer available");
        }
        return bos.toByteArray();
    }

    static String toDataUri(byte[] png)
    {
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(png);
    }
}
