// InputNotFoundException.java
// Raised when a raster, geometry or point table cannot be opened or has no usable band.

package limited.theta.rastermap;

import java.io.File;

public class InputNotFoundException extends RasterMapException
{
    public InputNotFoundException(String message)
    {
        super(message);
    }

    public InputNotFoundException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public static InputNotFoundException forFile(File file, Throwable cause)
    {
        return new InputNotFoundException("Unable to read " + file.getPath(), cause);
    }
}
