// RasterMapException.java
// Base class for every typed failure raised by the raster to map pipeline.

package limited.theta.rastermap;

public class RasterMapException extends Exception
{
    public RasterMapException(String message)
    {
        super(message);
    }

    public RasterMapException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
