// UnsupportedGeometryException.java

package limited.theta.rastermap;

public class UnsupportedGeometryException extends RasterMapException
{
    public UnsupportedGeometryException(String message)
    {
        super(message);
    }

    public UnsupportedGeometryException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
