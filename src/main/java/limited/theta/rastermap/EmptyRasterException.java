// EmptyRasterException.java
// Nothing left to render: zero finite pixels or an empty clip window.

package limited.theta.rastermap;

public class EmptyRasterException extends RasterMapException
{
    public EmptyRasterException(String message)
    {
        super(message);
    }
}
