// InvalidTransformException.java
// Non-positive pixel size, singular affine or missing georeferencing.

package limited.theta.rastermap;

public class InvalidTransformException extends RasterMapException
{
    public InvalidTransformException(String message)
    {
        super(message);
    }
}
