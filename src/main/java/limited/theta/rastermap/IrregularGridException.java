// IrregularGridException.java
// The point table does not tile a complete rectangular lon x lat grid.

package limited.theta.rastermap;

public class IrregularGridException extends RasterMapException
{
    public IrregularGridException(String message)
    {
        super(message);
    }
}
