// GeoTransform.java
// Corner-based (GDAL-style) affine from pixel to world:
//   x = a0 + a1*col + a2*row
//   y = b0 + b1*col + b2*row
// (col,row) = (0,0) is the outer corner of the first pixel.

package limited.theta.rastermap;

public final class GeoTransform
{
    private final double a0, a1, a2, b0, b1, b2;
    private final double inv00, inv01, inv10, inv11;

    private GeoTransform(double a0, double a1, double a2, double b0, double b1, double b2) throws InvalidTransformException
    {
        this.a0 = a0; this.a1 = a1; this.a2 = a2;
        this.b0 = b0; this.b1 = b1; this.b2 = b2;
        double det = a1*b2 - a2*b1;
        if (!(Math.abs(det) > 1e-18) || Double.isNaN(det)) {
            throw new InvalidTransformException("Non-invertible geotransform (det=" + det + ")");
        }
        this.inv00 =  b2/det; this.inv01 = -a2/det;
        this.inv10 = -b1/det; this.inv11 =  a1/det;
    }

    /** General affine in GDAL coefficient order. */
    public static GeoTransform of(double a0, double a1, double a2, double b0, double b1, double b2) throws InvalidTransformException
    {
        return new GeoTransform(a0, a1, a2, b0, b1, b2);
    }

    /**
     * North-up grid with its upper-left corner at (originX, originY). Both
     * pixel sizes are magnitudes and must be positive.
     */
    public static GeoTransform northUp(double originX, double originY, double pixelSizeX, double pixelSizeY) throws InvalidTransformException
    {
        if (!(pixelSizeX > 0) || !(pixelSizeY > 0) || Double.isInfinite(pixelSizeX) || Double.isInfinite(pixelSizeY)) {
            throw new InvalidTransformException("Pixel size must be positive, got " + pixelSizeX + " x " + pixelSizeY);
        }
        return new GeoTransform(originX, pixelSizeX, 0.0, originY, 0.0, -pixelSizeY);
    }

    public double getOriginX() { return a0; }
    public double getOriginY() { return b0; }
    public double getPixelSizeX() { return Math.abs(a1); }
    public double getPixelSizeY() { return Math.abs(b2); }

    public boolean isNorthUp()
    {
        return a2 == 0.0 && b1 == 0.0 && a1 > 0 && b2 < 0;
    }

    public double[] worldFromPixel(double col, double row)
    {
        return new double[] { a0 + a1*col + a2*row, b0 + b1*col + b2*row };
    }

    public double[] pixelFromWorld(double x, double y)
    {
        double dx = x - a0, dy = y - b0;
        return new double[] { inv00*dx + inv01*dy, inv10*dx + inv11*dy };
    }

    // world coordinate of the center of pixel (col,row)
    public double[] pixelCenter(int col, int row)
    {
        return worldFromPixel(col + 0.5, row + 0.5);
    }

    /** Extent of a width x height grid from its four outer corners. */
    public Bounds boundsOf(int width, int height)
    {
        double[] p00 = worldFromPixel(0, 0);
        double[] p10 = worldFromPixel(width, 0);
        double[] p01 = worldFromPixel(0, height);
        double[] p11 = worldFromPixel(width, height);

        double minX = Math.min(Math.min(p00[0], p10[0]), Math.min(p01[0], p11[0]));
        double maxX = Math.max(Math.max(p00[0], p10[0]), Math.max(p01[0], p11[0]));
        double minY = Math.min(Math.min(p00[1], p10[1]), Math.min(p01[1], p11[1]));
        double maxY = Math.max(Math.max(p00[1], p10[1]), Math.max(p01[1], p11[1]));
        return new Bounds(minX, minY, maxX, maxY);
    }

    /** Same origin, pixel size divided by factor. */
    public GeoTransform refined(double factor) throws InvalidTransformException
    {
        return new GeoTransform(a0, a1/factor, a2/factor, b0, b1/factor, b2/factor);
    }

    /** Same pixel size, origin moved to the outer corner of pixel (col,row). */
    public GeoTransform shifted(double col, double row) throws InvalidTransformException
    {
        double[] p = worldFromPixel(col, row);
        return new GeoTransform(p[0], a1, a2, p[1], b1, b2);
    }

    @Override
    public String toString()
    {
        return String.format("GeoTransform[%.9f, %.9f, %.9f, %.9f, %.9f, %.9f]", a0, a1, a2, b0, b1, b2);
    }
}
