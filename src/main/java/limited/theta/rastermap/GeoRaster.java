// GeoRaster.java
// A grid paired with the geotransform that places it on the map.

package limited.theta.rastermap;

public final class GeoRaster
{
    private final RasterGrid grid;
    private final GeoTransform transform;

    public GeoRaster(RasterGrid grid, GeoTransform transform)
    {
        if (grid == null || transform == null) {
            throw new IllegalArgumentException("grid and transform are required");
        }
        this.grid = grid;
        this.transform = transform;
    }

    public RasterGrid getGrid() { return grid; }
    public GeoTransform getTransform() { return transform; }
    public int getWidth()  { return grid.getWidth(); }
    public int getHeight() { return grid.getHeight(); }

    public Bounds getBounds()
    {
        return transform.boundsOf(grid.getWidth(), grid.getHeight());
    }

    public GeoRaster withGrid(RasterGrid other)
    {
        if (other.getWidth() != grid.getWidth() || other.getHeight() != grid.getHeight()) {
            throw new IllegalArgumentException("Grid shape " + other.getWidth() + "x" + other.getHeight()
                                               + " does not match " + grid.getWidth() + "x" + grid.getHeight());
        }
        return new GeoRaster(other, transform);
    }

    @Override
    public String toString()
    {
        return "GeoRaster[" + grid + ", " + transform + "]";
    }
}
