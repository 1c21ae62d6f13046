// RgbSource.java
// Red, green and blue GeoTIFF bands. Red defines the grid; green and blue are
// resampled bilinearly onto it.

package limited.theta.rastermap;

import java.io.File;
import java.util.Arrays;
import java.util.List;

public final class RgbSource implements RasterSource
{
    private final File red, green, blue;
    private final GeoTiffRasterLoader loader;

    public RgbSource(File red, File green, File blue)
    {
        this(red, green, blue, new GeoTiffRasterLoader());
    }

    public RgbSource(File red, File green, File blue, GeoTiffRasterLoader loader)
    {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.loader = loader;
    }

    @Override
    public String getName()
    {
        return "True color";
    }

    @Override
    public List<GeoRaster> load(Bounds clipBounds) throws RasterMapException
    {
        GeoRaster r = loader.load(red, clipBounds);
        GeoRaster g = onto(loader.load(green, clipBounds), r);
        GeoRaster b = onto(loader.load(blue, clipBounds), r);
        return Arrays.asList(r, g, b);
    }

    @Override
    public List<File> getInputFiles()
    {
        return Arrays.asList(red, green, blue);
    }

    private static GeoRaster onto(GeoRaster band, GeoRaster reference)
    {
        GeoTransform t = reference.getTransform();
        return new GeoRaster(Resampler.resample(band, t, reference.getWidth(), reference.getHeight()), t);
    }
}
