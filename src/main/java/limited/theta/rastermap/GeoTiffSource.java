// GeoTiffSource.java

package limited.theta.rastermap;

import java.io.File;
import java.util.Collections;
import java.util.List;

public final class GeoTiffSource implements RasterSource
{
    private final File file;
    private final GeoTiffRasterLoader loader;

    public GeoTiffSource(File file)
    {
        this(file, new GeoTiffRasterLoader());
    }

    public GeoTiffSource(File file, GeoTiffRasterLoader loader)
    {
        this.file = file;
        this.loader = loader;
    }

    @Override
    public String getName()
    {
        return RasterSource.stem(file);
    }

    @Override
    public List<GeoRaster> load(Bounds clipBounds) throws RasterMapException
    {
        return Collections.singletonList(loader.load(file, clipBounds));
    }

    @Override
    public List<File> getInputFiles()
    {
        return Collections.singletonList(file);
    }
}
