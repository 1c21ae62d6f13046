// IndexMapRenderer.java
// Single GeoTIFF index (NDVI, NDWI, ...) as a colorized web map.

package limited.theta.rastermap;

import java.io.File;

public class IndexMapRenderer extends SingleLayerRenderer
{
    public IndexMapRenderer(RenderOptions options)
    {
        super(options);
    }

    @Override
    protected RasterSource source(File input)
    {
        return new GeoTiffSource(input);
    }
}
