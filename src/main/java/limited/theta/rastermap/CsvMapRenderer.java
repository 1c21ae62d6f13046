// CsvMapRenderer.java
// Point table rebuilt into a grid and rendered like an index raster.

package limited.theta.rastermap;

import java.io.File;

public class CsvMapRenderer extends SingleLayerRenderer
{
    public CsvMapRenderer(RenderOptions options)
    {
        super(options);
    }

    @Override
    protected RasterSource source(File input)
    {
        return new CsvSource(input);
    }
}
