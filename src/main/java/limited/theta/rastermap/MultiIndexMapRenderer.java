// MultiIndexMapRenderer.java
// Several index rasters as toggleable layers of one map; only the first is
// visible initially and the legend shows the ramp on a relative 0..1 scale.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MultiIndexMapRenderer
{
    private static final Logger LOG = LoggerFactory.getLogger(MultiIndexMapRenderer.class);

    private final RenderOptions options;
    private final LayerPipeline pipeline;

    public MultiIndexMapRenderer(RenderOptions options)
    {
        this.options = options;
        this.pipeline = new LayerPipeline(options);
    }

    public RenderOptions getOptions() { return options; }

    public MapDocument build(List<File> rasters, AreaOfInterest aoi) throws RasterMapException, IOException
    {
        if (rasters == null || rasters.isEmpty()) {
            throw new IllegalArgumentException("At least one index raster is required");
        }
        Bounds clip = pipeline.clipBounds(aoi);
        ColorRamp ramp = ColorRamp.named(options.getColormap());

        MapDocument doc = null;
        for (int i = 0; i < rasters.size(); i++) {
            PreparedLayer layer = pipeline.prepare(new GeoTiffSource(rasters.get(i)), aoi, clip);
            RgbaImage image = Colorizer.colorize(layer.getGrid(), options);
            if (doc == null) {
                doc = MapDocument.create(layer.getViewBounds(), MapDocument.DEFAULT_ZOOM, options, true);
            }
            String name = String.format(Locale.ROOT, "%s (%.2f..%.2f)", layer.getName(), image.getMin(), image.getMax());
            doc.addOverlay(MapDocument.ImageOverlay.png(name, image.toPng(), layer.getBounds(), i == 0, true));
            LOG.debug("Added layer {}", name);
        }

        doc.setTitle("Index comparison");
        doc.addOutlines(aoi);
        doc.setLegend(MapDocument.Legend.forRamp(options.getColormap() + " (relative scale per layer)", ramp, 0, 1));
        doc.setLayerControl(true, false);
        return doc;
    }

    public File render(List<File> rasters, List<File> aoiFiles, File output) throws RasterMapException, IOException
    {
        LOG.info("Rendering {} index layers -> {}", rasters.size(), output);
        return MapDocumentWriter.write(build(rasters, AreaOfInterest.load(aoiFiles)), output);
    }
}
