// SingleLayerRenderer.java
// One colorized layer on a base map with a min/max legend. Subclasses only
// decide where the pixels come from.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class SingleLayerRenderer
{
    private static final Logger LOG = LoggerFactory.getLogger(SingleLayerRenderer.class);

    protected final RenderOptions options;
    protected final LayerPipeline pipeline;

    protected SingleLayerRenderer(RenderOptions options)
    {
        this.options = options;
        this.pipeline = new LayerPipeline(options);
    }

    protected abstract RasterSource source(File input);

    public RenderOptions getOptions() { return options; }

    public PreparedLayer prepare(File input, AreaOfInterest aoi) throws RasterMapException
    {
        return pipeline.prepare(source(input), aoi);
    }

    public MapDocument build(PreparedLayer layer, AreaOfInterest aoi) throws RasterMapException, IOException
    {
        RgbaImage image = Colorizer.colorize(layer.getGrid(), options);

        MapDocument doc = MapDocument.create(layer.getViewBounds(), MapDocument.DEFAULT_ZOOM, options, true);
        doc.setTitle(layer.getName());
        doc.addOverlay(MapDocument.ImageOverlay.png(layer.getName(), image.toPng(), layer.getBounds(), true, true));
        doc.setLegend(MapDocument.Legend.forRamp(
            String.format(Locale.ROOT, "%s (min=%.3f, max=%.3f)", layer.getName(), image.getMin(), image.getMax()),
            ColorRamp.named(options.getColormap()), image.getMin(), image.getMax()));
        doc.addOutlines(aoi);
        return doc;
    }

    public File render(File input, List<File> aoiFiles, File output) throws RasterMapException, IOException
    {
        LOG.info("Rendering {} -> {}", input, output);
        AreaOfInterest aoi = AreaOfInterest.load(aoiFiles);
        PreparedLayer layer = prepare(input, aoi);
        return MapDocumentWriter.write(build(layer, aoi), output);
    }

    /** Point-table export of a prepared layer's finite pixels. */
    public File exportCsv(PreparedLayer layer, File output) throws IOException
    {
        return CsvGridExporter.export(layer.getRaster(), output);
    }
}
