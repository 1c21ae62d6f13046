// TrueColorMapRenderer.java
// Red/green/blue band rasters composited into an opaque RGB overlay.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TrueColorMapRenderer
{
    private static final Logger LOG = LoggerFactory.getLogger(TrueColorMapRenderer.class);

    public static final int ZOOM = 12;

    private final RenderOptions options;

    public TrueColorMapRenderer()
    {
        this(RenderOptions.trueColorDefaults());
    }

    public TrueColorMapRenderer(RenderOptions options)
    {
        this.options = options;
    }

    public RenderOptions getOptions() { return options; }

    static String legendCaption(RenderOptions options)
    {
        return String.format(Locale.ROOT, "RGB (%s-%s%%)",
                             trim(options.getLowPercentile()), trim(options.getHighPercentile()));
    }

    // 2.0 -> "2", 2.5 -> "2.5"
    private static String trim(double v)
    {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }

    public MapDocument build(RgbSource source, AreaOfInterest aoi) throws RasterMapException, IOException
    {
        PreparedLayer layer = TrueColorCompositor.prepare(source, aoi, options);
        RgbImage image = TrueColorCompositor.compose(layer, options);

        MapDocument doc = MapDocument.create(layer.getViewBounds(), ZOOM, options, true);
        doc.setTitle(layer.getName());
        doc.addOverlay(MapDocument.ImageOverlay.png(layer.getName(), image.toPng(), layer.getBounds(), true, true));
        doc.addOutlines(aoi);
        doc.setLegend(new MapDocument.Legend(legendCaption(options), Arrays.asList("#000000", "#ffffff"), 0, 255));
        doc.fitTo(layer.getViewBounds());
        return doc;
    }

    public File render(RgbSource source, List<File> aoiFiles, File output) throws RasterMapException, IOException
    {
        LOG.info("Rendering true color from {} -> {}", source.getInputFiles(), output);
        return MapDocumentWriter.write(build(source, AreaOfInterest.load(aoiFiles)), output);
    }
}
