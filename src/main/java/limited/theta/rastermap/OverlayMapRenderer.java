// OverlayMapRenderer.java
// Index point tables drawn over a true-color backdrop. The backdrop is always
// on and kept out of the layer control; the index layers are toggleable with
// only the first one visible.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OverlayMapRenderer
{
    private static final Logger LOG = LoggerFactory.getLogger(OverlayMapRenderer.class);

    private final RenderOptions options;
    private final LayerPipeline pipeline;

    public OverlayMapRenderer(RenderOptions options)
    {
        this.options = options;
        this.pipeline = new LayerPipeline(options);
    }

    public RenderOptions getOptions() { return options; }

    /**
     * Point tables in csvDir, in name order.
     *
     * @param indices file stems to keep; null or empty keeps them all
     * @throws InputNotFoundException when nothing is left to draw
     */
    public static List<File> listTables(File csvDir, Collection<String> indices) throws InputNotFoundException
    {
        if (!csvDir.isDirectory()) {
            throw new InputNotFoundException("CSV directory not found: " + csvDir);
        }
        File[] found = csvDir.listFiles((d, name) -> name.toLowerCase(Locale.ROOT).endsWith(".csv"));
        List<File> tables = new ArrayList<>();
        if (found != null) {
            Arrays.sort(found);
            for (File f : found) {
                if (indices == null || indices.isEmpty() || indices.contains(RasterSource.stem(f))) {
                    tables.add(f);
                }
            }
        }
        if (tables.isEmpty()) {
            throw new InputNotFoundException("No index CSV files in " + csvDir
                                             + (indices == null || indices.isEmpty() ? "" : " matching " + indices));
        }
        return tables;
    }

    public MapDocument build(List<File> tables, RgbSource backdrop, AreaOfInterest aoi) throws RasterMapException, IOException
    {
        PreparedLayer rgbLayer = TrueColorCompositor.prepare(backdrop, aoi, options);
        RgbImage rgb = TrueColorCompositor.compose(rgbLayer, options);
        Bounds view = rgbLayer.getViewBounds();

        MapDocument doc = MapDocument.create(view, TrueColorMapRenderer.ZOOM, options, false);
        doc.setTitle("Index overlays");
        doc.addOverlay(MapDocument.ImageOverlay.png(rgbLayer.getName(), rgb.toPng(), rgbLayer.getBounds(), true, false));
        doc.addOutlines(aoi);

        Bounds clip = pipeline.clipBounds(aoi);
        for (int i = 0; i < tables.size(); i++) {
            PreparedLayer layer = pipeline.prepare(new CsvSource(tables.get(i)), aoi, clip);
            RgbaImage image = Colorizer.colorize(layer.getGrid(), options);
            doc.addOverlay(MapDocument.ImageOverlay.png(layer.getName(), image.toPng(), layer.getBounds(), i == 0, true));
            LOG.debug("Overlay {} range {}..{}", layer.getName(), image.getMin(), image.getMax());
        }

        doc.setLegend(MapDocument.Legend.forRamp(options.getColormap() + " (relative scale per layer)",
                                                 ColorRamp.named(options.getColormap()), 0, 1));
        doc.setLayerControl(true, false);
        doc.fitTo(view);
        return doc;
    }

    public File render(File csvDir, RgbSource backdrop, List<File> aoiFiles, Collection<String> indices, File output)
        throws RasterMapException, IOException
    {
        List<File> tables = listTables(csvDir, indices);
        LOG.info("Rendering {} index tables over true color -> {}", tables.size(), output);
        return MapDocumentWriter.write(build(tables, backdrop, AreaOfInterest.load(aoiFiles)), output);
    }
}
