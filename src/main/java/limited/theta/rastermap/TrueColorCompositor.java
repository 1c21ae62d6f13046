// TrueColorCompositor.java
// Opaque RGB composite from three bands, each stretched on its own between
// its low and high percentiles. No-data becomes black rather than transparent.

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TrueColorCompositor
{
    private static final Logger LOG = LoggerFactory.getLogger(TrueColorCompositor.class);

    private TrueColorCompositor() {}

    /**
     * Load the bands, clipped to the padded AOI box whenever an AOI is given,
     * and unsharp-mask each one when sharpening is enabled.
     */
    public static PreparedLayer prepare(RgbSource source, AreaOfInterest aoi, RenderOptions options) throws RasterMapException
    {
        Bounds clip = aoi.hasDocuments() ? aoi.getClipBounds(options.getPaddingFactor()) : null;
        List<GeoRaster> loaded = source.load(clip);

        List<RasterGrid> bands = new ArrayList<>();
        for (GeoRaster band : loaded) {
            RasterGrid g = band.getGrid();
            if (options.isSharpen()) {
                g = Enhancement.unsharpMask(g, options.getSharpenRadius(), options.getSharpenAmount());
            }
            bands.add(g);
        }
        return new PreparedLayer(source.getName(), bands, loaded.get(0).getTransform(), clip, aoi.getPolygons());
    }

    public static RgbImage compose(PreparedLayer layer, RenderOptions options) throws EmptyRasterException
    {
        return compose(layer.getBands(), options.getLowPercentile(), options.getHighPercentile());
    }

    /**
     * @throws EmptyRasterException when any band has no finite value
     */
    public static RgbImage compose(List<RasterGrid> bands, double lowPercentile, double highPercentile) throws EmptyRasterException
    {
        if (bands.size() != 3) {
            throw new IllegalArgumentException("True color needs exactly 3 bands, got " + bands.size());
        }
        int w = bands.get(0).getWidth(), h = bands.get(0).getHeight();
        byte[] px = new byte[w * h * 3];
        for (int b = 0; b < 3; b++) {
            RasterGrid band = bands.get(b);
            if (band.getWidth() != w || band.getHeight() != h) {
                throw new IllegalArgumentException("Band " + b + " is " + band.getWidth() + "x" + band.getHeight()
                                                   + ", expected " + w + "x" + h);
            }
            StretchRange range = StretchRange.fromGrid(band, null, null, lowPercentile, highPercentile);
            LOG.debug("Band {} stretch {}", b, range);
            double[] src = band.samples();
            for (int i = 0; i < src.length; i++) {
                double t = Double.isFinite(src[i]) ? range.normalize(src[i]) : 0.0;
                px[i * 3 + b] = (byte) (int) (t * 255);
            }
        }
        return new RgbImage(w, h, px);
    }
}
