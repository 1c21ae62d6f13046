// Colorizer.java
// Percentile-stretched color ramp rendering of a single band, with alpha set
// to the layer opacity on finite pixels and fully transparent on no-data.

package limited.theta.rastermap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Colorizer
{
    private static final Logger LOG = LoggerFactory.getLogger(Colorizer.class);

    private Colorizer() {}

    public static RgbaImage colorize(RasterGrid grid, RenderOptions options) throws EmptyRasterException
    {
        return colorize(grid, ColorRamp.named(options.getColormap()), options.getVmin(), options.getVmax(),
                        options.getOpacity(), options.getLowPercentile(), options.getHighPercentile());
    }

    public static RgbaImage colorize(RasterGrid grid, ColorRamp ramp, Double vmin, Double vmax, double opacity) throws EmptyRasterException
    {
        return colorize(grid, ramp, vmin, vmax, opacity, RenderOptions.DEFAULT_LOW_PERCENTILE, RenderOptions.DEFAULT_HIGH_PERCENTILE);
    }

    public static RgbaImage colorize(RasterGrid grid, ColorRamp ramp, Double vmin, Double vmax, double opacity,
                                     double lowPercentile, double highPercentile) throws EmptyRasterException
    {
        if (!(opacity >= 0 && opacity <= 1)) {
            throw new IllegalArgumentException("Opacity must be in [0,1], got " + opacity);
        }
        StretchRange range = StretchRange.fromGrid(grid, vmin, vmax, lowPercentile, highPercentile);
        LOG.debug("Colorizing {} with {} over {}", grid, ramp.getName(), range);

        int w = grid.getWidth(), h = grid.getHeight();
        int alpha = (int) Math.round(opacity * 255);
        byte[] px = new byte[w * h * 4];
        double[] src = grid.samples();
        for (int i = 0; i < src.length; i++) {
            int o = i * 4;
            if (!Double.isFinite(src[i])) {
                continue; // stays transparent black
            }
            double[] c = ramp.rgb(range.normalize(src[i]));
            px[o]     = (byte) (int) (c[0] * 255);
            px[o + 1] = (byte) (int) (c[1] * 255);
            px[o + 2] = (byte) (int) (c[2] * 255);
            px[o + 3] = (byte) alpha;
        }
        return new RgbaImage(w, h, px, range.min, range.max);
    }
}
