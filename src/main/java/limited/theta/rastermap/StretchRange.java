// StretchRange.java
// (min, max) used to normalize values for display; min < max always holds.

package limited.theta.rastermap;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class StretchRange
{
    private static final Logger LOG = LoggerFactory.getLogger(StretchRange.class);

    /** Width forced onto a range whose ends coincide. */
    public static final double DEGENERATE_EPSILON = 1e-3;

    public final double min, max;

    private StretchRange(double min, double max)
    {
        this.min = min;
        this.max = max;
    }

    /**
     * Range from explicit bounds; when the two ends are (numerically) equal or
     * inverted, max becomes min + DEGENERATE_EPSILON.
     */
    public static StretchRange of(double min, double max)
    {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Stretch bounds must be finite, got " + min + ", " + max);
        }
        if (isClose(min, max) || max < min) {
            LOG.warn("Degenerate stretch range [{}, {}], widening to [{}, {}]", min, max, min, min + DEGENERATE_EPSILON);
            max = min + DEGENERATE_EPSILON;
        }
        return new StretchRange(min, max);
    }

    /**
     * Percentile stretch over the finite samples. Either explicit bound may be
     * null, in which case it is taken from lowPercentile / highPercentile.
     *
     * @throws EmptyRasterException when the grid holds no finite value
     */
    public static StretchRange fromGrid(RasterGrid grid, Double vmin, Double vmax,
                                        double lowPercentile, double highPercentile) throws EmptyRasterException
    {
        if (vmin != null && vmax != null) {
            if (grid.countFinite() == 0) {
                throw new EmptyRasterException("Raster has no finite values to render");
            }
            return of(vmin, vmax);
        }
        double[] finite = grid.finiteValues();
        if (finite.length == 0) {
            throw new EmptyRasterException("Raster has no finite values to render");
        }
        Arrays.sort(finite);
        double lo = vmin != null ? vmin : percentile(finite, lowPercentile);
        double hi = vmax != null ? vmax : percentile(finite, highPercentile);
        return of(lo, hi);
    }

    /** Linear-interpolated percentile of ascending values, p in 0..100. */
    public static double percentile(double[] sorted, double p)
    {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("No values");
        }
        double pos = Math.max(0, Math.min(100, p)) / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double f = pos - lo;
        return sorted[lo] + f * (sorted[hi] - sorted[lo]);
    }

    /** v mapped onto 0..1 and clipped. */
    public double normalize(double v)
    {
        double t = (v - min) / (max - min);
        return t < 0 ? 0 : (t > 1 ? 1 : t);
    }

    // absolute 1e-8 plus relative 1e-5
    static boolean isClose(double a, double b)
    {
        return Math.abs(a - b) <= 1e-8 + 1e-5 * Math.abs(b);
    }

    @Override
    public String toString()
    {
        return "[" + min + ", " + max + "]";
    }
}
