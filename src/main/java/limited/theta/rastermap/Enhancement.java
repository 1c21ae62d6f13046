// Enhancement.java
// Unsharp masking, gaussian smoothing and upsampling of index grids. All three
// leave no-data pixels as no-data: the blur steps fill NaN with the finite mean
// before filtering and put NaN back afterwards.

package limited.theta.rastermap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Enhancement
{
    private static final Logger LOG = LoggerFactory.getLogger(Enhancement.class);

    private Enhancement() {}

    /**
     * filled + amount * (filled - blurred(filled)), sigma = radius. A grid
     * with no finite values comes back unchanged.
     */
    public static RasterGrid unsharpMask(RasterGrid grid, double radius, double amount)
    {
        double mean = grid.finiteMean();
        if (Double.isNaN(mean)) {
            return grid;
        }
        double[] filled = fillNoData(grid, mean);
        double[] blurred = radius > 0 ? new GaussianFilter(radius).apply(filled, grid.getWidth(), grid.getHeight()) : filled;

        double[] src = grid.samples();
        double[] out = new double[filled.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Double.isFinite(src[i]) ? filled[i] + amount * (filled[i] - blurred[i]) : Double.NaN;
        }
        return RasterGrid.wrap(grid.getWidth(), grid.getHeight(), out);
    }

    /** Gaussian blur at sigma = radius; identity when radius is not positive. */
    public static RasterGrid smooth(RasterGrid grid, double radius)
    {
        if (!(radius > 0)) {
            return grid;
        }
        double mean = grid.finiteMean();
        if (Double.isNaN(mean)) {
            return grid;
        }
        double[] blurred = new GaussianFilter(radius).apply(fillNoData(grid, mean), grid.getWidth(), grid.getHeight());

        double[] src = grid.samples();
        for (int i = 0; i < blurred.length; i++) {
            if (!Double.isFinite(src[i])) blurred[i] = Double.NaN;
        }
        return RasterGrid.wrap(grid.getWidth(), grid.getHeight(), blurred);
    }

    /**
     * Bilinear resample onto a grid factor times finer, keeping the origin and
     * the geographic extent covered by whole pixels. Returns the input when
     * factor is 1 or less.
     */
    public static GeoRaster upsample(GeoRaster raster, double factor) throws InvalidTransformException
    {
        if (!(factor > 1.0)) {
            return raster;
        }
        int w = RasterGrid.scaledSize(raster.getWidth(), factor);
        int h = RasterGrid.scaledSize(raster.getHeight(), factor);
        RasterGrid.cellCount(w, h);
        GeoTransform dst = raster.getTransform().refined(factor);
        LOG.debug("Upsampling {}x{} by {} to {}x{}", raster.getWidth(), raster.getHeight(), factor, w, h);
        return new GeoRaster(Resampler.resample(raster, dst, w, h), dst);
    }

    private static double[] fillNoData(RasterGrid grid, double fill)
    {
        double[] out = grid.toArray();
        for (int i = 0; i < out.length; i++) {
            if (!Double.isFinite(out[i])) out[i] = fill;
        }
        return out;
    }
}
