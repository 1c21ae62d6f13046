// Resampler.java
// No-data aware bilinear sampling. A destination pixel is no-data when the
// source pixel nearest to it is no-data; otherwise it is the weighted mean of
// the finite neighbours among the four that bracket it.

package limited.theta.rastermap;

public final class Resampler
{
    private Resampler() {}

    /**
     * Sample grid at fractional pixel-center coordinates (x = col, y = row, so
     * (0,0) is the center of the first pixel). Points beyond the outer edge of
     * the grid are NaN.
     */
    public static double bilinear(RasterGrid grid, double x, double y)
    {
        int w = grid.getWidth(), h = grid.getHeight();
        if (Double.isNaN(x) || Double.isNaN(y) || x < -0.5 || y < -0.5 || x > w - 0.5 || y > h - 0.5) {
            return Double.NaN;
        }

        int nearCol = clamp((int) Math.floor(x + 0.5), w);
        int nearRow = clamp((int) Math.floor(y + 0.5), h);
        if (!grid.isFinite(nearRow, nearCol)) {
            return Double.NaN;
        }

        int x0 = (int) Math.floor(x), y0 = (int) Math.floor(y);
        double fx = x - x0, fy = y - y0;
        int c0 = clamp(x0, w), c1 = clamp(x0 + 1, w);
        int r0 = clamp(y0, h), r1 = clamp(y0 + 1, h);

        double sum = 0, wsum = 0;
        double w00 = (1-fx)*(1-fy), w10 = fx*(1-fy), w01 = (1-fx)*fy, w11 = fx*fy;
        double v;
        v = grid.get(r0, c0); if (Double.isFinite(v) && w00 > 0) { sum += w00*v; wsum += w00; }
        v = grid.get(r0, c1); if (Double.isFinite(v) && w10 > 0) { sum += w10*v; wsum += w10; }
        v = grid.get(r1, c0); if (Double.isFinite(v) && w01 > 0) { sum += w01*v; wsum += w01; }
        v = grid.get(r1, c1); if (Double.isFinite(v) && w11 > 0) { sum += w11*v; wsum += w11; }

        // the nearest pixel always carries weight, so wsum > 0 here
        return wsum > 0 ? sum / wsum : grid.get(nearRow, nearCol);
    }

    /**
     * Resample src into a dstWidth x dstHeight grid placed by dst. Both
     * transforms must be in the same CRS.
     */
    public static RasterGrid resample(GeoRaster src, GeoTransform dst, int dstWidth, int dstHeight)
    {
        RasterGrid grid = src.getGrid();
        GeoTransform st = src.getTransform();
        double[] out = new double[dstWidth * dstHeight];
        for (int row = 0; row < dstHeight; row++) {
            for (int col = 0; col < dstWidth; col++) {
                double[] world = dst.pixelCenter(col, row);
                double[] px = st.pixelFromWorld(world[0], world[1]);
                out[row * dstWidth + col] = bilinear(grid, px[0] - 0.5, px[1] - 0.5);
            }
        }
        return RasterGrid.wrap(dstWidth, dstHeight, out);
    }

    private static int clamp(int i, int n)
    {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }
}
