// RasterGrid.java
// Immutable 2-D grid of double samples in row-major order; NaN marks no-data.

package limited.theta.rastermap;

import java.util.Arrays;

public final class RasterGrid
{
    private final int width, height;
    private final double[] values;

    public RasterGrid(int width, int height, double[] values)
    {
        this(width, height, values, true);
    }

    private RasterGrid(int width, int height, double[] values, boolean copy)
    {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
        }
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = copy ? values.clone() : values;
    }

    /**
     * Sample count of a width x height grid.
     *
     * @throws InvalidTransformException when the grid would not fit in one array
     */
    public static int cellCount(int width, int height) throws InvalidTransformException
    {
        try {
            return Math.multiplyExact(width, height);
        }
        catch (ArithmeticException e) {
            throw new InvalidTransformException("Grid of " + width + "x" + height + " samples is too large");
        }
    }

    /** Target dimension of size scaled by factor, rejected beyond int range. */
    static int scaledSize(int size, double factor) throws InvalidTransformException
    {
        double scaled = Math.floor(size * factor);
        if (!(scaled <= Integer.MAX_VALUE)) {
            throw new InvalidTransformException("Scaling " + size + " by " + factor + " overflows the grid size");
        }
        return (int) scaled;
    }

    // takes ownership of values; callers must not touch the array afterwards
    static RasterGrid wrap(int width, int height, double[] values)
    {
        return new RasterGrid(width, height, values, false);
    }

    public static RasterGrid filled(int width, int height, double value)
    {
        double[] v = new double[width * height];
        Arrays.fill(v, value);
        return wrap(width, height, v);
    }

    /** Build from rows; every row must have the same length. */
    public static RasterGrid of(double[][] rows)
    {
        int h = rows.length;
        int w = h == 0 ? 0 : rows[0].length;
        double[] v = new double[w * h];
        for (int r = 0; r < h; r++) {
            if (rows[r].length != w) {
                throw new IllegalArgumentException("Ragged row " + r);
            }
            System.arraycopy(rows[r], 0, v, r * w, w);
        }
        return new RasterGrid(w, h, v, false);
    }

    public int getWidth()  { return width; }
    public int getHeight() { return height; }

    public double get(int row, int col)
    {
        return values[row * width + col];
    }

    public boolean isFinite(int row, int col)
    {
        return Double.isFinite(values[row * width + col]);
    }

    /** Copy of the samples in row-major order. */
    public double[] toArray()
    {
        return values.clone();
    }

    // read-only view for package stages; never write through it
    double[] samples()
    {
        return values;
    }

    public int countFinite()
    {
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) n++;
        }
        return n;
    }

    public double[] finiteValues()
    {
        double[] out = new double[countFinite()];
        int i = 0;
        for (double v : values) {
            if (Double.isFinite(v)) out[i++] = v;
        }
        return out;
    }

    /** Mean of the finite samples, NaN when there are none. */
    public double finiteMean()
    {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) { sum += v; n++; }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof RasterGrid)) return false;
        RasterGrid g = (RasterGrid) o;
        return width == g.width && height == g.height && Arrays.equals(values, g.values);
    }

    @Override
    public int hashCode()
    {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
        return "RasterGrid[" + width + "x" + height + ", finite=" + countFinite() + "]";
    }
}
