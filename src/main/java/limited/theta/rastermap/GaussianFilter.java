// GaussianFilter.java
// Separable gaussian blur with the kernel truncated at 4 sigma and edges
// extended by repeating the nearest sample. Input must be free of NaN.

package limited.theta.rastermap;

public final class GaussianFilter
{
    private static final double TRUNCATE = 4.0;

    private final double[] kernel;
    private final int radius;

    public GaussianFilter(double sigma)
    {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive, got " + sigma);
        }
        this.radius = (int) (TRUNCATE * sigma + 0.5);
        this.kernel = new double[2 * radius + 1];
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double k = Math.exp(-0.5 * (i * i) / (sigma * sigma));
            kernel[i + radius] = k;
            sum += k;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
    }

    public int getRadius() { return radius; }

    /** Blur a dense row-major buffer; returns a new buffer. */
    public double[] apply(double[] values, int width, int height)
    {
        double[] tmp = new double[values.length];
        double[] out = new double[values.length];

        // along rows
        for (int r = 0; r < height; r++) {
            int base = r * width;
            for (int c = 0; c < width; c++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    int cc = c + k;
                    if (cc < 0) cc = 0; else if (cc >= width) cc = width - 1;
                    acc += kernel[k + radius] * values[base + cc];
                }
                tmp[base + c] = acc;
            }
        }

        // along columns
        for (int c = 0; c < width; c++) {
            for (int r = 0; r < height; r++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    int rr = r + k;
                    if (rr < 0) rr = 0; else if (rr >= height) rr = height - 1;
                    acc += kernel[k + radius] * tmp[rr * width + c];
                }
                out[r * width + c] = acc;
            }
        }
        return out;
    }
}
