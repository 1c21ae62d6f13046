// GaussianFilterTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GaussianFilterTest
{
    @Test
    public void radiusCoversFourSigma()
    {
        assertEquals(4, new GaussianFilter(1.0).getRadius());
        assertEquals(5, new GaussianFilter(1.2).getRadius());
    }

    @Test
    public void impulseSpreadsSymmetricallyAndKeepsItsMass()
    {
        int n = 15;
        double[] v = new double[n * n];
        v[7 * n + 7] = 1.0;
        double[] out = new GaussianFilter(1.0).apply(v, n, n);

        double sum = 0;
        for (double x : out) sum += x;
        assertEquals(1.0, sum, 1e-9);
        assertEquals(out[7 * n + 6], out[7 * n + 8], 1e-15);
        assertEquals(out[6 * n + 7], out[8 * n + 7], 1e-15);
        assertTrue(out[7 * n + 7] < 1.0 && out[7 * n + 7] > out[7 * n + 8]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void sigmaMustBePositive()
    {
        new GaussianFilter(0);
    }
}
