// ResamplerTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ResamplerTest
{
    private final RasterGrid grid = RasterGrid.of(new double[][] {
        { 1, 2 },
        { 3, Double.NaN }
    });

    @Test
    public void pixelCentersReturnTheirValue()
    {
        assertEquals(1.0, Resampler.bilinear(grid, 0, 0), 1e-12);
        assertEquals(3.0, Resampler.bilinear(grid, 0, 1), 1e-12);
    }

    @Test
    public void interpolatesBetweenFiniteNeighbours()
    {
        assertEquals(1.5, Resampler.bilinear(grid, 0.5, 0), 1e-12);
        assertEquals(2.0, Resampler.bilinear(grid, 0, 0.5), 1e-12);
    }

    @Test
    public void skipsNoDataNeighboursWhenNearestIsFinite()
    {
        // nearest pixel is (0,0); the missing corner drops out of the average
        double v = Resampler.bilinear(grid, 0.25, 0.25);
        assertTrue(Double.isFinite(v));
        assertTrue(v > 1.0 && v < 3.0);
    }

    @Test
    public void nearestNoDataGivesNoData()
    {
        assertTrue(Double.isNaN(Resampler.bilinear(grid, 0.9, 0.9)));
    }

    @Test
    public void outsideTheGridIsNoData()
    {
        assertTrue(Double.isNaN(Resampler.bilinear(grid, -0.6, 0)));
        assertTrue(Double.isNaN(Resampler.bilinear(grid, 0, 1.6)));
    }
}
