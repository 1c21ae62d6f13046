// StretchRangeTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StretchRangeTest
{
    @Test
    public void singleValueIsWidened() throws Exception
    {
        StretchRange r = StretchRange.fromGrid(RasterGrid.filled(3, 3, 0.5), null, null, 2, 98);
        assertEquals(0.5, r.min, 0);
        assertEquals(0.501, r.max, 1e-12);
    }

    @Test
    public void invertedExplicitBoundsAreWidened()
    {
        StretchRange r = StretchRange.of(0.8, 0.2);
        assertEquals(0.8, r.min, 0);
        assertEquals(0.8 + StretchRange.DEGENERATE_EPSILON, r.max, 1e-12);
    }

    @Test
    public void percentilesInterpolateLinearly()
    {
        double[] v = { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
        assertEquals(0.2, StretchRange.percentile(v, 2), 1e-12);
        assertEquals(9.8, StretchRange.percentile(v, 98), 1e-12);
        assertEquals(5.0, StretchRange.percentile(v, 50), 1e-12);
        assertEquals(10.0, StretchRange.percentile(v, 100), 1e-12);
    }

    @Test
    public void percentilesIgnoreNoData() throws Exception
    {
        double[][] rows = { { Double.NaN, 0, 10 }, { 5, Double.NaN, Double.NaN } };
        StretchRange r = StretchRange.fromGrid(RasterGrid.of(rows), null, null, 0, 100);
        assertEquals(0.0, r.min, 0);
        assertEquals(10.0, r.max, 0);
    }

    @Test
    public void explicitBoundOverridesOnlyItsEnd() throws Exception
    {
        RasterGrid g = RasterGrid.of(new double[][] { { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 } });
        StretchRange r = StretchRange.fromGrid(g, -1.0, null, 2, 98);
        assertEquals(-1.0, r.min, 0);
        assertEquals(9.8, r.max, 1e-12);
    }

    @Test
    public void minStaysBelowMaxForAnyInput() throws Exception
    {
        double[][] cases = { { 3, 3, 3 }, { -1e-9, 0, 1e-9 }, { 1e6, 1e6 + 1e-3, 1e6 } };
        for (double[] c : cases) {
            StretchRange r = StretchRange.fromGrid(RasterGrid.of(new double[][] { c }), null, null, 2, 98);
            assertTrue(r.min < r.max);
        }
    }

    @Test
    public void normalizeClips()
    {
        StretchRange r = StretchRange.of(0, 2);
        assertEquals(0.0, r.normalize(-5), 0);
        assertEquals(0.5, r.normalize(1), 0);
        assertEquals(1.0, r.normalize(3), 0);
    }

    @Test(expected = EmptyRasterException.class)
    public void allNoDataIsEmpty() throws Exception
    {
        StretchRange.fromGrid(RasterGrid.filled(2, 2, Double.NaN), null, null, 2, 98);
    }
}
