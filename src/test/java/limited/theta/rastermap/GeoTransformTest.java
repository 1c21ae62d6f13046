// GeoTransformTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GeoTransformTest
{
    private static final double EPS = 1e-12;

    @Test
    public void northUpMapsCornersAndCenters() throws Exception
    {
        GeoTransform t = GeoTransform.northUp(-45.0, -22.0, 0.5, 0.25);
        assertTrue(t.isNorthUp());
        assertArrayEquals(new double[] { -45.0, -22.0 }, t.worldFromPixel(0, 0), EPS);
        assertArrayEquals(new double[] { -44.75, -22.125 }, t.pixelCenter(0, 0), EPS);
        assertArrayEquals(new double[] { 3.0, 2.0 }, t.pixelFromWorld(-43.5, -22.5), EPS);
    }

    @Test
    public void boundsOfGrid() throws Exception
    {
        Bounds b = GeoTransform.northUp(10, 20, 0.1, 0.1).boundsOf(10, 5);
        assertEquals(10.0, b.minX, EPS);
        assertEquals(11.0, b.maxX, EPS);
        assertEquals(19.5, b.minY, EPS);
        assertEquals(20.0, b.maxY, EPS);
    }

    @Test
    public void refinedKeepsOriginAndExtent() throws Exception
    {
        GeoTransform t = GeoTransform.northUp(0, 4, 1, 1);
        GeoTransform f = t.refined(4);
        assertEquals(0.25, f.getPixelSizeX(), EPS);
        assertEquals(0.25, f.getPixelSizeY(), EPS);
        assertEquals(t.boundsOf(4, 4), f.boundsOf(16, 16));
    }

    @Test
    public void shiftedMovesOriginByWholePixels() throws Exception
    {
        GeoTransform t = GeoTransform.northUp(0, 4, 1, 1).shifted(-2, -1);
        assertEquals(-2.0, t.getOriginX(), EPS);
        assertEquals(5.0, t.getOriginY(), EPS);
    }

    @Test(expected = InvalidTransformException.class)
    public void zeroPixelSizeIsRejected() throws Exception
    {
        GeoTransform.northUp(0, 0, 0, 1);
    }

    @Test(expected = InvalidTransformException.class)
    public void singularAffineIsRejected() throws Exception
    {
        GeoTransform.of(0, 1, 2, 0, 2, 4);
    }

    @Test
    public void rotatedIsNotNorthUp() throws Exception
    {
        assertFalse(GeoTransform.of(0, 1, 0.1, 0, 0.1, -1).isNorthUp());
    }
}
