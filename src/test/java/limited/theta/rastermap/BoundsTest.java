// BoundsTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class BoundsTest
{
    @Test
    public void paddingGrowsEachSideByHalfTheFactor()
    {
        Bounds b = new Bounds(0, 0, 10, 4).padded(0.3);
        assertEquals(-1.5, b.minX, 1e-12);
        assertEquals(11.5, b.maxX, 1e-12);
        assertEquals(-0.6, b.minY, 1e-12);
        assertEquals(4.6, b.maxY, 1e-12);
    }

    @Test
    public void unionAndIntersection()
    {
        Bounds a = new Bounds(0, 0, 2, 2);
        Bounds b = new Bounds(1, 1, 3, 3);
        assertEquals(new Bounds(0, 0, 3, 3), a.union(b));
        assertEquals(new Bounds(1, 1, 2, 2), a.intersection(b));
        assertNull(a.intersection(new Bounds(5, 5, 6, 6)));
    }

    @Test
    public void envelopeRoundTrip()
    {
        Bounds b = new Bounds(-45.5, -23.1, -44.9, -22.7);
        assertEquals(b, Bounds.fromEnvelope(b.toEnvelope()));
        assertTrue(new Bounds(1, 1, 1, 1).isEmpty());
    }
}
