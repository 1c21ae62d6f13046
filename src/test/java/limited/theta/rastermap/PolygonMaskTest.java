// PolygonMaskTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

public class PolygonMaskTest
{
    private static final GeometryFactory GF = new GeometryFactory();

    static Polygon box(double x0, double y0, double x1, double y1)
    {
        return GF.createPolygon(new Coordinate[] {
            new Coordinate(x0, y0), new Coordinate(x1, y0), new Coordinate(x1, y1),
            new Coordinate(x0, y1), new Coordinate(x0, y0)
        });
    }

    // 4x4 unit pixels covering (0,0)-(4,4); AOI is the south-east quadrant
    static GeoRaster fourByFour() throws InvalidTransformException
    {
        return new GeoRaster(RasterGrid.of(GeoTiffFixtures.ramp(4, 4)), GeoTransform.northUp(0, 4, 1, 1));
    }

    static List<Polygon> southEast()
    {
        return Collections.singletonList(box(2, 0, 4, 2));
    }

    @Test
    public void rasterizeMarksPixelCentersInside() throws Exception
    {
        byte[] mask = PolygonMask.rasterize(southEast(), GeoTransform.northUp(0, 4, 1, 1), 4, 4);
        byte[] expected = {
            0, 0, 0, 0,
            0, 0, 0, 0,
            0, 0, 1, 1,
            0, 0, 1, 1
        };
        for (int i = 0; i < expected.length; i++) {
            assertEquals("pixel " + i, expected[i], mask[i]);
        }
    }

    @Test
    public void applyBlanksOutside() throws Exception
    {
        GeoRaster masked = PolygonMask.apply(fourByFour(), southEast());
        RasterGrid g = masked.getGrid();
        assertEquals(4, g.countFinite());
        assertEquals(11.0, g.get(2, 2), 0);
        assertEquals(16.0, g.get(3, 3), 0);
    }

    @Test
    public void maskingTwiceEqualsMaskingOnce() throws Exception
    {
        GeoRaster once = PolygonMask.apply(fourByFour(), southEast());
        GeoRaster twice = PolygonMask.apply(once, southEast());
        assertEquals(once.getGrid(), twice.getGrid());
    }

    @Test
    public void noPolygonsMeansNoChange() throws Exception
    {
        GeoRaster r = fourByFour();
        assertSame(r, PolygonMask.apply(r, Collections.<Polygon>emptyList()));
    }

    @Test
    public void multiplePolygonsAreUnioned() throws Exception
    {
        List<Polygon> two = Arrays.asList(box(0, 3, 1, 4), box(3, 0, 4, 1));
        RasterGrid g = PolygonMask.apply(fourByFour(), two).getGrid();
        assertEquals(2, g.countFinite());
        assertEquals(1.0, g.get(0, 0), 0);
        assertEquals(16.0, g.get(3, 3), 0);
    }
}
