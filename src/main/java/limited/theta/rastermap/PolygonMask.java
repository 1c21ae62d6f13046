// PolygonMask.java
// Rasterizes AOI polygons onto a grid by testing each pixel center, then
// sets every pixel outside all polygons to NaN.

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

public final class PolygonMask
{
    private static final GeometryFactory FACTORY = new GeometryFactory();

    private PolygonMask() {}

    /** 1 where the pixel center lies in any polygon, 0 elsewhere; row-major. */
    public static byte[] rasterize(List<Polygon> polygons, GeoTransform transform, int width, int height)
    {
        byte[] mask = new byte[width * height];
        if (polygons.isEmpty()) {
            return mask;
        }

        List<PreparedGeometry> prepared = new ArrayList<>();
        Envelope env = new Envelope();
        for (Polygon p : polygons) {
            prepared.add(PreparedGeometryFactory.prepare(p));
            env.expandToInclude(p.getEnvelopeInternal());
        }

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double[] c = transform.pixelCenter(col, row);
                if (!env.contains(c[0], c[1])) {
                    continue;
                }
                Point pt = FACTORY.createPoint(new Coordinate(c[0], c[1]));
                for (PreparedGeometry g : prepared) {
                    if (g.intersects(pt)) {
                        mask[row * width + col] = 1;
                        break;
                    }
                }
            }
        }
        return mask;
    } // rasterize

    /** Null every pixel outside the polygons; no polygons means no change. */
    public static GeoRaster apply(GeoRaster raster, List<Polygon> polygons)
    {
        if (polygons == null || polygons.isEmpty()) {
            return raster;
        }
        RasterGrid grid = raster.getGrid();
        byte[] mask = rasterize(polygons, raster.getTransform(), grid.getWidth(), grid.getHeight());
        double[] out = grid.toArray();
        for (int i = 0; i < out.length; i++) {
            if (mask[i] == 0) out[i] = Double.NaN;
        }
        return raster.withGrid(RasterGrid.wrap(grid.getWidth(), grid.getHeight(), out));
    }
}
