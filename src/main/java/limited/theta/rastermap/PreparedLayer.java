// PreparedLayer.java
// Immutable output of the enhancement/masking chain, handed to colorization
// and to the map document. Multi-band sources (true color) carry one grid per
// band, all sharing the same transform.

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Polygon;

public final class PreparedLayer
{
    private final String name;
    private final List<RasterGrid> bands;
    private final GeoTransform transform;
    private final Bounds clipBounds;
    private final List<Polygon> aoiPolygons;

    public PreparedLayer(String name, List<RasterGrid> bands, GeoTransform transform,
                         Bounds clipBounds, List<Polygon> aoiPolygons)
    {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("A layer needs at least one band");
        }
        RasterGrid first = bands.get(0);
        for (RasterGrid b : bands) {
            if (b.getWidth() != first.getWidth() || b.getHeight() != first.getHeight()) {
                throw new IllegalArgumentException("Bands of layer " + name + " differ in shape");
            }
        }
        this.name = name;
        this.bands = Collections.unmodifiableList(new ArrayList<>(bands));
        this.transform = transform;
        this.clipBounds = clipBounds;
        this.aoiPolygons = aoiPolygons == null
            ? Collections.<Polygon>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(aoiPolygons));
    }

    public static PreparedLayer single(String name, GeoRaster raster, Bounds clipBounds, List<Polygon> aoi)
    {
        return new PreparedLayer(name, Collections.singletonList(raster.getGrid()), raster.getTransform(), clipBounds, aoi);
    }

    public String getName() { return name; }
    public RasterGrid getGrid() { return bands.get(0); }
    public List<RasterGrid> getBands() { return bands; }
    public GeoTransform getTransform() { return transform; }

    /** May be null when the layer was not clipped. */
    public Bounds getClipBounds() { return clipBounds; }
    public List<Polygon> getAoiPolygons() { return aoiPolygons; }

    public GeoRaster getRaster()
    {
        return new GeoRaster(getGrid(), transform);
    }

    public Bounds getBounds()
    {
        return transform.boundsOf(getGrid().getWidth(), getGrid().getHeight());
    }

    /** Box the map should center on: clip bounds when clipped, else the layer extent. */
    public Bounds getViewBounds()
    {
        return clipBounds != null ? clipBounds : getBounds();
    }
}
