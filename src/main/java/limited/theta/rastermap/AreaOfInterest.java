// AreaOfInterest.java
// AOI documents as read from disk plus the polygons found inside them.

package limited.theta.rastermap;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Polygon;

import limited.theta.rastermap.geojson.GeoJsonObject;
import limited.theta.rastermap.geojson.GeoJsonReader;
import limited.theta.rastermap.geojson.PolygonCollector;

public final class AreaOfInterest
{
    private static final AreaOfInterest NONE = new AreaOfInterest(Collections.<GeoJsonObject>emptyList());

    private final List<GeoJsonObject> documents;
    private final PolygonCollector collector;

    private AreaOfInterest(List<GeoJsonObject> documents)
    {
        this.documents = Collections.unmodifiableList(new ArrayList<>(documents));
        this.collector = PolygonCollector.collect(this.documents);
        AoiBoundsResolver.warnSkipped(collector);
    }

    public static AreaOfInterest none()
    {
        return NONE;
    }

    public static AreaOfInterest of(List<GeoJsonObject> documents)
    {
        return documents == null || documents.isEmpty() ? NONE : new AreaOfInterest(documents);
    }

    public static AreaOfInterest load(List<File> files) throws InputNotFoundException, UnsupportedGeometryException
    {
        if (files == null || files.isEmpty()) {
            return NONE;
        }
        return of(new GeoJsonReader().readAll(files));
    }

    public List<GeoJsonObject> getDocuments() { return documents; }
    public List<Polygon> getPolygons() { return collector.getPolygons(); }

    public boolean hasDocuments() { return !documents.isEmpty(); }

    /** True when there is nothing to clip or mask with. */
    public boolean isEmpty() { return collector.getPolygons().isEmpty(); }

    public Bounds getClipBounds(double paddingFactor) throws UnsupportedGeometryException
    {
        if (documents.isEmpty()) {
            return null;
        }
        return AoiBoundsResolver.resolve(collector, paddingFactor);
    }
}
