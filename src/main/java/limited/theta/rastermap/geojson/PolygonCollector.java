// PolygonCollector.java
// Unwraps FeatureCollection and Feature envelopes recursively and gathers every
// polygon underneath. Unsupported members are remembered so callers can warn.

package limited.theta.rastermap.geojson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Polygon;

public class PolygonCollector implements GeoJsonVisitor<Void>
{
    private final List<Polygon> polygons = new ArrayList<>();
    private final List<String> skippedTypes = new ArrayList<>();

    public static PolygonCollector collect(List<GeoJsonObject> documents)
    {
        PolygonCollector c = new PolygonCollector();
        for (GeoJsonObject doc : documents) {
            doc.accept(c);
        }
        return c;
    }

    public List<Polygon> getPolygons()
    {
        return Collections.unmodifiableList(polygons);
    }

    public List<String> getSkippedTypes()
    {
        return Collections.unmodifiableList(skippedTypes);
    }

    @Override
    public Void visitFeatureCollection(GeoJsonFeatureCollection collection)
    {
        for (GeoJsonObject f : collection.getFeatures()) {
            f.accept(this);
        }
        return null;
    }

    @Override
    public Void visitFeature(GeoJsonFeature feature)
    {
        if (feature.getGeometry() != null) {
            feature.getGeometry().accept(this);
        }
        return null;
    }

    @Override
    public Void visitPolygon(GeoJsonPolygon polygon)
    {
        if (!polygon.getPolygon().isEmpty()) {
            polygons.add(polygon.getPolygon());
        }
        return null;
    }

    @Override
    public Void visitMultiPolygon(GeoJsonMultiPolygon multiPolygon)
    {
        for (Polygon p : multiPolygon.getPolygons()) {
            if (!p.isEmpty()) polygons.add(p);
        }
        return null;
    }

    @Override
    public Void visitUnsupported(GeoJsonUnsupported unsupported)
    {
        skippedTypes.add(unsupported.getType());
        return null;
    }
}
