// AoiBoundsResolver.java
// Padded clip box from the union of every polygon in the supplied AOI documents.

package limited.theta.rastermap;

import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import limited.theta.rastermap.geojson.GeoJsonObject;
import limited.theta.rastermap.geojson.PolygonCollector;

public final class AoiBoundsResolver
{
    private static final Logger LOG = LoggerFactory.getLogger(AoiBoundsResolver.class);

    public static final double DEFAULT_PADDING_FACTOR = 0.3;

    private AoiBoundsResolver() {}

    /**
     * Union bounding box of all polygon vertices, grown on each axis by
     * paddingFactor * extent / 2. Returns null when no documents are given.
     *
     * @throws UnsupportedGeometryException when documents were supplied but none holds a polygon
     */
    public static Bounds resolve(List<GeoJsonObject> documents, double paddingFactor) throws UnsupportedGeometryException
    {
        return AreaOfInterest.of(documents).getClipBounds(paddingFactor);
    }

    static Bounds resolve(PolygonCollector collector, double paddingFactor) throws UnsupportedGeometryException
    {
        Bounds union = unionBounds(collector.getPolygons());
        if (union == null) {
            if (!collector.getSkippedTypes().isEmpty()) {
                throw new UnsupportedGeometryException("No Polygon or MultiPolygon among AOI geometries "
                                                       + collector.getSkippedTypes());
            }
            return null;
        }
        Bounds padded = union.padded(paddingFactor);
        LOG.debug("AOI bounds {} padded by {} -> {}", union, paddingFactor, padded);
        return padded;
    }

    /** Unpadded union of the polygons' envelopes, null for an empty list. */
    public static Bounds unionBounds(List<Polygon> polygons)
    {
        Envelope env = new Envelope();
        for (Polygon p : polygons) {
            env.expandToInclude(p.getEnvelopeInternal());
        }
        return env.isNull() ? null : Bounds.fromEnvelope(env);
    }

    /** Called once per AreaOfInterest, when its documents are collected. */
    static void warnSkipped(PolygonCollector collector)
    {
        for (String type : collector.getSkippedTypes()) {
            LOG.warn("Skipping unsupported AOI geometry type {}", type);
        }
    }
}
