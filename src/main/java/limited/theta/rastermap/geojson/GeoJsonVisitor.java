// GeoJsonVisitor.java

package limited.theta.rastermap.geojson;

public interface GeoJsonVisitor<R>
{
    R visitFeatureCollection(GeoJsonFeatureCollection collection);

    R visitFeature(GeoJsonFeature feature);

    R visitPolygon(GeoJsonPolygon polygon);

    R visitMultiPolygon(GeoJsonMultiPolygon multiPolygon);

    R visitUnsupported(GeoJsonUnsupported unsupported);
}
