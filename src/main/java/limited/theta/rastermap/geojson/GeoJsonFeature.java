// GeoJsonFeature.java

package limited.theta.rastermap.geojson;

import org.json.JSONObject;

public final class GeoJsonFeature extends GeoJsonObject
{
    private final GeoJsonObject geometry; // null for "geometry": null

    public GeoJsonFeature(JSONObject source, GeoJsonObject geometry)
    {
        super(source);
        this.geometry = geometry;
    }

    public GeoJsonObject getGeometry() { return geometry; }

    @Override
    public String getType() { return "Feature"; }

    @Override
    public <R> R accept(GeoJsonVisitor<R> visitor)
    {
        return visitor.visitFeature(this);
    }
}
