// GeoJsonUnsupported.java
// Point, LineString, GeometryCollection and anything else the map cannot clip with.

package limited.theta.rastermap.geojson;

import org.json.JSONObject;

public final class GeoJsonUnsupported extends GeoJsonObject
{
    private final String type;

    public GeoJsonUnsupported(JSONObject source, String type)
    {
        super(source);
        this.type = type;
    }

    @Override
    public String getType() { return type; }

    @Override
    public <R> R accept(GeoJsonVisitor<R> visitor)
    {
        return visitor.visitUnsupported(this);
    }
}
