// GeoJsonPolygon.java

package limited.theta.rastermap.geojson;

import org.json.JSONObject;
import org.locationtech.jts.geom.Polygon;

public final class GeoJsonPolygon extends GeoJsonObject
{
    private final Polygon polygon;

    public GeoJsonPolygon(JSONObject source, Polygon polygon)
    {
        super(source);
        this.polygon = polygon;
    }

    public Polygon getPolygon() { return polygon; }

    @Override
    public String getType() { return "Polygon"; }

    @Override
    public <R> R accept(GeoJsonVisitor<R> visitor)
    {
        return visitor.visitPolygon(this);
    }
}
