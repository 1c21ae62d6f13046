// GeoJsonMultiPolygon.java

package limited.theta.rastermap.geojson;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

public final class GeoJsonMultiPolygon extends GeoJsonObject
{
    private final MultiPolygon multiPolygon;

    public GeoJsonMultiPolygon(JSONObject source, MultiPolygon multiPolygon)
    {
        super(source);
        this.multiPolygon = multiPolygon;
    }

    public MultiPolygon getMultiPolygon() { return multiPolygon; }

    public List<Polygon> getPolygons()
    {
        List<Polygon> out = new ArrayList<>();
        for (int i = 0; i < multiPolygon.getNumGeometries(); i++) {
            out.add((Polygon) multiPolygon.getGeometryN(i));
        }
        return out;
    }

    @Override
    public String getType() { return "MultiPolygon"; }

    @Override
    public <R> R accept(GeoJsonVisitor<R> visitor)
    {
        return visitor.visitMultiPolygon(this);
    }
}
