// GeoJsonObject.java
// Tagged GeoJSON variant. Only the members the map pipeline understands get
// their own subtype; anything else is kept as GeoJsonUnsupported.

package limited.theta.rastermap.geojson;

import org.json.JSONObject;

public abstract class GeoJsonObject
{
    private final JSONObject source;

    protected GeoJsonObject(JSONObject source)
    {
        this.source = source;
    }

    /** GeoJSON "type" member, e.g. "Polygon". */
    public abstract String getType();

    public abstract <R> R accept(GeoJsonVisitor<R> visitor);

    /** The document this node was parsed from, used to draw AOI outlines. */
    public JSONObject toJson()
    {
        return source;
    }
}
