// GeoJsonFeatureCollection.java

package limited.theta.rastermap.geojson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

public final class GeoJsonFeatureCollection extends GeoJsonObject
{
    private final List<GeoJsonObject> features;

    public GeoJsonFeatureCollection(JSONObject source, List<GeoJsonObject> features)
    {
        super(source);
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
    }

    public List<GeoJsonObject> getFeatures() { return features; }

    @Override
    public String getType() { return "FeatureCollection"; }

    @Override
    public <R> R accept(GeoJsonVisitor<R> visitor)
    {
        return visitor.visitFeatureCollection(this);
    }
}
