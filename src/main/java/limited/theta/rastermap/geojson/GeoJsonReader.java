// GeoJsonReader.java
// Parses GeoJSON text with org.json into the GeoJsonObject variants, building
// JTS polygons for Polygon and MultiPolygon members.

package limited.theta.rastermap.geojson;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import limited.theta.rastermap.InputNotFoundException;
import limited.theta.rastermap.UnsupportedGeometryException;

public class GeoJsonReader
{
    private final GeometryFactory factory;

    public GeoJsonReader()
    {
        this(new GeometryFactory());
    }

    public GeoJsonReader(GeometryFactory factory)
    {
        this.factory = factory;
    }

    public GeoJsonObject read(File file) throws InputNotFoundException, UnsupportedGeometryException
    {
        String text;
        try {
            text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw InputNotFoundException.forFile(file, e);
        }
        try {
            return parse(text);
        }
        catch (UnsupportedGeometryException e) {
            throw new UnsupportedGeometryException(file.getName() + ": " + e.getMessage(), e);
        }
    }

    public List<GeoJsonObject> readAll(List<File> files) throws InputNotFoundException, UnsupportedGeometryException
    {
        List<GeoJsonObject> out = new ArrayList<>();
        for (File f : files) {
            out.add(read(f));
        }
        return out;
    }

    public GeoJsonObject parse(String text) throws UnsupportedGeometryException
    {
        try {
            return parse(new JSONObject(text));
        }
        catch (JSONException e) {
            throw new UnsupportedGeometryException("Malformed GeoJSON: " + e.getMessage(), e);
        }
    }

    public GeoJsonObject parse(JSONObject json) throws UnsupportedGeometryException
    {
        String type = json.optString("type", null);
        if (type == null) {
            throw new UnsupportedGeometryException("GeoJSON object without a type member");
        }

        try {
            switch (type) {
                case "FeatureCollection": {
                    JSONArray arr = json.optJSONArray("features");
                    List<GeoJsonObject> features = new ArrayList<>();
                    if (arr != null) {
                        for (int i = 0; i < arr.length(); i++) {
                            features.add(parse(arr.getJSONObject(i)));
                        }
                    }
                    return new GeoJsonFeatureCollection(json, features);
                }
                case "Feature": {
                    JSONObject geom = json.optJSONObject("geometry");
                    return new GeoJsonFeature(json, geom == null ? null : parse(geom));
                }
                case "Polygon":
                    return new GeoJsonPolygon(json, toPolygon(json.getJSONArray("coordinates")));
                case "MultiPolygon": {
                    JSONArray coords = json.getJSONArray("coordinates");
                    Polygon[] polys = new Polygon[coords.length()];
                    for (int i = 0; i < coords.length(); i++) {
                        polys[i] = toPolygon(coords.getJSONArray(i));
                    }
                    return new GeoJsonMultiPolygon(json, factory.createMultiPolygon(polys));
                }
                default:
                    return new GeoJsonUnsupported(json, type);
            }
        }
        catch (JSONException e) {
            throw new UnsupportedGeometryException("Malformed " + type + ": " + e.getMessage(), e);
        }
    } // parse

    // rings: [exterior, hole, hole, ...], each a list of [x, y(, z)] positions
    private Polygon toPolygon(JSONArray rings) throws UnsupportedGeometryException
    {
        if (rings.length() == 0) {
            return factory.createPolygon();
        }
        LinearRing shell = toRing(rings.getJSONArray(0));
        LinearRing[] holes = new LinearRing[rings.length() - 1];
        for (int i = 1; i < rings.length(); i++) {
            holes[i - 1] = toRing(rings.getJSONArray(i));
        }
        return factory.createPolygon(shell, holes);
    }

    private LinearRing toRing(JSONArray positions) throws UnsupportedGeometryException
    {
        List<Coordinate> coords = new ArrayList<>();
        for (int i = 0; i < positions.length(); i++) {
            JSONArray p = positions.getJSONArray(i);
            coords.add(new Coordinate(p.getDouble(0), p.getDouble(1)));
        }
        if (!coords.isEmpty() && !coords.get(0).equals2D(coords.get(coords.size() - 1))) {
            coords.add(new Coordinate(coords.get(0)));
        }
        if (coords.size() < 4) {
            throw new UnsupportedGeometryException("Polygon ring needs at least 3 distinct positions, got " + positions.length());
        }
        return factory.createLinearRing(coords.toArray(new Coordinate[0]));
    }
}
