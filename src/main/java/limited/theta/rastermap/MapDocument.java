// MapDocument.java
// In-memory web map: base tile layers, image overlays, AOI outlines, a legend
// and a layer control. MapDocumentWriter turns it into one HTML file.

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.json.JSONArray;
import org.json.JSONObject;

import limited.theta.rastermap.geojson.GeoJsonObject;

public final class MapDocument
{
    public static final int DEFAULT_ZOOM = 11;

    private final Bounds view;
    private final int zoom;
    private String title = "Raster map";
    private final List<TileLayer> baseLayers = new ArrayList<>();
    private final List<ImageOverlay> overlays = new ArrayList<>();
    private final List<JSONObject> outlines = new ArrayList<>();
    private Legend legend;
    private boolean layerControl = true;
    private boolean layerControlCollapsed = true;
    private Bounds fitBounds;

    public MapDocument(Bounds view, int zoom)
    {
        this.view = view;
        this.zoom = zoom;
    }

    /**
     * Document centered on view with the configured base tiles; unless tiles are
     * "none", Esri World Imagery is offered as a second base layer when
     * withSatellite is set.
     */
    public static MapDocument create(Bounds view, int zoom, RenderOptions options, boolean withSatellite)
    {
        MapDocument doc = new MapDocument(view, zoom);
        if (options.hasBaseTiles()) {
            doc.addBaseLayer(TileLayer.named(options.getBaseTiles(), options.getTileAttribution()));
            if (withSatellite) {
                doc.addBaseLayer(TileLayer.ESRI_WORLD_IMAGERY);
            }
        }
        return doc;
    }

    public MapDocument setTitle(String title) { this.title = title; return this; }
    public MapDocument addBaseLayer(TileLayer layer) { baseLayers.add(layer); return this; }
    public MapDocument addOverlay(ImageOverlay overlay) { overlays.add(overlay); return this; }
    public MapDocument setLegend(Legend legend) { this.legend = legend; return this; }
    public MapDocument fitTo(Bounds bounds) { this.fitBounds = bounds; return this; }

    public MapDocument setLayerControl(boolean enabled, boolean collapsed)
    {
        this.layerControl = enabled;
        this.layerControlCollapsed = collapsed;
        return this;
    }

    /** Outline every AOI document with a transparent fill. */
    public MapDocument addOutlines(AreaOfInterest aoi)
    {
        for (GeoJsonObject doc : aoi.getDocuments()) {
            outlines.add(doc.toJson());
        }
        return this;
    }

    public String getTitle() { return title; }
    public Bounds getView() { return view; }
    public int getZoom() { return zoom; }
    public List<TileLayer> getBaseLayers() { return Collections.unmodifiableList(baseLayers); }
    public List<ImageOverlay> getOverlays() { return Collections.unmodifiableList(overlays); }
    public List<JSONObject> getOutlines() { return Collections.unmodifiableList(outlines); }
    public Legend getLegend() { return legend; }
    public boolean hasLayerControl() { return layerControl; }
    public boolean isLayerControlCollapsed() { return layerControlCollapsed; }
    public Bounds getFitBounds() { return fitBounds; }

    /** Configuration consumed by the map page script. */
    public JSONObject toJson()
    {
        JSONObject o = new JSONObject();
        o.put("title", title);
        o.put("center", latLng(view.getCenterY(), view.getCenterX()));
        o.put("zoom", zoom);

        JSONArray bases = new JSONArray();
        for (TileLayer t : baseLayers) {
            bases.put(new JSONObject().put("name", t.name).put("url", t.url).put("attribution", t.attribution));
        }
        o.put("baseLayers", bases);

        JSONArray ovs = new JSONArray();
        for (ImageOverlay ov : overlays) {
            ovs.put(new JSONObject()
                    .put("name", ov.name)
                    .put("image", ov.imageUri)
                    .put("bounds", corners(ov.bounds))
                    .put("opacity", ov.opacity)
                    .put("show", ov.show)
                    .put("control", ov.control));
        }
        o.put("overlays", ovs);

        JSONArray outs = new JSONArray();
        for (JSONObject g : outlines) {
            outs.put(g);
        }
        o.put("outlines", outs);
        o.put("outlineStyle", new JSONObject().put("fillOpacity", 0).put("weight", 2).put("color", "#3388ff"));

        if (legend != null) {
            o.put("legend", new JSONObject()
                  .put("caption", legend.caption)
                  .put("colors", new JSONArray(legend.colors))
                  .put("min", legend.min)
                  .put("max", legend.max));
        }
        if (layerControl) {
            o.put("layerControl", new JSONObject().put("collapsed", layerControlCollapsed));
        }
        if (fitBounds != null) {
            o.put("fitBounds", corners(fitBounds));
        }
        return o;
    } // toJson

    private static JSONArray latLng(double lat, double lon)
    {
        return new JSONArray().put(lat).put(lon);
    }

    // Leaflet order: [[south, west], [north, east]]
    private static JSONArray corners(Bounds b)
    {
        return new JSONArray().put(latLng(b.minY, b.minX)).put(latLng(b.maxY, b.maxX));
    }

    public static final class TileLayer
    {
        public static final TileLayer ESRI_WORLD_IMAGERY = new TileLayer("Esri World Imagery",
            "https://server.arcgisonline.com/ArcGIS/rest/services/World_Imagery/MapServer/tile/{z}/{y}/{x}",
            "Esri World Imagery");

        public final String name, url, attribution;

        public TileLayer(String name, String url, String attribution)
        {
            this.name = name;
            this.url = url;
            this.attribution = attribution == null ? "" : attribution;
        }

        /**
         * Known provider by name (case-insensitive), or a custom URL template
         * containing {z}/{x}/{y}.
         */
        public static TileLayer named(String name, String attribution)
        {
            String key = name.trim().toLowerCase(Locale.ROOT);
            switch (key) {
                case "cartodb positron":
                case "cartodbpositron":
                    return new TileLayer("CartoDB positron", "https://{s}.basemaps.cartocdn.com/light_all/{z}/{x}/{y}{r}.png",
                                         attr(attribution, "&copy; OpenStreetMap contributors &copy; CARTO"));
                case "cartodb dark_matter":
                case "cartodbdark_matter":
                    return new TileLayer("CartoDB dark_matter", "https://{s}.basemaps.cartocdn.com/dark_all/{z}/{x}/{y}{r}.png",
                                         attr(attribution, "&copy; OpenStreetMap contributors &copy; CARTO"));
                case "openstreetmap":
                    return new TileLayer("OpenStreetMap", "https://tile.openstreetmap.org/{z}/{x}/{y}.png",
                                         attr(attribution, "&copy; OpenStreetMap contributors"));
                default:
                    if (name.contains("{z}")) {
                        return new TileLayer("Base map", name, attribution);
                    }
                    throw new IllegalArgumentException("Unknown tile source '" + name + "'");
            }
        }

        private static String attr(String given, String fallback)
        {
            return given != null ? given : fallback;
        }
    }

    public static final class ImageOverlay
    {
        public final String name;
        public final String imageUri;
        public final Bounds bounds;
        public final double opacity;
        public final boolean show;
        public final boolean control;

        public ImageOverlay(String name, String imageUri, Bounds bounds, double opacity, boolean show, boolean control)
        {
            this.name = name;
            this.imageUri = imageUri;
            this.bounds = bounds;
            this.opacity = opacity;
            this.show = show;
            this.control = control;
        }

        public static ImageOverlay png(String name, byte[] png, Bounds bounds, boolean show, boolean control)
        {
            return new ImageOverlay(name, ImageEncoding.toDataUri(png), bounds, 1.0, show, control);
        }
    }

    public static final class Legend
    {
        public final String caption;
        public final List<String> colors;
        public final double min, max;

        public Legend(String caption, List<String> colors, double min, double max)
        {
            this.caption = caption;
            this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
            this.min = min;
            this.max = max;
        }

        public static Legend forRamp(String caption, ColorRamp ramp, double min, double max)
        {
            return new Legend(caption, ramp.sampleHex(10), min, max);
        }
    }
}
