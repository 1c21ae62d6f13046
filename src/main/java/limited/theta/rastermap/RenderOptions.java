// RenderOptions.java
// Immutable render configuration. Build with RenderOptions.builder() or read
// the snake_case JSON form used by the workflow layer with fromJson().

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.json.JSONException;
import org.json.JSONObject;

public final class RenderOptions
{
    public static final String DEFAULT_COLORMAP = "RdYlGn";
    public static final double DEFAULT_OPACITY = 0.75;
    public static final String DEFAULT_BASE_TILES = "CartoDB positron";
    public static final String NO_TILES = "none";
    public static final double DEFAULT_LOW_PERCENTILE = 2.0;
    public static final double DEFAULT_HIGH_PERCENTILE = 98.0;
    public static final double DEFAULT_SHARPEN_AMOUNT = 1.3;
    public static final double TRUE_COLOR_SHARPEN_AMOUNT = 1.2;

    private final String colormap;
    private final Double vmin, vmax;
    private final double opacity;
    private final double paddingFactor;
    private final boolean clip;
    private final double upsampleFactor;
    private final boolean sharpen;
    private final double sharpenRadius;
    private final double sharpenAmount;
    private final double smoothRadius;
    private final String baseTiles;
    private final String tileAttribution;
    private final double lowPercentile, highPercentile;

    private RenderOptions(Builder b)
    {
        this.colormap = b.colormap;
        this.vmin = b.vmin;
        this.vmax = b.vmax;
        this.opacity = b.opacity;
        this.paddingFactor = b.paddingFactor;
        this.clip = b.clip;
        this.upsampleFactor = b.upsampleFactor;
        this.sharpen = b.sharpen;
        this.sharpenRadius = b.sharpenRadius;
        this.sharpenAmount = b.sharpenAmount;
        this.smoothRadius = b.smoothRadius;
        this.baseTiles = b.baseTiles;
        this.tileAttribution = b.tileAttribution;
        this.lowPercentile = b.lowPercentile;
        this.highPercentile = b.highPercentile;
    }

    public static Builder builder() { return new Builder(); }

    public static RenderOptions defaults() { return builder().build(); }

    /** Settings of the cached compare-all map. */
    public static RenderOptions compareDefaults()
    {
        return builder()
            .clip(true)
            .upsampleFactor(12)
            .smoothRadius(1.0)
            .sharpen(true)
            .sharpenRadius(1.2)
            .sharpenAmount(1.5)
            .build();
    }

    /** True-color composites sharpen more gently than index layers. */
    public static RenderOptions trueColorDefaults()
    {
        return builder().sharpenAmount(TRUE_COLOR_SHARPEN_AMOUNT).build();
    }

    public static RenderOptions fromJson(JSONObject json)
    {
        return builder().merge(json).build();
    }

    public static RenderOptions fromFile(File file) throws InputNotFoundException
    {
        return fromFile(file, defaults());
    }

    /** Reads file over base: keys the file leaves out keep base's values. */
    public static RenderOptions fromFile(File file, RenderOptions base) throws InputNotFoundException
    {
        try {
            return base.toBuilder().merge(new JSONObject(Files.readString(file.toPath(), StandardCharsets.UTF_8))).build();
        }
        catch (IOException e) {
            throw InputNotFoundException.forFile(file, e);
        }
        catch (JSONException e) {
            throw new IllegalArgumentException("Malformed options file " + file + ": " + e.getMessage(), e);
        }
    }

    public String getColormap() { return colormap; }
    /** Explicit lower stretch bound, or null for the low percentile. */
    public Double getVmin() { return vmin; }
    /** Explicit upper stretch bound, or null for the high percentile. */
    public Double getVmax() { return vmax; }
    public double getOpacity() { return opacity; }
    public double getPaddingFactor() { return paddingFactor; }
    public boolean isClip() { return clip; }
    public double getUpsampleFactor() { return upsampleFactor; }
    public boolean isSharpen() { return sharpen; }
    public double getSharpenRadius() { return sharpenRadius; }
    public double getSharpenAmount() { return sharpenAmount; }
    public double getSmoothRadius() { return smoothRadius; }
    public String getBaseTiles() { return baseTiles; }
    public String getTileAttribution() { return tileAttribution; }
    public double getLowPercentile() { return lowPercentile; }
    public double getHighPercentile() { return highPercentile; }

    public boolean hasBaseTiles()
    {
        return baseTiles != null && !NO_TILES.equalsIgnoreCase(baseTiles.trim());
    }

    public Builder toBuilder()
    {
        Builder b = new Builder();
        b.colormap = colormap;
        b.vmin = vmin;
        b.vmax = vmax;
        b.opacity = opacity;
        b.paddingFactor = paddingFactor;
        b.clip = clip;
        b.upsampleFactor = upsampleFactor;
        b.sharpen = sharpen;
        b.sharpenRadius = sharpenRadius;
        b.sharpenAmount = sharpenAmount;
        b.smoothRadius = smoothRadius;
        b.baseTiles = baseTiles;
        b.tileAttribution = tileAttribution;
        b.lowPercentile = lowPercentile;
        b.highPercentile = highPercentile;
        return b;
    }

    public JSONObject toJson()
    {
        JSONObject o = new JSONObject();
        o.put("colormap", colormap);
        o.put("vmin", vmin == null ? JSONObject.NULL : vmin);
        o.put("vmax", vmax == null ? JSONObject.NULL : vmax);
        o.put("opacity", opacity);
        o.put("padding_factor", paddingFactor);
        o.put("clip", clip);
        o.put("upsample_factor", upsampleFactor);
        o.put("sharpen", sharpen);
        o.put("sharpen_radius", sharpenRadius);
        o.put("sharpen_amount", sharpenAmount);
        o.put("smooth_radius", smoothRadius);
        o.put("base_tiles", baseTiles);
        if (tileAttribution != null) o.put("tile_attr", tileAttribution);
        o.put("stretch_lower", lowPercentile);
        o.put("stretch_upper", highPercentile);
        return o;
    }

    @Override
    public String toString()
    {
        return "RenderOptions" + toJson();
    }

    public static final class Builder
    {
        private String colormap = DEFAULT_COLORMAP;
        private Double vmin, vmax;
        private double opacity = DEFAULT_OPACITY;
        private double paddingFactor = AoiBoundsResolver.DEFAULT_PADDING_FACTOR;
        private boolean clip = false;
        private double upsampleFactor = 1.0;
        private boolean sharpen = false;
        private double sharpenRadius = 1.0;
        private double sharpenAmount = DEFAULT_SHARPEN_AMOUNT;
        private double smoothRadius = 0.0;
        private String baseTiles = DEFAULT_BASE_TILES;
        private String tileAttribution;
        private double lowPercentile = DEFAULT_LOW_PERCENTILE;
        private double highPercentile = DEFAULT_HIGH_PERCENTILE;

        private Builder() {}

        public Builder colormap(String v) { this.colormap = v; return this; }
        public Builder vmin(Double v) { this.vmin = v; return this; }
        public Builder vmax(Double v) { this.vmax = v; return this; }
        public Builder opacity(double v) { this.opacity = v; return this; }
        public Builder paddingFactor(double v) { this.paddingFactor = v; return this; }
        public Builder clip(boolean v) { this.clip = v; return this; }
        public Builder upsampleFactor(double v) { this.upsampleFactor = v; return this; }
        public Builder sharpen(boolean v) { this.sharpen = v; return this; }
        public Builder sharpenRadius(double v) { this.sharpenRadius = v; return this; }
        public Builder sharpenAmount(double v) { this.sharpenAmount = v; return this; }
        public Builder smoothRadius(double v) { this.smoothRadius = v; return this; }
        public Builder baseTiles(String v) { this.baseTiles = v; return this; }
        public Builder tileAttribution(String v) { this.tileAttribution = v; return this; }
        public Builder lowPercentile(double v) { this.lowPercentile = v; return this; }
        public Builder highPercentile(double v) { this.highPercentile = v; return this; }

        /** Overlay any keys present in json; absent keys keep their current value. */
        public Builder merge(JSONObject json)
        {
            try {
                if (json.has("colormap")) colormap = json.getString("colormap");
                if (json.has("vmin")) vmin = json.isNull("vmin") ? null : json.getDouble("vmin");
                if (json.has("vmax")) vmax = json.isNull("vmax") ? null : json.getDouble("vmax");
                if (json.has("opacity")) opacity = json.getDouble("opacity");
                if (json.has("padding_factor")) paddingFactor = json.getDouble("padding_factor");
                if (json.has("clip")) clip = json.getBoolean("clip");
                if (json.has("upsample_factor")) upsampleFactor = json.getDouble("upsample_factor");
                if (json.has("sharpen")) sharpen = json.getBoolean("sharpen");
                if (json.has("sharpen_radius")) sharpenRadius = json.getDouble("sharpen_radius");
                if (json.has("sharpen_amount")) sharpenAmount = json.getDouble("sharpen_amount");
                if (json.has("smooth_radius")) smoothRadius = json.getDouble("smooth_radius");
                if (json.has("base_tiles")) baseTiles = json.getString("base_tiles");
                if (json.has("tile_attr")) tileAttribution = json.isNull("tile_attr") ? null : json.getString("tile_attr");
                if (json.has("stretch_lower")) lowPercentile = json.getDouble("stretch_lower");
                if (json.has("stretch_upper")) highPercentile = json.getDouble("stretch_upper");
            }
            catch (JSONException e) {
                throw new IllegalArgumentException("Invalid render options: " + e.getMessage(), e);
            }
            return this;
        }

        public RenderOptions build()
        {
            ColorRamp.named(colormap); // fails fast on unknown names
            if (!(opacity >= 0 && opacity <= 1)) {
                throw new IllegalArgumentException("opacity must be in [0,1], got " + opacity);
            }
            if (!(paddingFactor >= 0)) {
                throw new IllegalArgumentException("padding_factor must not be negative, got " + paddingFactor);
            }
            if (!(sharpenRadius >= 0) || !(smoothRadius >= 0)) {
                throw new IllegalArgumentException("radii must not be negative");
            }
            if (!(lowPercentile >= 0 && lowPercentile < highPercentile && highPercentile <= 100)) {
                throw new IllegalArgumentException("Need 0 <= stretch_lower < stretch_upper <= 100, got "
                                                   + lowPercentile + ", " + highPercentile);
            }
            if (Double.isNaN(upsampleFactor)) {
                throw new IllegalArgumentException("upsample_factor is NaN");
            }
            return new RenderOptions(this);
        }
    }
}
