// ColorRamp.java
// Named color ramps sampled into a 256 entry lookup table. Names follow the
// matplotlib conventions ("RdYlGn", "viridis", ...); a "_r" suffix reverses.

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ColorRamp
{
    public static final int LUT_SIZE = 256;

    private static final Map<String, String[]> ANCHORS = new LinkedHashMap<>();
    static {
        // ColorBrewer diverging
        ANCHORS.put("RdYlGn", new String[] { "#a50026", "#d73027", "#f46d43", "#fdae61", "#fee08b", "#ffffbf",
                                             "#d9ef8b", "#a6d96a", "#66bd63", "#1a9850", "#006837" });
        ANCHORS.put("RdYlBu", new String[] { "#a50026", "#d73027", "#f46d43", "#fdae61", "#fee090", "#ffffbf",
                                             "#e0f3f8", "#abd9e9", "#74add1", "#4575b4", "#313695" });
        ANCHORS.put("Spectral", new String[] { "#9e0142", "#d53e4f", "#f46d43", "#fdae61", "#fee08b", "#ffffbf",
                                               "#e6f598", "#abdda4", "#66c2a5", "#3288bd", "#5e4fa2" });
        ANCHORS.put("BrBG", new String[] { "#543005", "#8c510a", "#bf812d", "#dfc27d", "#f6e8c3", "#f5f5f5",
                                           "#c7eae5", "#80cdc1", "#35978f", "#01665e", "#003c30" });
        // ColorBrewer sequential
        ANCHORS.put("Greens", new String[] { "#f7fcf5", "#e5f5e0", "#c7e9c0", "#a1d99b", "#74c476", "#41ab5d",
                                             "#238b45", "#006d2c", "#00441b" });
        ANCHORS.put("YlGn", new String[] { "#ffffe5", "#f7fcb9", "#d9f0a3", "#addd8e", "#78c679", "#41ab5d",
                                           "#238443", "#006837", "#004529" });
        // perceptually uniform, sampled every 1/8
        ANCHORS.put("viridis", new String[] { "#440154", "#472d7b", "#3b528b", "#2c728e", "#21918c", "#28ae80",
                                              "#5ec962", "#addc30", "#fde725" });
        ANCHORS.put("magma", new String[] { "#000004", "#1c1044", "#4f127b", "#812581", "#b5367a", "#e55064",
                                            "#fb8761", "#fec287", "#fcfdbf" });
        ANCHORS.put("gray", new String[] { "#000000", "#ffffff" });
    }

    private final String name;
    private final double[][] lut; // [LUT_SIZE][3], components in 0..1

    private ColorRamp(String name, double[][] lut)
    {
        this.name = name;
        this.lut = lut;
    }

    public static Set<String> baseNames()
    {
        return Collections.unmodifiableSet(ANCHORS.keySet());
    }

    public static ColorRamp named(String name)
    {
        if (name == null) {
            throw new IllegalArgumentException("Color ramp name is required");
        }
        boolean reversed = name.endsWith("_r");
        String base = reversed ? name.substring(0, name.length() - 2) : name;
        String[] anchors = ANCHORS.get(base);
        if (anchors == null) {
            throw new IllegalArgumentException("Unknown color ramp '" + name + "', expected one of " + ANCHORS.keySet());
        }

        double[][] stops = new double[anchors.length][];
        for (int i = 0; i < anchors.length; i++) {
            stops[reversed ? anchors.length - 1 - i : i] = parseHex(anchors[i]);
        }

        double[][] lut = new double[LUT_SIZE][3];
        for (int i = 0; i < LUT_SIZE; i++) {
            double pos = (double) i / (LUT_SIZE - 1) * (stops.length - 1);
            int lo = Math.min((int) Math.floor(pos), stops.length - 2);
            double f = pos - lo;
            for (int k = 0; k < 3; k++) {
                lut[i][k] = stops[lo][k] + f * (stops[lo + 1][k] - stops[lo][k]);
            }
        }
        return new ColorRamp(name, lut);
    }

    public String getName() { return name; }

    /** RGB in 0..1 for a normalized value; t is clipped to [0,1]. */
    public double[] rgb(double t)
    {
        return lut[index(t)];
    }

    public String hex(double t)
    {
        double[] c = rgb(t);
        return String.format("#%02x%02x%02x", toByte(c[0]), toByte(c[1]), toByte(c[2]));
    }

    /** n evenly spaced colors from 0 to 1 inclusive, for legends. */
    public List<String> sampleHex(int n)
    {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(hex(n == 1 ? 0.0 : (double) i / (n - 1)));
        }
        return out;
    }

    // same bucketing as matplotlib: floor(t * N) with t == 1 landing in the top entry
    static int index(double t)
    {
        if (!(t > 0)) return 0;
        if (t >= 1) return LUT_SIZE - 1;
        return Math.min((int) (t * LUT_SIZE), LUT_SIZE - 1);
    }

    private static int toByte(double v)
    {
        return (int) Math.round(Math.max(0, Math.min(1, v)) * 255);
    }

    private static double[] parseHex(String hex)
    {
        int rgb = Integer.parseInt(hex.substring(1), 16);
        return new double[] { ((rgb >> 16) & 0xff) / 255.0, ((rgb >> 8) & 0xff) / 255.0, (rgb & 0xff) / 255.0 };
    }
}
