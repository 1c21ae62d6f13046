// CsvGridReader.java
// Rebuilds a regular lon/lat raster from a longitude,latitude,value point
// table, the inverse of CsvGridExporter. Columns are located by header name.

package limited.theta.rastermap;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CsvGridReader
{
    private static final Logger LOG = LoggerFactory.getLogger(CsvGridReader.class);

    /** Pixel size assumed on an axis that has a single distinct coordinate. */
    public static final double FALLBACK_RESOLUTION = 0.0001;

    private CsvGridReader() {}

    public static GeoRaster read(File file) throws RasterMapException
    {
        if (!file.isFile()) {
            throw new InputNotFoundException("Point table not found: " + file.getPath());
        }
        try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return read(in, file.getName());
        }
        catch (IOException e) {
            throw InputNotFoundException.forFile(file, e);
        }
    }

    public static GeoRaster read(Reader reader, String sourceName) throws IOException, RasterMapException
    {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String header = in.readLine();
        if (header == null) {
            throw new EmptyRasterException(sourceName + " is empty");
        }
        if (header.startsWith("\uFEFF")) {
            header = header.substring(1);
        }
        String[] cols = header.split(",", -1);
        int iLon = -1, iLat = -1, iVal = -1;
        for (int i = 0; i < cols.length; i++) {
            String c = cols[i].trim().toLowerCase();
            if (c.equals("longitude")) iLon = i;
            else if (c.equals("latitude")) iLat = i;
            else if (c.equals("value")) iVal = i;
        }
        if (iLon < 0 || iLat < 0 || iVal < 0) {
            throw new IrregularGridException(sourceName + " needs the columns longitude, latitude, value; found " + header);
        }
        int needed = Math.max(iLon, Math.max(iLat, iVal)) + 1;

        List<double[]> points = new ArrayList<>();
        String line;
        int lineNo = 1;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (line.trim().isEmpty()) continue;
            String[] f = line.split(",", -1);
            if (f.length < needed) {
                throw new IrregularGridException(sourceName + ":" + lineNo + ": expected " + needed + " fields");
            }
            try {
                points.add(new double[] { parse(f[iLon]), parse(f[iLat]), parse(f[iVal]) });
            }
            catch (NumberFormatException e) {
                throw new IrregularGridException(sourceName + ":" + lineNo + ": invalid number in '" + line + "'");
            }
        }
        if (points.isEmpty()) {
            throw new EmptyRasterException(sourceName + " has no data rows");
        }
        return buildGrid(points, sourceName);
    } // read

    /** Grid from {lon, lat, value} triples; rows run north to south, columns west to east. */
    public static GeoRaster buildGrid(List<double[]> points, String sourceName) throws RasterMapException
    {
        TreeSet<Double> lonSet = new TreeSet<>();
        TreeSet<Double> latSet = new TreeSet<>(Collections.reverseOrder());
        for (double[] p : points) {
            if (!Double.isFinite(p[0]) || !Double.isFinite(p[1])) {
                throw new IrregularGridException(sourceName + ": non-finite coordinate");
            }
            lonSet.add(p[0]);
            latSet.add(p[1]);
        }
        int nLon = lonSet.size(), nLat = latSet.size();
        if ((long) nLon * nLat != points.size()) {
            throw new IrregularGridException(sourceName + ": " + nLon + " longitudes x " + nLat + " latitudes != "
                                             + points.size() + " rows; not a regular grid");
        }

        List<Double> lons = new ArrayList<>(lonSet);
        List<Double> lats = new ArrayList<>(latSet);
        Map<Double, Integer> lonIndex = new HashMap<>();
        Map<Double, Integer> latIndex = new HashMap<>();
        for (int i = 0; i < nLon; i++) lonIndex.put(lons.get(i), i);
        for (int i = 0; i < nLat; i++) latIndex.put(lats.get(i), i);

        double[] values = new double[nLon * nLat];
        boolean[] seen = new boolean[values.length];
        Arrays.fill(values, Double.NaN);
        for (double[] p : points) {
            int idx = latIndex.get(p[1]) * nLon + lonIndex.get(p[0]);
            if (seen[idx]) {
                throw new IrregularGridException(sourceName + ": duplicate point " + p[0] + ", " + p[1]);
            }
            seen[idx] = true;
            values[idx] = p[2];
        }

        double lonRes = nLon > 1 ? lons.get(1) - lons.get(0) : FALLBACK_RESOLUTION;
        double latRes = nLat > 1 ? lats.get(0) - lats.get(1) : FALLBACK_RESOLUTION;
        if (nLon == 1 || nLat == 1) {
            LOG.warn("{} has a single distinct coordinate on one axis; assuming {} deg pixels", sourceName, FALLBACK_RESOLUTION);
        }
        GeoTransform t = GeoTransform.northUp(lons.get(0) - lonRes / 2, lats.get(0) + latRes / 2, lonRes, latRes);
        LOG.debug("Rebuilt {}x{} grid from {} ({} x {} deg)", nLon, nLat, sourceName, lonRes, latRes);
        return new GeoRaster(RasterGrid.wrap(nLon, nLat, values), t);
    }

    /**
     * Pad with NaN so the grid covers clip, adding round(delta / resolution)
     * whole pixels on each side that falls short. Existing pixels keep their
     * geographic position.
     */
    public static GeoRaster expandToClipBounds(GeoRaster raster, Bounds clip) throws InvalidTransformException
    {
        GeoTransform t = raster.getTransform();
        double lonRes = t.getPixelSizeX(), latRes = t.getPixelSizeY();
        if (!(lonRes > 0) || !(latRes > 0) || !t.isNorthUp()) {
            throw new InvalidTransformException("Cannot pad a grid with transform " + t);
        }

        Bounds b = raster.getBounds();
        int left = padCount(b.minX - clip.minX, lonRes);
        int right = padCount(clip.maxX - b.maxX, lonRes);
        int top = padCount(clip.maxY - b.maxY, latRes);
        int bottom = padCount(b.minY - clip.minY, latRes);
        if (left == 0 && right == 0 && top == 0 && bottom == 0) {
            return raster;
        }

        RasterGrid g = raster.getGrid();
        int w = left + g.getWidth() + right;
        int h = top + g.getHeight() + bottom;
        double[] out = new double[w * h];
        Arrays.fill(out, Double.NaN);
        double[] src = g.samples();
        for (int r = 0; r < g.getHeight(); r++) {
            System.arraycopy(src, r * g.getWidth(), out, (r + top) * w + left, g.getWidth());
        }
        LOG.debug("Padded {}x{} grid by l={} r={} t={} b={}", g.getWidth(), g.getHeight(), left, right, top, bottom);
        return new GeoRaster(RasterGrid.wrap(w, h, out), t.shifted(-left, -top));
    }

    private static int padCount(double delta, double resolution)
    {
        double pixels = delta / resolution;
        return pixels <= 0 ? 0 : (int) Math.round(pixels);
    }

    private static double parse(String s)
    {
        String t = s.trim();
        if (t.isEmpty() || t.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        return Double.parseDouble(t);
    }
}
