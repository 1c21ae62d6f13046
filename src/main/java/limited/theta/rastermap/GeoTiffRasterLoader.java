// GeoTiffRasterLoader.java
// Reads the first band of a GeoTIFF (optionally only the window under a clip
// box), turns its no-data sentinel into NaN and reprojects it to WGS84.
//
// Georeferencing comes from ModelPixelScale + ModelTiepoint or from
// ModelTransformation, normalized to a corner-based affine. The horizontal CRS
// comes from the GeoKeyDirectory:
//   3072 ProjectedCSTypeGeoKey, e.g. 32723 = WGS84 / UTM 23S
//   2048 GeographicTypeGeoKey,  e.g. 4326 = WGS84, 4674 = SIRGAS 2000
//   1025 GTRasterTypeGeoKey,    2 = PixelIsPoint (tiepoints refer to centers)

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.ImageWindow;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GeoTiffRasterLoader
{
    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffRasterLoader.class);

    /** Every loaded raster is returned in this CRS. */
    public static final String TARGET_CRS = "EPSG:4326";

    static final int MODEL_PIXEL_SCALE_TAG = 33550;
    static final int MODEL_TIEPOINT_TAG = 33922;
    static final int MODEL_TRANSFORMATION_TAG = 34264;
    static final int GEOKEY_DIRECTORY_TAG = 34735;
    static final int GDAL_NODATA_TAG = 42113;

    static final int KEY_RasterTypeGeoKey = 1025;
    static final int KEY_GeographicTypeGeoKey = 2048;
    static final int KEY_ProjectedCSTypeGeoKey = 3072;
    private static final int RASTER_PIXEL_IS_POINT = 2;
    private static final int USER_DEFINED = 32767;

    // points per edge when carrying a box between CRSs
    private static final int EDGE_SAMPLES = 21;

    public GeoRaster load(File file) throws RasterMapException
    {
        return load(file, null);
    }

    /**
     * @param clipBounds optional box in WGS84 lon/lat; only the source pixels
     *                   under it are read
     * @throws InputNotFoundException when the file is missing, unreadable or has no band
     * @throws EmptyRasterException when the clip box misses the raster entirely
     */
    public GeoRaster load(File file, Bounds clipBounds) throws RasterMapException
    {
        SourceRaster src = open(file);

        CRSFactory crsFactory = new CRSFactory();
        CoordinateTransformFactory ctf = new CoordinateTransformFactory();
        CoordinateReferenceSystem dataCRS = createCrs(crsFactory, src.epsg, file);
        CoordinateReferenceSystem wgs84 = crsFactory.createFromName(TARGET_CRS);
        CoordinateTransform dataToWgs = ctf.createTransform(dataCRS, wgs84);
        CoordinateTransform wgsToData = ctf.createTransform(wgs84, dataCRS);
        boolean sameCrs = TARGET_CRS.equals(src.epsg);

        int x0 = 0, y0 = 0, x1 = src.width, y1 = src.height;
        if (clipBounds != null) {
            Bounds clipData = sameCrs ? clipBounds : transformBounds(clipBounds, wgsToData);
            int[] win = window(src, clipData);
            x0 = win[0]; y0 = win[1]; x1 = win[2]; y1 = win[3];
        }
        boolean windowed = x0 != 0 || y0 != 0 || x1 != src.width || y1 != src.height;
        LOG.debug("Reading {} window [{},{})x[{},{}) of {}x{}", file.getName(), x0, x1, y0, y1, src.width, src.height);

        Rasters rasters;
        try {
            rasters = windowed ? src.directory.readRasters(new ImageWindow(x0, y0, x1, y1))
                               : src.directory.readRasters();
        }
        catch (RuntimeException e) {
            throw new InputNotFoundException("Unable to read band 1 of " + file.getPath(), e);
        }

        int w = x1 - x0, h = y1 - y0;
        double[] values = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                Number n = rasters.getPixelSample(0, x, y);
                double v = n == null ? Double.NaN : n.doubleValue();
                if (src.noData != null && isNoData(n, src.noData)) {
                    v = Double.NaN;
                }
                values[y * w + x] = v;
            }
        }

        GeoRaster raw = new GeoRaster(RasterGrid.wrap(w, h, values), src.transform.shifted(x0, y0));
        if (sameCrs && raw.getTransform().isNorthUp()) {
            return raw;
        }
        return reproject(raw, dataToWgs, wgsToData);
    } // load

    /**
     * Float32 samples are matched against the sentinel narrowed to float, so
     * values like 0.1 that are not exact in single precision still match.
     */
    static boolean isNoData(Number sample, double noData)
    {
        if (sample == null) {
            return false;
        }
        if (sample instanceof Float) {
            return Float.compare(sample.floatValue(), (float) noData) == 0;
        }
        return Double.compare(sample.doubleValue(), noData) == 0;
    }

    /**
     * Warp a raster into WGS84 on a north-up grid with square pixels: the
     * pixel size keeps the source's diagonal pixel count across the
     * destination extent. Destination pixels with no source coverage are NaN.
     */
    static GeoRaster reproject(GeoRaster raw, CoordinateTransform dataToWgs, CoordinateTransform wgsToData) throws InvalidTransformException
    {
        Bounds dst = transformBounds(raw.getBounds(), dataToWgs);
        double ps = Math.hypot(dst.getWidth(), dst.getHeight()) / Math.hypot(raw.getWidth(), raw.getHeight());
        int nx = Math.max(1, (int) (dst.getWidth() / ps + 0.5));
        int ny = Math.max(1, (int) (dst.getHeight() / ps + 0.5));
        GeoTransform dstT = GeoTransform.northUp(dst.minX, dst.maxY, ps, ps);
        LOG.debug("Reprojecting {}x{} to {}x{} at {} deg", raw.getWidth(), raw.getHeight(), nx, ny, ps);

        RasterGrid grid = raw.getGrid();
        GeoTransform srcT = raw.getTransform();
        ProjCoordinate in = new ProjCoordinate(), out = new ProjCoordinate();
        double[] values = new double[RasterGrid.cellCount(nx, ny)];
        for (int row = 0; row < ny; row++) {
            for (int col = 0; col < nx; col++) {
                double[] ll = dstT.pixelCenter(col, row);
                in.x = ll[0];
                in.y = ll[1];
                double v;
                try {
                    wgsToData.transform(in, out);
                    double[] px = srcT.pixelFromWorld(out.x, out.y);
                    v = Resampler.bilinear(grid, px[0] - 0.5, px[1] - 0.5);
                }
                catch (Proj4jException e) {
                    v = Double.NaN; // outside the projection's domain
                }
                values[row * nx + col] = v;
            }
        }
        return new GeoRaster(RasterGrid.wrap(nx, ny, values), dstT);
    }

    // box carried through ct by sampling points along each edge
    static Bounds transformBounds(Bounds b, CoordinateTransform ct) throws InvalidTransformException
    {
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        ProjCoordinate in = new ProjCoordinate(), out = new ProjCoordinate();
        for (int i = 0; i < EDGE_SAMPLES; i++) {
            double f = (double) i / (EDGE_SAMPLES - 1);
            double x = b.minX + f * b.getWidth();
            double y = b.minY + f * b.getHeight();
            double[][] pts = { {x, b.minY}, {x, b.maxY}, {b.minX, y}, {b.maxX, y} };
            for (double[] p : pts) {
                in.x = p[0];
                in.y = p[1];
                try {
                    ct.transform(in, out);
                }
                catch (Proj4jException e) {
                    continue;
                }
                if (Double.isFinite(out.x) && Double.isFinite(out.y)) {
                    minX = Math.min(minX, out.x); maxX = Math.max(maxX, out.x);
                    minY = Math.min(minY, out.y); maxY = Math.max(maxY, out.y);
                }
            }
        }
        if (minX > maxX || minY > maxY) {
            throw new InvalidTransformException("Bounds " + b + " could not be transformed");
        }
        return new Bounds(minX, minY, maxX, maxY);
    }

    // pixel window {x0, y0, x1, y1} (end exclusive) covering box, clamped to the raster
    private static int[] window(SourceRaster src, Bounds box) throws EmptyRasterException
    {
        GeoTransform t = src.transform;
        double[][] corners = {
            t.pixelFromWorld(box.minX, box.minY), t.pixelFromWorld(box.minX, box.maxY),
            t.pixelFromWorld(box.maxX, box.minY), t.pixelFromWorld(box.maxX, box.maxY)
        };
        double cMin = Double.POSITIVE_INFINITY, cMax = Double.NEGATIVE_INFINITY;
        double rMin = Double.POSITIVE_INFINITY, rMax = Double.NEGATIVE_INFINITY;
        for (double[] c : corners) {
            cMin = Math.min(cMin, c[0]); cMax = Math.max(cMax, c[0]);
            rMin = Math.min(rMin, c[1]); rMax = Math.max(rMax, c[1]);
        }
        int x0 = (int) Math.max(0, Math.floor(cMin + 1e-6));
        int y0 = (int) Math.max(0, Math.floor(rMin + 1e-6));
        int x1 = (int) Math.min(src.width, Math.ceil(cMax - 1e-6));
        int y1 = (int) Math.min(src.height, Math.ceil(rMax - 1e-6));
        if (x1 <= x0 || y1 <= y0) {
            throw new EmptyRasterException("Clip bounds " + box + " do not intersect the raster");
        }
        return new int[] { x0, y0, x1, y1 };
    }

    private static SourceRaster open(File file) throws RasterMapException
    {
        if (!file.isFile()) {
            throw new InputNotFoundException("Raster not found: " + file.getPath());
        }
        TIFFImage tiff;
        try {
            tiff = TiffReader.readTiff(file);
        }
        catch (IOException | RuntimeException e) {
            throw InputNotFoundException.forFile(file, e);
        }

        List<FileDirectory> dirs = tiff.getFileDirectories();
        if (dirs == null || dirs.isEmpty()) {
            throw new InputNotFoundException("No image directory in " + file.getPath());
        }
        FileDirectory dir = dirs.get(0);
        Integer samples = dir.getSamplesPerPixel();
        if (samples == null || samples < 1) {
            throw new InputNotFoundException("No band in " + file.getPath());
        }

        SourceRaster src = new SourceRaster();
        src.directory = dir;
        src.width = dir.getImageWidth().intValue();
        src.height = dir.getImageHeight().intValue();

        Map<Integer, Integer> geoKeys = readGeoKeys(dir);
        src.transform = buildTransform(dir, geoKeys);
        if (src.transform == null) {
            throw new InvalidTransformException("No georeferencing found in " + file.getPath());
        }
        src.epsg = detectEpsg(geoKeys);
        if (src.epsg == null) {
            LOG.warn("No horizontal CRS in {}; assuming {}", file.getName(), TARGET_CRS);
            src.epsg = TARGET_CRS;
        }
        src.noData = readNoData(dir);
        LOG.debug("Opened {}: {}x{} {} noData={} {}", file.getName(), src.width, src.height, src.epsg, src.noData, src.transform);
        return src;
    } // open

    private static CoordinateReferenceSystem createCrs(CRSFactory factory, String epsg, File file) throws InputNotFoundException
    {
        try {
            return factory.createFromName(epsg);
        }
        catch (Proj4jException e) {
            throw new InputNotFoundException("Unsupported CRS " + epsg + " in " + file.getPath(), e);
        }
    }

    /** Corner-based affine from the GeoTIFF model tags, or null when there is none. */
    static GeoTransform buildTransform(FileDirectory d, Map<Integer, Integer> geoKeys) throws InvalidTransformException
    {
        Integer rasterType = geoKeys.get(KEY_RasterTypeGeoKey);
        boolean pixelIsPoint = rasterType != null && rasterType == RASTER_PIXEL_IS_POINT;

        double[] scale = toDoubleArray(tagValues(d, MODEL_PIXEL_SCALE_TAG));
        double[] tie = toDoubleArray(tagValues(d, MODEL_TIEPOINT_TAG));
        if (scale != null && scale.length >= 2 && tie != null && tie.length >= 6) {
            double sx = scale[0], sy = scale[1];
            double i = tie[0], j = tie[1], x = tie[3], y = tie[4];

            double originX = x - i * sx;
            double originY = y + j * sy;
            if (pixelIsPoint) {
                originX -= 0.5 * sx;
                originY += 0.5 * sy;
            }
            // ModelPixelScale is positive for north-up rasters; rows run south
            return GeoTransform.of(originX, sx, 0.0, originY, 0.0, -sy);
        }

        double[] mt = toDoubleArray(tagValues(d, MODEL_TRANSFORMATION_TAG));
        if (mt != null && mt.length == 16) {
            double a1 = mt[0], a2 = mt[1], a0 = mt[3];
            double b1 = mt[4], b2 = mt[5], b0 = mt[7];
            if (pixelIsPoint) {
                a0 -= 0.5 * a1 + 0.5 * a2;
                b0 -= 0.5 * b1 + 0.5 * b2;
            }
            return GeoTransform.of(a0, a1, a2, b0, b1, b2);
        }
        return null;
    }

    /** "EPSG:nnnn" from the projected key, else the geographic key; null when neither is usable. */
    static String detectEpsg(Map<Integer, Integer> geoKeys)
    {
        Integer projected = geoKeys.get(KEY_ProjectedCSTypeGeoKey);
        if (projected != null && projected > 0 && projected != USER_DEFINED) {
            return "EPSG:" + projected;
        }
        Integer geographic = geoKeys.get(KEY_GeographicTypeGeoKey);
        if (geographic != null && geographic > 0 && geographic != USER_DEFINED) {
            return "EPSG:" + geographic;
        }
        return null;
    }

    // GeoKeyDirectory: header {1, 1, 0, numKeys} then numKeys x {keyId, tagLocation, count, value}.
    // Only keys stored inline (tagLocation 0) are returned.
    static Map<Integer, Integer> readGeoKeys(FileDirectory d)
    {
        Map<Integer, Integer> keys = new HashMap<>();
        double[] raw = toDoubleArray(tagValues(d, GEOKEY_DIRECTORY_TAG));
        if (raw == null || raw.length < 4) {
            return keys;
        }
        int numKeys = (int) raw[3];
        for (int k = 0; k < numKeys; k++) {
            int base = 4 + 4 * k;
            if (base + 3 >= raw.length) break;
            if ((int) raw[base + 1] == 0) {
                keys.put((int) raw[base], (int) raw[base + 3]);
            }
        }
        return keys;
    }

    static Double readNoData(FileDirectory d)
    {
        Object v = tagValues(d, GDAL_NODATA_TAG);
        if (v == null) {
            return null;
        }
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        String s = toAscii(v).trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(s);
        }
        catch (NumberFormatException e) {
            LOG.warn("Ignoring unparseable no-data value '{}'", s);
            return null;
        }
    }

    private static Object tagValues(FileDirectory d, int tag)
    {
        if (d.getEntries() == null) {
            return null;
        }
        for (FileDirectoryEntry entry : d.getEntries()) {
            if (entry.getFieldTag() != null && entry.getFieldTag().getId() == tag) {
                return entry.getValues();
            }
        }
        return null;
    }

    private static String toAscii(Object v)
    {
        if (v instanceof String) return (String) v;
        if (v instanceof List<?>) {
            StringBuilder sb = new StringBuilder();
            for (Object o : (List<?>) v) {
                sb.append(String.valueOf(o));
            }
            return sb.toString();
        }
        return String.valueOf(v);
    }

    private static double[] toDoubleArray(Object o)
    {
        if (o == null) return null;
        if (o instanceof double[]) return (double[]) o;
        if (o instanceof Number) return new double[] { ((Number) o).doubleValue() };
        if (o instanceof List<?>) {
            List<?> lst = (List<?>) o;
            double[] d = new double[lst.size()];
            for (int i = 0; i < lst.size(); i++) {
                Object v = lst.get(i);
                if (!(v instanceof Number)) return null;
                d[i] = ((Number) v).doubleValue();
            }
            return d;
        }
        return null;
    }

    private static final class SourceRaster
    {
        FileDirectory directory;
        int width, height;
        GeoTransform transform;
        String epsg;
        Double noData;
    }
}
