// CsvGridExporter.java
// Writes one longitude,latitude,value row per finite pixel, at pixel centers.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CsvGridExporter
{
    private static final Logger LOG = LoggerFactory.getLogger(CsvGridExporter.class);

    public static final String HEADER = "longitude,latitude,value";

    private CsvGridExporter() {}

    /** Rows are written north to south, west to east. Returns the row count. */
    public static int write(GeoRaster raster, Writer out) throws IOException
    {
        RasterGrid g = raster.getGrid();
        GeoTransform t = raster.getTransform();
        out.write(HEADER);
        out.write('\n');
        int rows = 0;
        for (int r = 0; r < g.getHeight(); r++) {
            for (int c = 0; c < g.getWidth(); c++) {
                double v = g.get(r, c);
                if (!Double.isFinite(v)) continue;
                double[] ll = t.pixelCenter(c, r);
                out.write(Double.toString(ll[0]));
                out.write(',');
                out.write(Double.toString(ll[1]));
                out.write(',');
                out.write(Double.toString(v));
                out.write('\n');
                rows++;
            }
        }
        return rows;
    }

    /** Builds the table in memory first so a failed export leaves no file behind. */
    public static File export(GeoRaster raster, File output) throws IOException
    {
        StringWriter sw = new StringWriter();
        int rows = write(raster, sw);
        OutputFiles.writeString(output, sw.toString());
        LOG.info("Exported {} points to {}", rows, output);
        return output;
    }

    /** Load a GeoTIFF (optionally clipped) and export its finite pixels. */
    public static File export(File raster, Bounds clipBounds, File output) throws RasterMapException, IOException
    {
        return export(new GeoTiffRasterLoader().load(raster, clipBounds), output);
    }
}
