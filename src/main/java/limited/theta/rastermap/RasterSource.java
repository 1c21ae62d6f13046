// RasterSource.java
// Where a layer's pixels come from: a GeoTIFF, a point table or an RGB band
// triple. Every source yields WGS84 bands that share one grid.

package limited.theta.rastermap;

import java.io.File;
import java.util.List;

public interface RasterSource
{
    /** Layer name shown in legends and layer controls. */
    String getName();

    /**
     * @param clipBounds WGS84 box to restrict reading to, or null for everything
     */
    List<GeoRaster> load(Bounds clipBounds) throws RasterMapException;

    /** Files the layer is derived from, used for staleness checks. */
    List<File> getInputFiles();

    /** Whether the pipeline pads this source's grid with no-data out to the clip bounds. */
    default boolean padsToClipBounds()
    {
        return false;
    }

    /** File name without its last extension. */
    static String stem(File file)
    {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
