// CompareAllMapRenderer.java
// Cached multi-index comparison map. The artifact is rebuilt only when it is
// missing or some source raster was modified after it.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompareAllMapRenderer
{
    private static final Logger LOG = LoggerFactory.getLogger(CompareAllMapRenderer.class);

    public static final String ARTIFACT_NAME = "compare_indices_all.html";

    private final MultiIndexMapRenderer renderer;

    public CompareAllMapRenderer()
    {
        this(RenderOptions.compareDefaults());
    }

    public CompareAllMapRenderer(RenderOptions options)
    {
        this.renderer = new MultiIndexMapRenderer(options);
    }

    /** True when artifact is absent or older than any of sources. */
    public static boolean isStale(File artifact, List<File> sources)
    {
        if (!artifact.isFile()) {
            return true;
        }
        long built = artifact.lastModified();
        for (File f : sources) {
            if (f.lastModified() > built) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rebuild artifact from rasters if stale.
     *
     * @return true when the map was (re)built, false when the cached one was kept
     */
    public boolean ensure(List<File> rasters, List<File> aoiFiles, File artifact) throws RasterMapException, IOException
    {
        if (!isStale(artifact, rasters)) {
            LOG.info("{} is up to date with {} rasters", artifact, rasters.size());
            return false;
        }
        renderer.render(rasters, aoiFiles, artifact);
        return true;
    }

    /** Every .tif/.tiff in indicesDir, in name order. */
    public boolean ensure(File indicesDir, List<File> aoiFiles, File artifact) throws RasterMapException, IOException
    {
        return ensure(listRasters(indicesDir), aoiFiles, artifact);
    }

    public static List<File> listRasters(File dir) throws InputNotFoundException
    {
        if (!dir.isDirectory()) {
            throw new InputNotFoundException("Index directory not found: " + dir);
        }
        File[] found = dir.listFiles((d, name) -> {
            String n = name.toLowerCase(Locale.ROOT);
            return n.endsWith(".tif") || n.endsWith(".tiff");
        });
        if (found == null || found.length == 0) {
            throw new InputNotFoundException("No index GeoTIFF in " + dir);
        }
        Arrays.sort(found);
        return new ArrayList<>(Arrays.asList(found));
    }
}
