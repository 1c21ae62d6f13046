// LayerPipeline.java
// The shared enhancement chain every renderer runs its sources through:
//
//   sharpen -> mask to AOI -> pad to clip box -> upsample -> smooth -> mask again
//
// Masking only happens when clipping is on and the AOI holds polygons; the
// second mask pass removes values that bilinear upsampling spreads across the
// AOI edge. Padding only applies to sources that ask for it (point tables).

package limited.theta.rastermap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LayerPipeline
{
    private static final Logger LOG = LoggerFactory.getLogger(LayerPipeline.class);

    private final RenderOptions options;

    public LayerPipeline(RenderOptions options)
    {
        this.options = options;
    }

    public RenderOptions getOptions() { return options; }

    /** Padded AOI box when clipping is enabled, otherwise null. */
    public Bounds clipBounds(AreaOfInterest aoi) throws UnsupportedGeometryException
    {
        if (!options.isClip()) {
            return null;
        }
        if (!aoi.hasDocuments()) {
            LOG.warn("Clipping requested without an AOI; rendering the full raster");
            return null;
        }
        return aoi.getClipBounds(options.getPaddingFactor());
    }

    public PreparedLayer prepare(RasterSource source, AreaOfInterest aoi) throws RasterMapException
    {
        return prepare(source, aoi, clipBounds(aoi));
    }

    /** Run the chain with a clip box computed once for several layers. */
    public PreparedLayer prepare(RasterSource source, AreaOfInterest aoi, Bounds clip) throws RasterMapException
    {
        List<Polygon> mask = options.isClip() ? aoi.getPolygons() : Collections.<Polygon>emptyList();
        Bounds padTo = source.padsToClipBounds() ? clip : null;

        List<RasterGrid> bands = new ArrayList<>();
        GeoTransform transform = null;
        for (GeoRaster band : source.load(clip)) {
            GeoRaster out = enhance(band, mask, padTo);
            bands.add(out.getGrid());
            transform = out.getTransform();
        }
        PreparedLayer layer = new PreparedLayer(source.getName(), bands, transform, clip, aoi.getPolygons());
        LOG.debug("Prepared layer {}: {}", layer.getName(), layer.getGrid());
        return layer;
    }

    /**
     * One band through the chain.
     *
     * @param mask  polygons to null the outside of; empty to skip masking
     * @param padTo box to pad the grid out to, or null
     */
    public GeoRaster enhance(GeoRaster raster, List<Polygon> mask, Bounds padTo) throws InvalidTransformException
    {
        GeoRaster r = raster;
        if (options.isSharpen()) {
            r = r.withGrid(Enhancement.unsharpMask(r.getGrid(), options.getSharpenRadius(), options.getSharpenAmount()));
        }
        if (!mask.isEmpty()) {
            r = PolygonMask.apply(r, mask);
        }
        if (padTo != null) {
            r = CsvGridReader.expandToClipBounds(r, padTo);
        }
        r = Enhancement.upsample(r, options.getUpsampleFactor());
        r = r.withGrid(Enhancement.smooth(r.getGrid(), options.getSmoothRadius()));
        if (!mask.isEmpty() && options.getUpsampleFactor() > 1.0) {
            r = PolygonMask.apply(r, mask);
        }
        return r;
    }
}
