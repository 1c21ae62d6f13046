// MapRenderersTest.java
// End-to-end renders from GeoTIFF, CSV and AOI fixtures on disk.

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MapRenderersTest
{
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private File ndvi, ndwi, aoiFile;
    private File red, green, blue;

    // 8x8 pixels of 0.01 deg covering (-45,-22.08)-(-44.92,-22); AOI is the middle 0.04 deg square
    @Before
    public void writeFixtures() throws Exception
    {
        ndvi = GeoTiffFixtures.write(tmp.newFile("ndvi.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(8, 8));
        double[][] w = GeoTiffFixtures.ramp(8, 8);
        for (double[] row : w) {
            for (int c = 0; c < row.length; c++) row[c] = -row[c] / 64.0;
        }
        ndwi = GeoTiffFixtures.write(tmp.newFile("ndwi.tif"), 4326, -45.0, -22.0, 0.01, w);

        red = GeoTiffFixtures.write(tmp.newFile("B04.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(8, 8));
        green = GeoTiffFixtures.write(tmp.newFile("B03.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(8, 8));
        blue = GeoTiffFixtures.write(tmp.newFile("B02.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(8, 8));

        aoiFile = tmp.newFile("aoi.geojson");
        Files.write(aoiFile.toPath(), ("{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"properties\":{},"
            + "\"geometry\":{\"type\":\"Polygon\",\"coordinates\":"
            + "[[[-44.98,-22.06],[-44.94,-22.06],[-44.94,-22.02],[-44.98,-22.02],[-44.98,-22.06]]]}}]}")
            .getBytes(StandardCharsets.UTF_8));
    }

    private static String read(File f) throws Exception
    {
        return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
    }

    @Test
    public void indexMapWithoutAoi() throws Exception
    {
        File out = new File(tmp.getRoot(), "out/ndvi.html");
        new IndexMapRenderer(RenderOptions.defaults()).render(ndvi, Collections.<File>emptyList(), out);

        String html = read(out);
        assertTrue(html.contains("ndvi (min="));
        assertTrue(html.contains("data:image/png;base64,"));
        assertTrue(html.contains("Esri World Imagery"));
    }

    @Test
    public void indexMapClippedToAoi() throws Exception
    {
        RenderOptions o = RenderOptions.builder().clip(true).sharpen(true).upsampleFactor(2).build();
        IndexMapRenderer r = new IndexMapRenderer(o);
        AreaOfInterest aoi = AreaOfInterest.load(Collections.singletonList(aoiFile));

        PreparedLayer layer = r.prepare(ndvi, aoi);
        assertNotNull(layer.getClipBounds());
        assertTrue(layer.getGrid().countFinite() > 0);
        assertTrue(layer.getGrid().countFinite() < layer.getGrid().getWidth() * layer.getGrid().getHeight());
        assertTrue(layer.getBounds().getWidth() < 0.08);

        MapDocument doc = r.build(layer, aoi);
        assertEquals(1, doc.getOutlines().size());
        assertEquals(layer.getClipBounds(), doc.getView());
        assertEquals(1, doc.getOverlays().size());
    }

    @Test
    public void indexLayerExportsItsFinitePixels() throws Exception
    {
        IndexMapRenderer r = new IndexMapRenderer(RenderOptions.defaults());
        PreparedLayer layer = r.prepare(ndvi, AreaOfInterest.none());
        File csv = r.exportCsv(layer, new File(tmp.getRoot(), "ndvi.csv"));
        assertEquals(65, Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8).size());
    }

    @Test
    public void multiIndexShowsOnlyTheFirstLayer() throws Exception
    {
        MapDocument doc = new MultiIndexMapRenderer(RenderOptions.defaults())
            .build(Arrays.asList(ndvi, ndwi), AreaOfInterest.none());

        assertEquals(2, doc.getOverlays().size());
        assertTrue(doc.getOverlays().get(0).show);
        assertFalse(doc.getOverlays().get(1).show);
        assertTrue(doc.getOverlays().get(0).name.startsWith("ndvi ("));
        assertTrue(doc.getOverlays().get(1).name.startsWith("ndwi ("));
        assertEquals("RdYlGn (relative scale per layer)", doc.getLegend().caption);
        assertEquals(0.0, doc.getLegend().min, 0);
        assertEquals(1.0, doc.getLegend().max, 0);
        assertFalse(doc.isLayerControlCollapsed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void multiIndexNeedsARaster() throws Exception
    {
        new MultiIndexMapRenderer(RenderOptions.defaults()).build(Collections.<File>emptyList(), AreaOfInterest.none());
    }

    @Test
    public void csvMapIsPaddedToTheClipBox() throws Exception
    {
        File csv = CsvGridExporter.export(ndvi, null, new File(tmp.getRoot(), "tables/ndvi.csv"));
        RenderOptions o = RenderOptions.builder().clip(true).paddingFactor(2.0).build();
        CsvMapRenderer r = new CsvMapRenderer(o);
        AreaOfInterest aoi = AreaOfInterest.load(Collections.singletonList(aoiFile));

        PreparedLayer layer = r.prepare(csv, aoi);
        // AOI box is 0.04 wide; padding 2.0 makes the clip box 0.12 wide, wider than the 0.08 grid
        assertTrue(layer.getGrid().getWidth() > 8);
        assertTrue(layer.getBounds().minX <= layer.getClipBounds().minX + 0.005);

        File out = new File(tmp.getRoot(), "csv.html");
        r.render(csv, Collections.singletonList(aoiFile), out);
        assertTrue(read(out).contains("ndvi (min="));
    }

    @Test
    public void trueColorMap() throws Exception
    {
        RgbSource source = new RgbSource(red, green, blue);
        MapDocument doc = new TrueColorMapRenderer(RenderOptions.defaults()).build(source, AreaOfInterest.none());

        assertEquals(TrueColorMapRenderer.ZOOM, doc.getZoom());
        assertEquals("RGB (2-98%)", doc.getLegend().caption);
        assertEquals(2, doc.getBaseLayers().size());
        assertEquals(1, doc.getOverlays().size());
        assertNotNull(doc.getFitBounds());
    }

    @Test
    public void trueColorAlwaysClipsToAnAoi() throws Exception
    {
        AreaOfInterest aoi = AreaOfInterest.load(Collections.singletonList(aoiFile));
        PreparedLayer layer = TrueColorCompositor.prepare(new RgbSource(red, green, blue), aoi, RenderOptions.defaults());
        assertEquals(3, layer.getBands().size());
        assertNotNull(layer.getClipBounds());
        assertTrue(layer.getGrid().getWidth() < 8);
    }

    @Test
    public void overlayCombination() throws Exception
    {
        File dir = tmp.newFolder("indices");
        CsvGridExporter.export(ndvi, null, new File(dir, "ndvi.csv"));
        CsvGridExporter.export(ndwi, null, new File(dir, "ndwi.csv"));
        Files.write(new File(dir, "notes.txt").toPath(), "x".getBytes(StandardCharsets.UTF_8));

        List<File> all = OverlayMapRenderer.listTables(dir, null);
        assertEquals(2, all.size());
        assertEquals("ndvi.csv", all.get(0).getName());

        List<File> some = OverlayMapRenderer.listTables(dir, Collections.singleton("ndwi"));
        MapDocument doc = new OverlayMapRenderer(RenderOptions.defaults())
            .build(some, new RgbSource(red, green, blue), AreaOfInterest.none());

        assertEquals(2, doc.getOverlays().size());
        assertFalse(doc.getOverlays().get(0).control);
        assertEquals("ndwi", doc.getOverlays().get(1).name);
        assertTrue(doc.getOverlays().get(1).show);
        assertEquals(1, doc.getBaseLayers().size());
        assertFalse(doc.isLayerControlCollapsed());
    }

    @Test(expected = InputNotFoundException.class)
    public void overlayWithoutTablesFails() throws Exception
    {
        OverlayMapRenderer.listTables(tmp.newFolder("empty"), null);
    }

    @Test
    public void compareAllIsRebuiltOnlyWhenStale() throws Exception
    {
        File indices = tmp.newFolder("compare");
        File a = GeoTiffFixtures.write(new File(indices, "ndvi.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(4, 4));
        GeoTiffFixtures.write(new File(indices, "ndwi.tif"), 4326, -45.0, -22.0, 0.01, GeoTiffFixtures.ramp(4, 4));
        File artifact = new File(tmp.getRoot(), "maps/" + CompareAllMapRenderer.ARTIFACT_NAME);
        List<File> aoi = Collections.singletonList(aoiFile);
        CompareAllMapRenderer r = new CompareAllMapRenderer();

        assertTrue(CompareAllMapRenderer.isStale(artifact, CompareAllMapRenderer.listRasters(indices)));
        assertTrue(r.ensure(indices, aoi, artifact));
        assertTrue(artifact.isFile());

        long built = artifact.lastModified();
        assertTrue(a.setLastModified(built - 60000));
        assertFalse(r.ensure(indices, aoi, artifact));
        assertEquals(built, artifact.lastModified());

        assertTrue(a.setLastModified(built + 60000));
        assertTrue(r.ensure(indices, aoi, artifact));
    }

    @Test(expected = InputNotFoundException.class)
    public void compareAllWithoutRastersFails() throws Exception
    {
        CompareAllMapRenderer.listRasters(tmp.newFolder("nothing"));
    }
}
