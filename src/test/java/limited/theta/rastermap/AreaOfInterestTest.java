// AreaOfInterestTest.java

package limited.theta.rastermap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import limited.theta.rastermap.geojson.GeoJsonReader;

public class AreaOfInterestTest
{
    static final String SQUARE =
        "{\"type\":\"Polygon\",\"coordinates\":[[[-45.0,-23.0],[-44.0,-23.0],[-44.0,-22.0],[-45.0,-22.0],[-45.0,-23.0]]]}";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    static AreaOfInterest squareAoi() throws Exception
    {
        return AreaOfInterest.of(Collections.singletonList(new GeoJsonReader().parse(SQUARE)));
    }

    @Test
    public void clipBoundsArePaddedUnion() throws Exception
    {
        Bounds b = squareAoi().getClipBounds(0.3);
        assertEquals(-45.15, b.minX, 1e-9);
        assertEquals(-43.85, b.maxX, 1e-9);
        assertEquals(-23.15, b.minY, 1e-9);
        assertEquals(-21.85, b.maxY, 1e-9);
    }

    @Test
    public void unionSpansEveryDocument() throws Exception
    {
        GeoJsonReader reader = new GeoJsonReader();
        String other = "{\"type\":\"Feature\",\"properties\":{},\"geometry\":"
            + "{\"type\":\"Polygon\",\"coordinates\":[[[-43.0,-21.0],[-42.0,-21.0],[-42.0,-20.0],[-43.0,-21.0]]]}}";
        AreaOfInterest aoi = AreaOfInterest.of(Arrays.asList(reader.parse(SQUARE), reader.parse(other)));
        assertEquals(2, aoi.getPolygons().size());
        assertEquals(new Bounds(-45, -23, -42, -20), aoi.getClipBounds(0));
    }

    @Test
    public void noDocumentsMeansNoClip() throws Exception
    {
        AreaOfInterest aoi = AreaOfInterest.load(Collections.<File>emptyList());
        assertFalse(aoi.hasDocuments());
        assertTrue(aoi.isEmpty());
        assertNull(aoi.getClipBounds(0.3));
    }

    @Test
    public void loadsFromFiles() throws Exception
    {
        File f = tmp.newFile("aoi.geojson");
        Files.write(f.toPath(), SQUARE.getBytes(StandardCharsets.UTF_8));
        AreaOfInterest aoi = AreaOfInterest.load(Collections.singletonList(f));
        assertTrue(aoi.hasDocuments());
        assertEquals(1, aoi.getPolygons().size());
    }

    @Test(expected = InputNotFoundException.class)
    public void missingFileIsInputNotFound() throws Exception
    {
        AreaOfInterest.load(Collections.singletonList(new File(tmp.getRoot(), "nope.geojson")));
    }

    @Test(expected = UnsupportedGeometryException.class)
    public void documentsWithoutPolygonsAreRejected() throws Exception
    {
        AreaOfInterest aoi = AreaOfInterest.of(Collections.singletonList(
            new GeoJsonReader().parse("{\"type\":\"Point\",\"coordinates\":[-45.0,-23.0]}")));
        aoi.getClipBounds(0.3);
    }

    @Test
    public void unsupportedGeometryNextToAPolygonIsSkipped() throws Exception
    {
        String fc = "{\"type\":\"FeatureCollection\",\"features\":["
            + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"LineString\",\"coordinates\":[[0,0],[50,50]]}},"
            + "{\"type\":\"Feature\",\"geometry\":" + SQUARE + "}]}";
        AreaOfInterest aoi = AreaOfInterest.of(Collections.singletonList(new GeoJsonReader().parse(fc)));
        assertEquals(new Bounds(-45, -23, -44, -22), aoi.getClipBounds(0));
    }

    @Test
    public void skippedGeometryIsReportedOnce() throws Exception
    {
        String fc = "{\"type\":\"FeatureCollection\",\"features\":["
            + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"LineString\",\"coordinates\":[[0,0],[1,1]]}},"
            + "{\"type\":\"Feature\",\"geometry\":" + SQUARE + "}]}";
        PrintStream err = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, "UTF-8"));
        try {
            Bounds b = AoiBoundsResolver.resolve(Collections.singletonList(new GeoJsonReader().parse(fc)), 0);
            assertEquals(new Bounds(-45, -23, -44, -22), b);
        }
        finally {
            System.setErr(err);
        }
        String log = new String(captured.toByteArray(), StandardCharsets.UTF_8);
        assertEquals(log, log.indexOf("LineString"), log.lastIndexOf("LineString"));
        assertTrue(log, log.contains("LineString"));
    }
}
