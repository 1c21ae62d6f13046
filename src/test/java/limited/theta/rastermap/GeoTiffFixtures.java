// GeoTiffFixtures.java
// Small single-band float GeoTIFFs written with TiffWriter for loader and
// renderer tests.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

final class GeoTiffFixtures
{
    private GeoTiffFixtures() {}

    /**
     * North-up raster with its upper-left corner at (originX, originY).
     *
     * @param epsg  CRS code written to the GeoKeyDirectory, 0 for none
     * @param rows  values[row][col]; NaN is written as is
     */
    static File write(File file, int epsg, double originX, double originY, double pixelSize, double[][] rows) throws IOException
    {
        return write(file, epsg, false, originX, originY, pixelSize, rows, null);
    }

    static File write(File file, int epsg, boolean projected, double originX, double originY, double pixelSize,
                      double[][] rows, String noData) throws IOException
    {
        int height = rows.length, width = rows[0].length;
        Rasters rasters = new Rasters(width, height, 1, FieldType.FLOAT);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rasters.setFirstPixelSample(x, y, (float) rows[y][x]);
            }
        }

        FileDirectory dir = new FileDirectory();
        dir.setImageWidth(width);
        dir.setImageHeight(height);
        dir.setBitsPerSample(32);
        dir.setCompression(TiffConstants.COMPRESSION_NO);
        dir.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        dir.setSamplesPerPixel(1);
        dir.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        dir.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        dir.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
        dir.setWriteRasters(rasters);

        dir.addEntry(new FileDirectoryEntry(FieldTagType.getById(GeoTiffRasterLoader.MODEL_PIXEL_SCALE_TAG),
                                            FieldType.DOUBLE, 3, Arrays.asList(pixelSize, pixelSize, 0.0)));
        dir.addEntry(new FileDirectoryEntry(FieldTagType.getById(GeoTiffRasterLoader.MODEL_TIEPOINT_TAG),
                                            FieldType.DOUBLE, 6, Arrays.asList(0.0, 0.0, 0.0, originX, originY, 0.0)));
        if (epsg > 0) {
            int key = projected ? GeoTiffRasterLoader.KEY_ProjectedCSTypeGeoKey : GeoTiffRasterLoader.KEY_GeographicTypeGeoKey;
            List<Integer> geoKeys = new ArrayList<>(Arrays.asList(1, 1, 0, 1, key, 0, 1, epsg));
            dir.addEntry(new FileDirectoryEntry(FieldTagType.getById(GeoTiffRasterLoader.GEOKEY_DIRECTORY_TAG),
                                                FieldType.SHORT, geoKeys.size(), geoKeys));
        }
        if (noData != null) {
            FieldTagType tag = FieldTagType.getById(GeoTiffRasterLoader.GDAL_NODATA_TAG);
            dir.addEntry(new FileDirectoryEntry(tag, FieldType.ASCII, noData.length() + 1,
                                                Collections.singletonList(noData)));
        }

        TIFFImage tiff = new TIFFImage();
        tiff.add(dir);
        TiffWriter.writeTiff(file, tiff);
        return file;
    } // write

    /** rows x cols grid of row * cols + col + 1, so every pixel is distinct. */
    static double[][] ramp(int height, int width)
    {
        double[][] v = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                v[r][c] = r * width + c + 1;
            }
        }
        return v;
    }

    static boolean noDataTagSupported()
    {
        return FieldTagType.getById(GeoTiffRasterLoader.GDAL_NODATA_TAG) != null;
    }
}
