// CsvSource.java
// Point table source. The table is always read whole; clipping happens by
// masking and by padding the grid out to the clip box.

package limited.theta.rastermap;

import java.io.File;
import java.util.Collections;
import java.util.List;

public final class CsvSource implements RasterSource
{
    private final File file;

    public CsvSource(File file)
    {
        this.file = file;
    }

    @Override
    public String getName()
    {
        return RasterSource.stem(file);
    }

    @Override
    public List<GeoRaster> load(Bounds clipBounds) throws RasterMapException
    {
        return Collections.singletonList(CsvGridReader.read(file));
    }

    @Override
    public List<File> getInputFiles()
    {
        return Collections.singletonList(file);
    }

    @Override
    public boolean padsToClipBounds()
    {
        return true;
    }
}
