// RasterMapTool.java
// Command line front end for the renderers.
//
//   RasterMapTool index <raster.tif> <out.html> [--csv <out.csv>]
//   RasterMapTool multi <out.html> <raster.tif>...
//   RasterMapTool csv <table.csv> <out.html>
//   RasterMapTool truecolor <red.tif> <green.tif> <blue.tif> <out.html>
//   RasterMapTool overlay <csvDir> <red.tif> <green.tif> <blue.tif> <out.html> [--indices ndvi,ndwi]
//   RasterMapTool compare <indicesDir> <out.html>
//   RasterMapTool export-csv <raster.tif> <out.csv>
//
// Every command also takes --aoi <file.geojson> (repeatable) and
// --options <options.json>.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RasterMapTool
{
    private static final Logger LOG = LoggerFactory.getLogger(RasterMapTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    /** Parsed command line: positional arguments plus the shared flags. */
    static final class Arguments
    {
        final String command;
        final List<String> positional = new ArrayList<>();
        final List<File> aoiFiles = new ArrayList<>();
        final Set<String> indices = new LinkedHashSet<>();
        File optionsFile;
        File csvOutput;

        Arguments(String command)
        {
            this.command = command;
        }

        static Arguments parse(String[] args)
        {
            if (args.length == 0) {
                throw new IllegalArgumentException("Missing command");
            }
            Arguments a = new Arguments(args[0]);
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--aoi":
                        a.aoiFiles.add(new File(value(args, ++i, arg)));
                        break;
                    case "--options":
                        a.optionsFile = new File(value(args, ++i, arg));
                        break;
                    case "--csv":
                        a.csvOutput = new File(value(args, ++i, arg));
                        break;
                    case "--indices":
                        for (String s : value(args, ++i, arg).split(",")) {
                            if (!s.trim().isEmpty()) {
                                a.indices.add(s.trim());
                            }
                        }
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        a.positional.add(arg);
                }
            }
            return a;
        } // parse

        private static String value(String[] args, int i, String flag)
        {
            if (i >= args.length) {
                throw new IllegalArgumentException(flag + " needs a value");
            }
            return args[i];
        }

        File file(int i)
        {
            return new File(positional.get(i));
        }

        /** The options file read over the command's own defaults. */
        RenderOptions options(RenderOptions base) throws InputNotFoundException
        {
            return optionsFile == null ? base : RenderOptions.fromFile(optionsFile, base);
        }

        void expect(int min, int max)
        {
            int n = positional.size();
            if (n < min || (max >= 0 && n > max)) {
                throw new IllegalArgumentException(command + " takes "
                                                   + (min == max ? String.valueOf(min) : "at least " + min)
                                                   + " arguments, got " + n);
            }
        }
    }

    public static void main(String[] args)
    {
        int rc = run(args, System.out);
        if (rc != EXIT_OK) {
            System.exit(rc);
        }
    }

    static int run(String[] args, PrintStream out)
    {
        Arguments a;
        try {
            a = Arguments.parse(args);
        }
        catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            usage(out);
            return EXIT_USAGE;
        }

        try {
            switch (a.command) {
                case "index": {
                    a.expect(2, 2);
                    IndexMapRenderer r = new IndexMapRenderer(a.options(RenderOptions.defaults()));
                    AreaOfInterest aoi = AreaOfInterest.load(a.aoiFiles);
                    PreparedLayer layer = r.prepare(a.file(0), aoi);
                    MapDocumentWriter.write(r.build(layer, aoi), a.file(1));
                    if (a.csvOutput != null) {
                        r.exportCsv(layer, a.csvOutput);
                        out.println("Wrote " + a.csvOutput);
                    }
                    out.println("Wrote " + a.file(1));
                    break;
                }
                case "multi": {
                    a.expect(2, -1);
                    List<File> rasters = new ArrayList<>();
                    for (int i = 1; i < a.positional.size(); i++) {
                        rasters.add(a.file(i));
                    }
                    new MultiIndexMapRenderer(a.options(RenderOptions.defaults())).render(rasters, a.aoiFiles, a.file(0));
                    out.println("Wrote " + a.file(0));
                    break;
                }
                case "csv":
                    a.expect(2, 2);
                    new CsvMapRenderer(a.options(RenderOptions.defaults())).render(a.file(0), a.aoiFiles, a.file(1));
                    out.println("Wrote " + a.file(1));
                    break;
                case "truecolor":
                    a.expect(4, 4);
                    new TrueColorMapRenderer(a.options(RenderOptions.trueColorDefaults()))
                        .render(new RgbSource(a.file(0), a.file(1), a.file(2)), a.aoiFiles, a.file(3));
                    out.println("Wrote " + a.file(3));
                    break;
                case "overlay":
                    a.expect(5, 5);
                    new OverlayMapRenderer(a.options(RenderOptions.trueColorDefaults()))
                        .render(a.file(0), new RgbSource(a.file(1), a.file(2), a.file(3)), a.aoiFiles, a.indices, a.file(4));
                    out.println("Wrote " + a.file(4));
                    break;
                case "compare": {
                    a.expect(2, 2);
                    CompareAllMapRenderer r = new CompareAllMapRenderer(a.options(RenderOptions.compareDefaults()));
                    boolean rebuilt = r.ensure(a.file(0), a.aoiFiles, a.file(1));
                    out.println((rebuilt ? "Wrote " : "Up to date: ") + a.file(1));
                    break;
                }
                case "export-csv": {
                    a.expect(2, 2);
                    RenderOptions o = a.options(RenderOptions.defaults());
                    Bounds clip = new LayerPipeline(o).clipBounds(AreaOfInterest.load(a.aoiFiles));
                    CsvGridExporter.export(a.file(0), clip, a.file(1));
                    out.println("Wrote " + a.file(1));
                    break;
                }
                default:
                    out.println("Unknown command " + a.command);
                    usage(out);
                    return EXIT_USAGE;
            }
            return EXIT_OK;
        }
        catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            usage(out);
            return EXIT_USAGE;
        }
        catch (RasterMapException | IOException e) {
            LOG.error("{} failed", a.command, e);
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    } // run


    static void usage(PrintStream out)
    {
        out.println("Usage: RasterMapTool <command> [arguments] [--aoi <file.geojson>]... [--options <options.json>]");
        for (String line : Arrays.asList(
                 "  index <raster.tif> <out.html> [--csv <out.csv>]",
                 "  multi <out.html> <raster.tif>...",
                 "  csv <table.csv> <out.html>",
                 "  truecolor <red.tif> <green.tif> <blue.tif> <out.html>",
                 "  overlay <csvDir> <red.tif> <green.tif> <blue.tif> <out.html> [--indices a,b]",
                 "  compare <indicesDir> <out.html>",
                 "  export-csv <raster.tif> <out.csv>")) {
            out.println(line);
        }
    }
}
