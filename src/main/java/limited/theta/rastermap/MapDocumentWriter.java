// MapDocumentWriter.java
// Renders a MapDocument into the Leaflet page template and writes it out.

package limited.theta.rastermap;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MapDocumentWriter
{
    private static final Logger LOG = LoggerFactory.getLogger(MapDocumentWriter.class);

    static final String TEMPLATE = "map-template.html";

    private MapDocumentWriter() {}

    public static String render(MapDocument doc) throws IOException
    {
        String template = loadTemplate();
        // org.json escapes "</" so the config cannot close the script element
        return template
            .replace("{{TITLE}}", escapeHtml(doc.getTitle()))
            .replace("{{CONFIG}}", doc.toJson().toString());
    }

    /** Render fully in memory, then write; nothing is written if rendering fails. */
    public static File write(MapDocument doc, File output) throws IOException
    {
        String html = render(doc);
        OutputFiles.writeString(output, html);
        LOG.info("Wrote map {} ({} overlays, {} KB)", output, doc.getOverlays().size(), html.length() / 1024);
        return output;
    }

    private static String loadTemplate() throws IOException
    {
        try (InputStream in = MapDocumentWriter.class.getResourceAsStream(TEMPLATE)) {
            if (in == null) {
                throw new IOException("Missing resource " + TEMPLATE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static String escapeHtml(String s)
    {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '&': sb.append("&amp;"); break;
                case '"': sb.append("&quot;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
