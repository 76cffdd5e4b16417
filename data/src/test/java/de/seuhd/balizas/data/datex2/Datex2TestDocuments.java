package de.seuhd.balizas.data.datex2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * XML snippets and fixtures shared by the DATEX2 tests.
 */
final class Datex2TestDocuments {
    static final String PUBLICATION_FIXTURE = "/datex2/situation-publication.xml";

    private static final String HEADER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d2:payload xmlns:d2="http://levelC/schema/3/d2Payload"
                        xmlns:sit="http://levelC/schema/3/situation"
                        xmlns:loc="http://levelC/schema/3/locationReferencing"
                        xmlns:com="http://levelC/schema/3/common"
                        xmlns:lse="http://levelC/schema/3/locationReferencingSpanishExtension">
            """;
    private static final String FOOTER = "</d2:payload>";

    private Datex2TestDocuments() {
    }

    /**
     * Wraps the given situations in a payload element declaring all DATEX2 namespaces.
     */
    static byte[] payload(String situations) {
        return (HEADER + situations + FOOTER).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Builds a point with coordinates and, if a province is given, a Spanish extension carrying it.
     */
    static String point(String element, String latitude, String longitude, String province) {
        String extension = province == null ? "" : """
                <loc:_tpegNonJunctionPointExtension>
                  <loc:extendedTpegNonJunctionPoint>
                    <lse:province>%s</lse:province>
                  </loc:extendedTpegNonJunctionPoint>
                </loc:_tpegNonJunctionPointExtension>
                """.formatted(province);
        return """
                <loc:%1$s>
                  <loc:pointCoordinates>
                    <loc:latitude>%2$s</loc:latitude>
                    <loc:longitude>%3$s</loc:longitude>
                  </loc:pointCoordinates>
                  %4$s
                </loc:%1$s>
                """.formatted(element, latitude, longitude, extension);
    }

    static byte[] fixture() {
        try (InputStream in = Datex2TestDocuments.class.getResourceAsStream(PUBLICATION_FIXTURE)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture " + PUBLICATION_FIXTURE);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
