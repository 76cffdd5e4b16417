package de.seuhd.balizas.data.impl;

import de.seuhd.balizas.data.datex2.Datex2DocumentLoader;
import de.seuhd.balizas.data.datex2.SituationExtractor;
import de.seuhd.balizas.domain.exceptions.MalformedDocumentException;
import de.seuhd.balizas.domain.exceptions.NoContentException;
import de.seuhd.balizas.domain.model.Situation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SituationParserImplTest {
    private final SituationParserImpl parser = new SituationParserImpl(new Datex2DocumentLoader(), new SituationExtractor());

    @Test
    void parsesPublication() throws IOException {
        byte[] content;
        try (InputStream in = getClass().getResourceAsStream("/datex2/situation-publication.xml")) {
            assertThat(in).isNotNull();
            content = in.readAllBytes();
        }

        List<Situation> situations = parser.parse(content);

        assertThat(situations).extracting(Situation::id).containsExactly("S-MAD-1", "S-BCN-1", "");
        assertThat(situations).allSatisfy(situation -> {
            assertThat(situation.latitude()).isBetween(-90.0, 90.0);
            assertThat(situation.longitude()).isBetween(-180.0, 180.0);
        });
    }

    @Test
    void propagatesMissingContent() {
        assertThatThrownBy(() -> parser.parse(new byte[0])).isInstanceOf(NoContentException.class);
    }

    @Test
    void propagatesMalformedContent() {
        byte[] content = "<sit:situation>".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> parser.parse(content)).isInstanceOf(MalformedDocumentException.class);
    }
}
