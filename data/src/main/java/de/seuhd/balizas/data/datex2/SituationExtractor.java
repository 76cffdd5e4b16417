package de.seuhd.balizas.data.datex2;

import de.seuhd.balizas.domain.exceptions.NoContentException;
import de.seuhd.balizas.domain.model.Situation;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static de.seuhd.balizas.data.datex2.Datex2Elements.findAll;
import static de.seuhd.balizas.data.datex2.Datex2Elements.findChild;
import static de.seuhd.balizas.data.datex2.Datex2Elements.findFirst;
import static de.seuhd.balizas.data.datex2.Datex2Elements.parseDouble;
import static de.seuhd.balizas.data.datex2.Datex2Elements.text;
import static de.seuhd.balizas.data.datex2.Datex2Namespaces.*;

/**
 * Extracts geolocated situations from a parsed DATEX2 situation publication.
 * <p>
 * One {@link Situation} is produced per situation record that can be geolocated. A record is skipped if it has
 * no location reference, if the location reference contains no from, to or point element, or if the chosen
 * point does not carry both coordinates. Output order follows document order.
 */
@Component
@Slf4j
public class SituationExtractor {

    /**
     * Extracts all geolocated situation records.
     *
     * @param document the parsed publication
     * @return the situations in document order
     * @throws NoContentException if no document is given
     */
    public @NonNull List<Situation> extract(@Nullable Document document) throws NoContentException {
        if (document == null || document.getDocumentElement() == null) {
            throw new NoContentException("XML not parsed, parse a DATEX2 payload before extracting situations");
        }

        List<Situation> situations = new ArrayList<>();
        int records = 0;
        for (Element situation : findAll(document.getDocumentElement(), SITUATION, SITUATION_ELEMENT)) {
            String id = situation.getAttribute(ID_ATTRIBUTE);
            String severity = text(findFirst(situation, SITUATION, OVERALL_SEVERITY));

            for (Element situationRecord : findAll(situation, SITUATION, SITUATION_RECORD)) {
                records++;
                extractRecord(id, severity, situationRecord).ifPresent(situations::add);
            }
        }
        log.debug("Extracted {} situations from {} situation records", situations.size(), records);
        return Collections.unmodifiableList(situations);
    }

    private @NonNull Optional<Situation> extractRecord(@NonNull String id, @Nullable String severity, @NonNull Element situationRecord) {
        Element locationReference = findChild(situationRecord, SITUATION, LOCATION_REFERENCE);
        if (locationReference == null) {
            log.trace("Skipping record {} of situation {}: no location reference", situationRecord.getAttribute(ID_ATTRIBUTE), id);
            return Optional.empty();
        }

        Element pointElement = selectPoint(locationReference);
        if (pointElement == null) {
            log.trace("Skipping record {} of situation {}: no point", situationRecord.getAttribute(ID_ATTRIBUTE), id);
            return Optional.empty();
        }

        PointInfo point = PointInfo.of(pointElement);
        if (point.latitude() == null || point.longitude() == null) {
            log.trace("Skipping record {} of situation {}: incomplete coordinates", situationRecord.getAttribute(ID_ATTRIBUTE), id);
            return Optional.empty();
        }

        return Optional.of(Situation.builder()
                .id(id)
                .severity(severity)
                .latitude(point.latitude())
                .longitude(point.longitude())
                .province(point.province())
                .municipality(point.municipality())
                .autonomousCommunity(point.autonomousCommunity())
                .roadName(text(findFirst(situationRecord, LOCATION, ROAD_NAME)))
                .managementType(text(findFirst(situationRecord, SITUATION, MANAGEMENT_TYPE)))
                .causeType(text(findFirst(situationRecord, SITUATION, CAUSE_TYPE)))
                .kmPoint(point.kmPoint())
                .build());
    }

    /**
     * Picks the point describing the location: the start of a segment, otherwise its end, otherwise a single point.
     */
    private @Nullable Element selectPoint(@NonNull Element locationReference) {
        Element from = findFirst(locationReference, LOCATION, FROM);
        if (from != null) {
            return from;
        }
        Element to = findFirst(locationReference, LOCATION, TO);
        if (to != null) {
            return to;
        }
        return findFirst(locationReference, LOCATION, POINT);
    }

    /**
     * Coordinates and Spanish administrative data of a location point. Every value may be missing.
     */
    record PointInfo(
            @Nullable Double latitude,
            @Nullable Double longitude,
            @Nullable String province,
            @Nullable String municipality,
            @Nullable String autonomousCommunity,
            @Nullable Double kmPoint
    ) {
        static @NonNull PointInfo of(@NonNull Element point) {
            Double latitude = null;
            Double longitude = null;
            Element coordinates = findFirst(point, LOCATION, POINT_COORDINATES);
            if (coordinates != null) {
                latitude = parseDouble(text(findChild(coordinates, LOCATION, LATITUDE)));
                longitude = parseDouble(text(findChild(coordinates, LOCATION, LONGITUDE)));
            }

            String province = null;
            String municipality = null;
            String autonomousCommunity = null;
            Double kmPoint = null;
            Element extension = findFirst(point, LOCATION, EXTENDED_POINT);
            if (extension != null) {
                province = text(findChild(extension, SPANISH_LOCATION, PROVINCE));
                municipality = text(findChild(extension, SPANISH_LOCATION, MUNICIPALITY));
                autonomousCommunity = text(findChild(extension, SPANISH_LOCATION, AUTONOMOUS_COMMUNITY));
                kmPoint = parseDouble(text(findChild(extension, SPANISH_LOCATION, KILOMETER_POINT)));
            }

            return new PointInfo(latitude, longitude, province, municipality, autonomousCommunity, kmPoint);
        }
    }
}
