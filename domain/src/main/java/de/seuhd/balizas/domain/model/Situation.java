package de.seuhd.balizas.domain.model;

import lombok.Builder;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Represents a geolocated traffic incident extracted from one situation record of a DATEX2 publication.
 * The identifier and severity belong to the enclosing situation, all other values to the record and its point.
 *
 * @param id The identifier of the enclosing situation (empty if the publication does not carry one).
 * @param severity Overall severity of the situation (low, medium, high, highest).
 * @param latitude Latitude of the resolved location point.
 * @param longitude Longitude of the resolved location point.
 * @param province Province from the Spanish location extension.
 * @param municipality Municipality from the Spanish location extension.
 * @param autonomousCommunity Autonomous community from the Spanish location extension.
 * @param roadName Name of the affected road (e.g., "A-1").
 * @param managementType Road, carriageway or lane management type (e.g., "laneClosures").
 * @param causeType Cause of the situation record.
 * @param kmPoint Kilometer marker of the point along the road.
 */
@Builder
public record Situation(
        @NonNull String id,
        @Nullable String severity,
        double latitude,
        double longitude,
        @Nullable String province,
        @Nullable String municipality,
        @Nullable String autonomousCommunity,
        @Nullable String roadName,
        @Nullable String managementType,
        @Nullable String causeType,
        @Nullable Double kmPoint
) {
}
