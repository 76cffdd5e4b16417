package de.seuhd.balizas.domain.model;

/**
 * Overall figures for a list of situations.
 *
 * @param total Number of situations.
 * @param provincesAffected Number of distinct provinces (unspecified counts as one).
 * @param communitiesAffected Number of distinct autonomous communities (unspecified counts as one).
 * @param municipalitiesAffected Number of distinct municipalities (unspecified counts as one).
 */
public record SituationSummary(
        int total,
        int provincesAffected,
        int communitiesAffected,
        int municipalitiesAffected
) {
}
