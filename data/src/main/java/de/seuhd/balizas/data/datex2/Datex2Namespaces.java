package de.seuhd.balizas.data.datex2;

/**
 * Namespace URIs and element names of the DATEX2 v3 situation publication as published by the DGT.
 * Elements are matched by namespace URI, never by prefix.
 */
public final class Datex2Namespaces {
    public static final String PAYLOAD = "http://levelC/schema/3/d2Payload";
    public static final String SITUATION = "http://levelC/schema/3/situation";
    public static final String LOCATION = "http://levelC/schema/3/locationReferencing";
    /**
     * Common DATEX2 types. Part of the fixed namespace contract of the publication; none of the extracted
     * elements live in it, so elements of this namespace never match a lookup.
     */
    public static final String COMMON = "http://levelC/schema/3/common";
    public static final String SPANISH_LOCATION = "http://levelC/schema/3/locationReferencingSpanishExtension";

    // situation namespace
    static final String SITUATION_ELEMENT = "situation";
    static final String ID_ATTRIBUTE = "id";
    static final String OVERALL_SEVERITY = "overallSeverity";
    static final String SITUATION_RECORD = "situationRecord";
    static final String MANAGEMENT_TYPE = "roadOrCarriagewayOrLaneManagementType";
    static final String CAUSE_TYPE = "causeType";
    static final String LOCATION_REFERENCE = "locationReference";

    // location referencing namespace
    static final String ROAD_NAME = "roadName";
    static final String FROM = "from";
    static final String TO = "to";
    static final String POINT = "point";
    static final String POINT_COORDINATES = "pointCoordinates";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final String EXTENDED_POINT = "extendedTpegNonJunctionPoint";

    // Spanish location extension namespace
    static final String PROVINCE = "province";
    static final String MUNICIPALITY = "municipality";
    static final String AUTONOMOUS_COMMUNITY = "autonomousCommunity";
    static final String KILOMETER_POINT = "kilometerPoint";

    private Datex2Namespaces() {
    }
}
