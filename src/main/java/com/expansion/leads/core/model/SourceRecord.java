package com.expansion.leads.core.model;

import java.util.Objects;

/**
 * A raw row from one upstream source before resolution.
 *
 * @param source         the contributing source
 * @param sourceKey      stable source-local key (also the seen key)
 * @param name           organisation name as the source spells it (display-cleaned)
 * @param locality       town or city, if the source carries one
 * @param county         county, if the source carries one
 * @param route          sponsor route (sponsor register rows only)
 * @param subRoute       sponsor sub-route (sponsor register rows only)
 * @param registryNumber registry number when the source carries it directly
 */
public record SourceRecord(
        SourceType source,
        String sourceKey,
        String name,
        String locality,
        String county,
        String route,
        String subRoute,
        String registryNumber
) {
    public SourceRecord {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(sourceKey, "sourceKey is required");
        name = name != null ? name : "";
        locality = locality != null ? locality : "";
        county = county != null ? county : "";
        route = route != null ? route : "";
        subRoute = subRoute != null ? subRoute : "";
        registryNumber = registryNumber != null ? registryNumber : "";
    }

    public static SourceRecord sponsorRow(String rowKey, String name, String locality, String county,
                                          String route, String subRoute) {
        return new SourceRecord(SourceType.SPONSOR_REGISTER, rowKey, name, locality, county, route, subRoute, "");
    }

    public SeenKey seenKey() {
        return new SeenKey(source, sourceKey);
    }
}
