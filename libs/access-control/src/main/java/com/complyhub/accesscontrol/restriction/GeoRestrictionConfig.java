package com.complyhub.accesscontrol.restriction;

import java.util.List;

/**
 * Geographic restriction on the resolved origin of a request. Codes are compared
 * case-insensitively.
 *
 * @param allowedCountries countries allowed (empty = any country not blocked)
 * @param blockedCountries countries always denied
 * @param allowedStates    states allowed when the request carries a state (empty = any)
 */
public record GeoRestrictionConfig(
        List<String> allowedCountries, List<String> blockedCountries, List<String> allowedStates)
        implements RestrictionConfig {

    public GeoRestrictionConfig {
        allowedCountries = allowedCountries == null ? List.of() : List.copyOf(allowedCountries);
        blockedCountries = blockedCountries == null ? List.of() : List.copyOf(blockedCountries);
        allowedStates = allowedStates == null ? List.of() : List.copyOf(allowedStates);
    }

    @Override
    public RestrictionType type() {
        return RestrictionType.GEO;
    }
}
