package com.complyhub.accesscontrol.restriction;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Configuration of an access restriction, tagged with the {@link RestrictionType} it belongs
 * to. In JSON the tag is the {@code type} property:
 *
 * <pre>{@code
 * { "type": "IP", "allowedCidrs": ["10.0.0.0/8"] }
 * }</pre>
 * The evaluator understands the four built-in variants only and denies any other
 * implementation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IpRestrictionConfig.class, name = "IP"),
        @JsonSubTypes.Type(value = GeoRestrictionConfig.class, name = "GEO"),
        @JsonSubTypes.Type(value = TimeRestrictionConfig.class, name = "TIME"),
        @JsonSubTypes.Type(value = DeviceRestrictionConfig.class, name = "DEVICE")
})
public interface RestrictionConfig {

    /** The restriction type this configuration describes. */
    RestrictionType type();
}
