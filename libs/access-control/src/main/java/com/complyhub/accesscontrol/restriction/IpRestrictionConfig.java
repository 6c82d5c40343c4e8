package com.complyhub.accesscontrol.restriction;

import java.util.List;

/**
 * Network-origin restriction. Entries may be IPv4 or IPv6.
 *
 * @param allowedIps   exact addresses allowed (empty = no allowlist)
 * @param blockedIps   exact addresses always denied
 * @param allowedCidrs ranges the address must fall into (empty = no range check)
 */
public record IpRestrictionConfig(List<String> allowedIps, List<String> blockedIps, List<String> allowedCidrs)
        implements RestrictionConfig {

    public IpRestrictionConfig {
        allowedIps = allowedIps == null ? List.of() : List.copyOf(allowedIps);
        blockedIps = blockedIps == null ? List.of() : List.copyOf(blockedIps);
        allowedCidrs = allowedCidrs == null ? List.of() : List.copyOf(allowedCidrs);
    }

    public static IpRestrictionConfig allowingCidrs(String... cidrs) {
        return new IpRestrictionConfig(List.of(), List.of(), List.of(cidrs));
    }

    @Override
    public RestrictionType type() {
        return RestrictionType.IP;
    }

    /** True when at least one list is non-empty. */
    public boolean constrainsAnything() {
        return !allowedIps.isEmpty() || !blockedIps.isEmpty() || !allowedCidrs.isEmpty();
    }
}
