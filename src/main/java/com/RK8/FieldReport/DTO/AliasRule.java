package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of the district alias table, scoped to a single state.
 */
@Value
@Builder
public class AliasRule {
    public static final String WILDCARD_MARKER = "*";

    String state;
    String rawPattern;
    String canonicalName;
    MatchMode matchMode;

    /**
     * The literal part of the pattern: the whole pattern for exact rules, the text
     * before the wildcard marker for prefix rules.
     */
    public String literal() {
        if (matchMode == MatchMode.PREFIX_WILDCARD && rawPattern.endsWith(WILDCARD_MARKER)) {
            return rawPattern.substring(0, rawPattern.length() - WILDCARD_MARKER.length());
        }
        return rawPattern;
    }

    public boolean matches(String rawDistrict) {
        if (rawDistrict == null) return false;
        return matchMode == MatchMode.EXACT
                ? rawPattern.equals(rawDistrict)
                : rawDistrict.startsWith(literal());
    }
}
