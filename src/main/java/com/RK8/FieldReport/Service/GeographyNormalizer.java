package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.DTO.AliasRule;
import com.RK8.FieldReport.DTO.GeographyResolution;
import com.RK8.FieldReport.DTO.MatchMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves raw district names to their canonical form using the alias table.
 *
 * <p>Rules are grouped per state when the normalizer is built and never change
 * afterwards, so a single instance is safe to share between concurrent report runs.
 * State lookup is exact and case-sensitive. Within a state an exact rule always
 * beats a prefix rule, and longer prefixes are tried before shorter ones.
 */
public class GeographyNormalizer {

    private final Map<String, StateRules> rulesByState;
    private final String unresolvedMarker;
    private final int ruleCount;

    public GeographyNormalizer(List<AliasRule> rules, String unresolvedMarker) {
        Map<String, Map<String, AliasRule>> exact = new LinkedHashMap<>();
        Map<String, List<AliasRule>> prefix = new LinkedHashMap<>();
        for (AliasRule rule : rules) {
            if (rule.getMatchMode() == MatchMode.EXACT) {
                // first entry wins when two keys clean to the same text
                exact.computeIfAbsent(rule.getState(), k -> new HashMap<>())
                        .putIfAbsent(rule.getRawPattern(), rule);
            } else {
                prefix.computeIfAbsent(rule.getState(), k -> new ArrayList<>()).add(rule);
            }
        }

        Map<String, StateRules> byState = new HashMap<>();
        for (String state : exact.keySet()) {
            byState.put(state, new StateRules(exact.get(state), List.of()));
        }
        for (Map.Entry<String, List<AliasRule>> e : prefix.entrySet()) {
            List<AliasRule> ordered = new ArrayList<>(e.getValue());
            // stable sort keeps table order between prefixes of equal length
            ordered.sort(Comparator.comparingInt((AliasRule r) -> r.literal().length()).reversed());
            StateRules existing = byState.get(e.getKey());
            Map<String, AliasRule> exactRules = existing != null ? existing.exact : Map.of();
            byState.put(e.getKey(), new StateRules(exactRules, ordered));
        }

        this.rulesByState = Collections.unmodifiableMap(byState);
        this.unresolvedMarker = unresolvedMarker;
        this.ruleCount = rules.size();
    }

    public GeographyResolution resolve(String state, String rawDistrict) {
        if (rawDistrict == null || rawDistrict.isEmpty()) {
            return new GeographyResolution(unresolvedMarker, false);
        }

        StateRules rules = state == null ? null : rulesByState.get(state);
        if (rules == null) {
            return new GeographyResolution(rawDistrict, false);
        }

        AliasRule exact = rules.exact.get(rawDistrict);
        if (exact != null) {
            return new GeographyResolution(exact.getCanonicalName(), true);
        }
        for (AliasRule rule : rules.prefix) {
            if (rule.matches(rawDistrict)) {
                return new GeographyResolution(rule.getCanonicalName(), true);
            }
        }
        return new GeographyResolution(rawDistrict, false);
    }

    public boolean hasRulesFor(String state) {
        return rulesByState.containsKey(state);
    }

    public int getRuleCount() {
        return ruleCount;
    }

    private static final class StateRules {
        private final Map<String, AliasRule> exact;
        private final List<AliasRule> prefix;

        private StateRules(Map<String, AliasRule> exact, List<AliasRule> prefix) {
            this.exact = Collections.unmodifiableMap(exact);
            this.prefix = List.copyOf(prefix);
        }
    }
}
