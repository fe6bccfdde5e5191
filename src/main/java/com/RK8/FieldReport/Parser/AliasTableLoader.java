package com.RK8.FieldReport.Parser;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.AliasRule;
import com.RK8.FieldReport.DTO.MatchMode;
import com.RK8.FieldReport.Exception.AliasTableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the district alias table:
 *
 * <pre>
 * STATE NAME:
 *   Source District: Master District
 *   'Truncated Prefi*': Master District
 * </pre>
 *
 * A source name ending in {@value AliasRule#WILDCARD_MARKER} becomes a prefix rule.
 * State and district keys are cleaned of surrounding whitespace and control
 * characters here, once, so lookups never have to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AliasTableLoader {

    private final ResourceLoader resourceLoader;
    private final ReportProperties properties;

    public List<AliasRule> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            if (properties.getGeography().isFailIfMissing()) {
                throw new AliasTableException(location, "Alias table not found: " + location);
            }
            log.warn("Alias table not found at {}. District names will pass through unchanged.", location);
            return List.of();
        }

        try (InputStream in = resource.getInputStream()) {
            List<AliasRule> rules = parse(in, location);
            log.info("Loaded {} district alias rules from {}", rules.size(), location);
            return rules;
        } catch (IOException e) {
            throw new AliasTableException(location, "Could not read alias table: " + e.getMessage(), e);
        }
    }

    public List<AliasRule> parse(InputStream in, String location) {
        Object document;
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException | YAMLException e) {
            throw new AliasTableException(location, "Could not parse alias table: " + e.getMessage(), e);
        }

        if (document == null) return List.of();
        if (!(document instanceof Map)) {
            throw new AliasTableException(location, "Alias table must map state names to district mappings");
        }

        List<AliasRule> rules = new ArrayList<>();
        for (Map.Entry<?, ?> stateEntry : ((Map<?, ?>) document).entrySet()) {
            String state = cleanKey(String.valueOf(stateEntry.getKey()));
            Object districts = stateEntry.getValue();

            if (districts == null) {
                // state listed with every district commented out
                log.debug("No alias rules under {}", state);
                continue;
            }
            if (!(districts instanceof Map)) {
                throw new AliasTableException(location, "Districts of " + state + " must be a mapping");
            }

            for (Map.Entry<?, ?> entry : ((Map<?, ?>) districts).entrySet()) {
                String pattern = cleanKey(String.valueOf(entry.getKey()));
                Object target = entry.getValue();
                if (target == null || cleanKey(String.valueOf(target)).isEmpty()) {
                    throw new AliasTableException(location,
                            "No canonical name for " + state + " / " + pattern);
                }
                String canonical = cleanKey(String.valueOf(target));

                MatchMode mode = pattern.endsWith(AliasRule.WILDCARD_MARKER)
                        ? MatchMode.PREFIX_WILDCARD
                        : MatchMode.EXACT;
                if (pattern.isEmpty() || (mode == MatchMode.PREFIX_WILDCARD
                        && pattern.length() == AliasRule.WILDCARD_MARKER.length())) {
                    log.warn("Ignoring alias rule with empty pattern under {}", state);
                    continue;
                }

                rules.add(AliasRule.builder()
                        .state(state)
                        .rawPattern(pattern)
                        .canonicalName(canonical)
                        .matchMode(mode)
                        .build());
            }
        }
        return rules;
    }

    /**
     * Strips whitespace and control characters from both ends, e.g. a stray newline
     * left inside a quoted key.
     */
    static String cleanKey(String key) {
        if (key == null) return "";
        int start = 0;
        int end = key.length();
        while (start < end && isStrippable(key.charAt(start))) start++;
        while (end > start && isStrippable(key.charAt(end - 1))) end--;
        return key.substring(start, end);
    }

    private static boolean isStrippable(char c) {
        return Character.isWhitespace(c) || Character.isISOControl(c) || Character.isSpaceChar(c);
    }
}
