package com.RK8.FieldReport.Parser;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.AliasRule;
import com.RK8.FieldReport.DTO.MatchMode;
import com.RK8.FieldReport.Exception.AliasTableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AliasTableLoaderTest {

    private ReportProperties properties;
    private AliasTableLoader loader;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        loader = new AliasTableLoader(new DefaultResourceLoader(), properties);
    }

    @Test
    @DisplayName("Keys ending in * become prefix rules, others exact")
    void exactAndWildcardRules() {
        List<AliasRule> rules = parse(
                "ANDHRA PRADESH:\n"
                        + "  'Sri Potti Sriramulu Nell*': Nellore\n"
                        + "  Visakhapatnam: Vizag\n");

        assertThat(rules).hasSize(2);
        assertThat(rules.get(0).getMatchMode()).isEqualTo(MatchMode.PREFIX_WILDCARD);
        assertThat(rules.get(0).literal()).isEqualTo("Sri Potti Sriramulu Nell");
        assertThat(rules.get(1).getMatchMode()).isEqualTo(MatchMode.EXACT);
        assertThat(rules.get(1).getState()).isEqualTo("ANDHRA PRADESH");
        assertThat(rules.get(1).getCanonicalName()).isEqualTo("Vizag");
    }

    @Test
    @DisplayName("State and district keys lose padding and embedded newlines")
    void stripsNewlineAndPaddingFromKeys() {
        List<AliasRule> rules = parse(
                "' UTTARAKHAND ':\n"
                        + "  \"Almora\\n\": Almora\n"
                        + "  '  Hardwar ': Haridwar\n");

        assertThat(rules).extracting(AliasRule::getRawPattern).containsExactly("Almora", "Hardwar");
        assertThat(rules).extracting(AliasRule::getState).containsOnly("UTTARAKHAND");
    }

    @Test
    @DisplayName("Whitespace inside a key is kept")
    void keepsInternalWhitespace() {
        List<AliasRule> rules = parse("SIKKIM:\n  'North  District': 'North Sikkim'\n");

        assertThat(rules.get(0).getRawPattern()).isEqualTo("North  District");
    }

    @Test
    @DisplayName("A state with only commented entries has no rules")
    void stateWithOnlyCommentsHasNoRules() {
        List<AliasRule> rules = parse(
                "HARYANA:\n"
                        + "  # Gurgaon: Gurugram\n"
                        + "BIHAR:\n"
                        + "  Purnia: Purnea\n");

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).getState()).isEqualTo("BIHAR");
    }

    @Test
    @DisplayName("An empty document has no rules")
    void emptyDocumentHasNoRules() {
        assertThat(parse("# nothing mapped yet\n")).isEmpty();
    }

    @Test
    @DisplayName("A district list that is not a mapping names its state")
    void rejectsDistrictListThatIsNotAMapping() {
        assertThatThrownBy(() -> parse("BIHAR:\n  - Purnia\n"))
                .isInstanceOf(AliasTableException.class)
                .hasMessageContaining("BIHAR");
    }

    @Test
    @DisplayName("A district without a canonical name is rejected")
    void rejectsMissingCanonicalName() {
        assertThatThrownBy(() -> parse("BIHAR:\n  Purnia:\n"))
                .isInstanceOf(AliasTableException.class)
                .hasMessageContaining("Purnia");
    }

    @Test
    @DisplayName("Unparseable YAML is rejected")
    void rejectsBrokenYaml() {
        assertThatThrownBy(() -> parse("BIHAR: [unclosed\n"))
                .isInstanceOf(AliasTableException.class);
    }

    @Test
    @DisplayName("A bare * key is ignored")
    void ignoresBareWildcard() {
        List<AliasRule> rules = parse("BIHAR:\n  '*': Everything\n  Purnia: Purnea\n");

        assertThat(rules).extracting(AliasRule::getRawPattern).containsExactly("Purnia");
    }

    @Test
    @DisplayName("Missing table loads as no rules by default")
    void missingTablePassesThroughByDefault() {
        assertThat(loader.load("classpath:does-not-exist.yml")).isEmpty();
    }

    @Test
    @DisplayName("Missing table fails when configured as required")
    void missingTableFailsWhenRequired() {
        properties.getGeography().setFailIfMissing(true);

        assertThatThrownBy(() -> loader.load("classpath:does-not-exist.yml"))
                .isInstanceOf(AliasTableException.class)
                .hasMessageContaining("does-not-exist.yml");
    }

    @Test
    @DisplayName("Bundled district_mapping.yml loads with exact and prefix rules")
    void bundledTable() {
        List<AliasRule> rules = loader.load("classpath:district_mapping.yml");

        assertThat(rules).isNotEmpty();
        assertThat(rules).anySatisfy(rule -> {
            assertThat(rule.getState()).isEqualTo("KARNATAKA");
            assertThat(rule.getRawPattern()).isEqualTo("Bangalore");
            assertThat(rule.getCanonicalName()).isEqualTo("Bengaluru Urban");
        });
        assertThat(rules).anySatisfy(rule -> {
            assertThat(rule.getState()).isEqualTo("UTTARAKHAND");
            assertThat(rule.getRawPattern()).isEqualTo("Almora");
        });
        assertThat(rules).filteredOn(rule -> rule.getMatchMode() == MatchMode.PREFIX_WILDCARD)
                .extracting(AliasRule::getCanonicalName)
                .contains("Nellore", "Mohali", "North 24 Pgs.");
    }

    @Test
    @DisplayName("Key cleaning strips control characters")
    void cleanKeyStripsControlCharacters() {
        assertThat(AliasTableLoader.cleanKey("\tAlmora\r\n")).isEqualTo("Almora");
        assertThat(AliasTableLoader.cleanKey("   ")).isEmpty();
    }

    private List<AliasRule> parse(String yaml) {
        return loader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test");
    }
}
