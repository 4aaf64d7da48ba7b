package com.vmsentinel.core.config;

import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.Condition;
import com.vmsentinel.core.model.Severity;
import com.vmsentinel.core.rules.DefaultRules;
import com.vmsentinel.core.rules.RuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesLoader} and {@link RulesConfig}.
 */
class RulesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should ship a classpath catalogue identical to the built-in defaults")
    void shouldMatchDefaultCatalogue() {
        RuleSet loaded = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).toRuleSet();

        assertThat(loaded.rules()).containsExactlyElementsOf(DefaultRules.rules());
        assertThat(loaded.overloadMetrics()).isEqualTo(DefaultRules.OVERLOAD_METRICS);
        assertThat(loaded.underloadMetrics()).isEqualTo(DefaultRules.UNDERLOAD_METRICS);
        assertThat(loaded.underloadQuorum()).isEqualTo(RuleSet.DEFAULT_UNDERLOAD_QUORUM);
    }

    @Test
    @DisplayName("Should load rules and metadata from a classpath resource")
    void shouldLoadFromClasspath() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        assertThat(config.getRules()).hasSize(2);
        assertThat(config.getUnderloadQuorum()).isEqualTo(2);

        RuleSet ruleSet = config.toRuleSet();
        AlertRule highCpu = ruleSet.rule("test_high_cpu").orElseThrow();
        assertThat(highCpu.getCondition()).isEqualTo(Condition.GREATER_THAN);
        assertThat(highCpu.getThresholds().getHigh()).isEqualTo(90.5);
        assertThat(highCpu.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(highCpu.getTimeFraction()).isEqualTo(0.5);

        AlertRule lowMemory = ruleSet.rule("test_low_memory").orElseThrow();
        assertThat(lowMemory.getThresholds().getLow()).isEqualTo(10.0);
        assertThat(lowMemory.getTimeFraction()).isEqualTo(1.0);
        assertThat(lowMemory.getDescription()).isEmpty();

        assertThat(ruleSet.overloadMetrics()).containsExactly("cpu_usage");
        assertThat(ruleSet.underloadMetrics()).containsExactlyInAnyOrder("cpu_usage", "memory_usage");
    }

    @Test
    @DisplayName("Should throw for a missing classpath resource")
    void shouldRejectMissingResource() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("no-such-rules.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Classpath resource not found");
    }

    @Test
    @DisplayName("Should report every configuration problem at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("invalid-rules.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Rules configuration validation failed:")
                .hasMessageContaining("gt rule 'missing_high' requires 'high'")
                .hasMessageContaining("Unknown condition: 'between'")
                .hasMessageContaining("Unknown severity: 'loud'")
                .hasMessageContaining("Duplicate rule name: 'missing_high'");
    }

    @Test
    @DisplayName("Should report empty rule entries and NaN time fractions as validation errors")
    void shouldCollectMalformedEntries() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("malformed-entries-rules.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Rules configuration validation failed:")
                .hasMessageContaining("Rule at index 0 is null")
                .hasMessageContaining("Rule 'nan_fraction' requires 'timeFraction' in [0, 1], got: NaN");
    }

    @Test
    @DisplayName("Should load rules from a file and default omitted fields")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("rules.yml");
        Files.writeString(file, String.join("\n",
                "rules:",
                "  - name: busy_disk",
                "    metric: disk_latency",
                "    condition: gt",
                "    high: 40",
                "    severity: WARNING",
                ""));

        RuleSet ruleSet = RulesLoader.fromFile(file.toString()).toRuleSet();

        AlertRule rule = ruleSet.rule("busy_disk").orElseThrow();
        assertThat(rule.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(rule.getTimeFraction()).isEqualTo(0.2);
        assertThat(ruleSet.overloadMetrics()).isEqualTo(DefaultRules.OVERLOAD_METRICS);
        assertThat(ruleSet.underloadQuorum()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldRejectMissingFile() {
        String path = tempDir.resolve("absent.yml").toString();

        assertThatThrownBy(() -> RulesLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Rules file not found");
    }

    @Test
    @DisplayName("Should prefer an existing configured path and fall back to the classpath otherwise")
    void shouldResolveConfiguredPath() throws IOException {
        Path file = tempDir.resolve("custom.yml");
        Files.writeString(file, "rules:\n  - name: only\n    metric: cpu_usage\n    condition: lt\n"
                + "    low: 1\n    severity: info\n");

        assertThat(RulesLoader.load(file.toString()).getRules()).hasSize(1);
        assertThat(RulesLoader.load(null).getRules()).hasSize(DefaultRules.rules().size());
        assertThat(RulesLoader.load("  ").getRules()).hasSize(DefaultRules.rules().size());
        assertThat(RulesLoader.load(tempDir.resolve("absent.yml").toString()).getRules())
                .hasSize(DefaultRules.rules().size());
    }

    @Test
    @DisplayName("Should build a rule set from the settings' rules path")
    void shouldLoadRuleSetFromSettings() throws IOException {
        Path file = tempDir.resolve("settings-rules.yml");
        Files.writeString(file, "underloadQuorum: 1\nrules:\n  - name: only\n    metric: cpu_usage\n"
                + "    condition: range\n    low: 1\n    high: 2\n    severity: info\n");
        AnalysisSettings settings = AnalysisSettings.builder().rulesConfigPath(file.toString()).build();

        RuleSet ruleSet = RulesLoader.loadRuleSet(settings);

        assertThat(ruleSet.size()).isEqualTo(1);
        assertThat(ruleSet.underloadQuorum()).isEqualTo(1);
        assertThat(RulesLoader.loadRuleSet(AnalysisSettings.defaults()).size())
                .isEqualTo(DefaultRules.rules().size());
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() throws IOException {
        Path file = tempDir.resolve("dup.yml");
        Files.writeString(file, "rules:\n  - name: a\n    name: b\n    metric: cpu_usage\n"
                + "    condition: lt\n    low: 1\n    severity: info\n");

        assertThatThrownBy(() -> RulesLoader.fromFile(file.toString()))
                .isInstanceOf(YAMLException.class);
    }

    @Test
    @DisplayName("Should return an empty configuration for an empty file")
    void shouldAcceptEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        RulesConfig config = RulesLoader.fromFile(file.toString());

        assertThat(config.getRules()).isEmpty();
        assertThat(config.toRuleSet().size()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive underload quorum")
    void shouldRejectInvalidQuorum() {
        RulesConfig config = new RulesConfig();
        config.setUnderloadQuorum(0);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("underloadQuorum must be >= 1");
    }
}
