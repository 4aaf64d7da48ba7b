package com.vmsentinel.core.config;

import com.vmsentinel.core.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the alert rule catalogue from YAML.
 *
 * <h3>Where rules come from</h3>
 * <ol>
 * <li>the file named by {@value #ENV_RULES_PATH}, when it exists</li>
 * <li>a file handed to {@link #fromFile(String)}</li>
 * <li>otherwise the bundled {@value #DEFAULT_RESOURCE} via
 * {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every entry point runs {@link RulesConfig#validate()} on the parsed result,
 * so a bad catalogue is rejected before any rule set is built from it.
 * Duplicate YAML keys are a parse error.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Names a rules file that replaces the bundled catalogue. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Classpath resource holding the default catalogue. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules from {@value #ENV_RULES_PATH}, falling back to the classpath.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load() {
        return load(System.getenv(ENV_RULES_PATH));
    }

    /**
     * Load rules from {@code configuredPath} when it names an existing file,
     * otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param configuredPath file path, may be {@code null} or blank
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load(String configuredPath) {
        if (configuredPath != null && !configuredPath.isBlank() && Files.exists(Path.of(configuredPath))) {
            LOG.info("Loading rules from configured path: {}", configuredPath);
            return fromFile(configuredPath);
        }
        LOG.info("Loading rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Resolve rules for the given settings and build a rule set from them.
     *
     * @param settings settings naming the rules file; must not be {@code null}
     * @return a new rule set
     * @throws IllegalStateException if rule validation fails
     */
    public static RuleSet loadRuleSet(AnalysisSettings settings) {
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        return load(settings.getRulesConfigPath()).toRuleSet();
    }

    /**
     * Load rules from a YAML file.
     *
     * @param path path of the rules file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules bundled on the classpath.
     *
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RulesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));
        RulesConfig config = yaml.load(is);

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No alert rules defined in configuration");
            config = config != null ? config : new RulesConfig();
        }
        config.validate();

        LOG.info("Loaded {} alert rule(s)", config.getRules().size());
        return config;
    }
}
