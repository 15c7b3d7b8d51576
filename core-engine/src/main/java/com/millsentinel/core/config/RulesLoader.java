package com.millsentinel.core.config;

import com.millsentinel.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link RulesConfig} from a YAML source.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>{@link #load()}: the file named by {@value #ENV_RULES_PATH} when set,
 * otherwise the built-in {@value #DEFAULT_RESOURCE}</li>
 * <li>{@link #fromFile(Path)}: a rules file chosen by the operator</li>
 * <li>{@link #fromClasspath(String)}: a resource bundled with the
 * application</li>
 * </ul>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link RulesConfig#validate()} after parsing
 * so that a misconfigured rule fails the run before any analysis starts.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Built-in rule set shipped with the engine. */
    public static final String DEFAULT_RESOURCE = "alert-rules.yml";

    private RulesLoader() {
        // utility class — not instantiable
    }

    /**
     * Load the operator's rules file if {@value #ENV_RULES_PATH} names one,
     * else the built-in rule set.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the named file does not exist
     * @throws IllegalStateException    if rule validation fails
     */
    public static RulesConfig load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank()) {
            return fromFile(Path.of(envPath));
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return parseAndValidate(is, "file " + path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, "classpath resource " + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static RulesConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No alert rules defined in {}", source);
            config = new RulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} alert rule(s) from {}", config.getRules().size(), source);
        LOG.debug("Alert rules: {}", config.getRules().stream().map(AlertRule::getName).toList());
        return config;
    }
}
