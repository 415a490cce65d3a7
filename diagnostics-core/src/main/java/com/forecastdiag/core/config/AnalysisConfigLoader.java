package com.forecastdiag.core.config;

import com.forecastdiag.core.interval.IntervalEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads an {@link AnalysisConfig} from YAML on behalf of a calling service.
 *
 * <p>
 * The loader never looks anything up by itself: the caller names the file,
 * the classpath resource or passes the document text. After parsing, the
 * interval levels are normalised (numbers widened to {@code double},
 * duplicates removed, the {@link IntervalEstimator#DEFAULT_LEVELS} used when
 * none are listed) and the result is validated.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Default parameters bundled with the library. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @param path YAML file
     * @return normalised and validated configuration
     * @throws IllegalArgumentException if the file does not exist or is not
     *                                  valid YAML for this configuration
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AnalysisConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Configuration file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return read(parse(is, path.toString()), path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + path, e);
        }
    }

    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Configuration file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param resource classpath resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return normalised and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return read(parse(is, resource), "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yaml configuration document, e.g. a request body
     * @return normalised and validated configuration
     */
    public static AnalysisConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        AnalysisConfig parsed;
        try {
            parsed = newYaml().load(new StringReader(yaml));
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Malformed analysis configuration: " + e.getMessage(), e);
        }
        return read(parsed, "inline document");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(AnalysisConfig.class, options));
    }

    private static AnalysisConfig parse(InputStream is, String source) {
        try {
            return newYaml().load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Malformed analysis configuration in " + source + ": "
                    + e.getMessage(), e);
        }
    }

    private static AnalysisConfig read(AnalysisConfig parsed, String source) {
        AnalysisConfig config = parsed;
        if (config == null) {
            LOG.warn("Analysis configuration in {} is empty; using defaults", source);
            config = new AnalysisConfig();
        }
        config.setIntervalLevels(normaliseLevels(config.getIntervalLevels()));
        config.validate();

        LOG.info("Loaded analysis configuration from {}: mode={}, period={}, levels={}, {} outlier rule(s)",
                source, config.getDecompositionMode(),
                config.getPeriod() != null ? config.getPeriod() : "auto",
                config.getIntervalLevels(), config.getOutlierRules().size());
        return config;
    }

    /**
     * YAML integers arrive as {@link Integer} even in a {@code List<Double>}
     * property, so elements are read as plain objects. Anything that is not a
     * number becomes NaN and fails validation.
     */
    static List<Double> normaliseLevels(List<?> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>(IntervalEstimator.DEFAULT_LEVELS);
        }
        Set<Double> levels = new LinkedHashSet<>();
        for (Object level : raw) {
            levels.add(level instanceof Number number ? number.doubleValue() : Double.NaN);
        }
        if (levels.size() < raw.size()) {
            LOG.debug("Dropped {} duplicate interval level(s)", raw.size() - levels.size());
        }
        return new ArrayList<>(levels);
    }
}
