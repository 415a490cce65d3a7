package com.forecastdiag.core.outlier;

import com.forecastdiag.core.config.OutlierRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link OutlierDetector} instances from
 * {@link OutlierRule} configurations.
 *
 * <p>
 * Register new method names here alongside their detector class.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given rule. A threshold or contamination of
     * zero selects the method default.
     *
     * @param rule the rule configuration; must not be {@code null}
     * @return an appropriate {@link OutlierDetector}
     * @throws NullPointerException     if {@code rule} or its method is
     *                                  {@code null}
     * @throws IllegalArgumentException if the method is unknown
     */
    public static OutlierDetector create(OutlierRule rule) {
        Objects.requireNonNull(rule, "OutlierRule must not be null");
        Objects.requireNonNull(rule.getMethod(), "Outlier method must not be null");

        double threshold = rule.getThreshold();
        String method = rule.getMethod().toLowerCase(Locale.ROOT);
        return switch (method) {
            case ZScoreOutlierDetector.METHOD -> new ZScoreOutlierDetector(
                    threshold > 0 ? threshold : ZScoreOutlierDetector.DEFAULT_THRESHOLD);
            case IqrOutlierDetector.METHOD -> new IqrOutlierDetector(
                    threshold > 0 ? threshold : IqrOutlierDetector.DEFAULT_MULTIPLIER);
            case ModifiedZScoreOutlierDetector.METHOD -> new ModifiedZScoreOutlierDetector(
                    threshold > 0 ? threshold : ModifiedZScoreOutlierDetector.DEFAULT_THRESHOLD);
            case MahalanobisOutlierDetector.METHOD -> new MahalanobisOutlierDetector(
                    rule.getContamination() > 0
                            ? rule.getContamination()
                            : MahalanobisOutlierDetector.DEFAULT_CONTAMINATION);
            default -> throw new IllegalArgumentException(
                    "Unknown outlier method: '" + rule.getMethod()
                            + "'. Supported methods: zscore, iqr, modified_zscore, mahalanobis");
        };
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * @param rules rule configurations; must not be {@code null}
     * @return unmodifiable list of detectors (one per rule)
     */
    public static List<OutlierDetector> createAll(List<OutlierRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} outlier detector(s) from configuration", rules.size());
        List<OutlierDetector> detectors = rules.stream()
                .map(DetectorFactory::create)
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
