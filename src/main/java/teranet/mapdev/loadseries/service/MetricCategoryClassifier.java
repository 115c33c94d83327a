package teranet.mapdev.loadseries.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.MetricCategory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a metric file name to its measurement category using the configured tokens.
 *
 * Matching is case-insensitive on a substring; categories are tried in the configured
 * order (current, voltage, power by default) and the first hit wins.
 */
@Service
public class MetricCategoryClassifier {

    private final CleaningConfig cleaningConfig;

    public MetricCategoryClassifier(CleaningConfig cleaningConfig) {
        this.cleaningConfig = cleaningConfig;
    }

    public MetricCategory classify(String label) {
        if (label == null) {
            return MetricCategory.UNKNOWN;
        }
        String upper = label.toUpperCase(Locale.ROOT);
        for (Map.Entry<MetricCategory, List<String>> entry : cleaningConfig.getCategories().tokensInOrder().entrySet()) {
            if (containsAny(upper, entry.getValue())) {
                return entry.getKey();
            }
        }
        return MetricCategory.UNKNOWN;
    }

    private static boolean containsAny(String upperLabel, List<String> tokens) {
        if (tokens == null) {
            return false;
        }
        for (String token : tokens) {
            if (token != null && !token.isBlank() && upperLabel.contains(token.trim().toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
