package uk.gegc.interviewledger.features.scoring.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.features.scoring.config.ScoringProperties;
import uk.gegc.interviewledger.features.scoring.config.ScoringProperties.ProfileSettings;
import uk.gegc.interviewledger.features.scoring.domain.ScoringProfiles;
import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyPolicy;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionScale;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionTier;
import uk.gegc.interviewledger.features.scoring.domain.model.DimensionFloor;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoringProfile;
import uk.gegc.interviewledger.features.scoring.domain.model.WeightSet;
import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the scoring profile for an interview route. Profiles are assembled and validated
 * once at startup; a bad weight set fails the application context.
 */
@Slf4j
@Component
public class ScoringProfileRegistry {

    private final Map<String, ScoringProfile> profiles;
    private final Map<String, String> routeProfiles;
    private final ScoringProfile defaultProfile;

    public ScoringProfileRegistry(ScoringProperties properties) {
        Map<String, ScoringProfile> builtIn = ScoringProfiles.builtIn();
        Map<String, ScoringProfile> assembled = new LinkedHashMap<>(builtIn);

        properties.getProfiles().forEach((name, settings) -> {
            ScoringProfile base = builtIn.get(name);
            if (base == null) {
                base = builtIn.get(settings.getBasedOn());
                if (base == null) {
                    throw new InvalidWeightsException("Profile '" + name + "' is based on unknown profile '"
                            + settings.getBasedOn() + "'");
                }
            }
            assembled.put(name, applyOverrides(name, base, settings));
        });

        this.profiles = Collections.unmodifiableMap(assembled);
        this.routeProfiles = new HashMap<>(properties.getRouteProfiles());
        this.routeProfiles.forEach((route, profile) -> {
            if (!profiles.containsKey(profile)) {
                throw new InvalidWeightsException("Route '" + route + "' maps to unknown profile '" + profile + "'");
            }
        });
        this.defaultProfile = profiles.get(properties.getDefaultProfile());
        if (defaultProfile == null) {
            throw new InvalidWeightsException("Default scoring profile '" + properties.getDefaultProfile() + "' is not defined");
        }
        log.info("Loaded scoring profiles {} (default: {})", profiles.keySet(), defaultProfile.name());
    }

    /**
     * Profile for the given route; unknown or missing routes fall back to the default profile.
     */
    public ScoringProfile forRoute(String route) {
        if (route == null) {
            return defaultProfile;
        }
        String profileName = routeProfiles.get(route);
        if (profileName == null) {
            profileName = profiles.containsKey(route) ? route : null;
        }
        return profileName == null ? defaultProfile : profiles.get(profileName);
    }

    public ScoringProfile getDefaultProfile() {
        return defaultProfile;
    }

    public Map<String, ScoringProfile> getProfiles() {
        return profiles;
    }

    private ScoringProfile applyOverrides(String name, ScoringProfile base, ProfileSettings settings) {
        ScoringProfile.ScoringProfileBuilder builder = base.toBuilder().name(name);
        if (settings.getCategoryWeights() != null) {
            builder.categoryWeights(WeightSet.of(settings.getCategoryWeights()));
        }
        if (settings.getContentWeights() != null) {
            builder.contentWeights(WeightSet.of(settings.getContentWeights()));
        }
        if (settings.getSpeechWeights() != null) {
            builder.speechWeights(WeightSet.of(settings.getSpeechWeights()));
        }
        if (settings.getBodyWeights() != null) {
            builder.bodyWeights(WeightSet.of(settings.getBodyWeights()));
        }
        if (settings.getBrevityBonus() != null || settings.getFinanceNumbersBonus() != null
                || settings.getMajorContradictionPenalty() != null) {
            builder.rules(ScoringProfiles.defaultRules(
                    valueOr(settings.getBrevityBonus(), ScoringProfiles.BREVITY_BONUS),
                    valueOr(settings.getFinanceNumbersBonus(), ScoringProfiles.FINANCE_NUMBERS_BONUS),
                    valueOr(settings.getMajorContradictionPenalty(), ScoringProfiles.MAJOR_CONTRADICTION_PENALTY)));
        }
        if (!settings.getDecisionTiers().isEmpty()) {
            builder.decisionScale(DecisionScale.of(settings.getDecisionTiers().stream()
                    .map(t -> new DecisionTier(t.getLabel(), t.getFloor(), t.getSummary()))
                    .toList()));
        }
        if (settings.getDimensionFloorEnabled() != null) {
            builder.dimensionFloor(settings.getDimensionFloorEnabled()
                    ? DimensionFloor.of(
                            valueOr(settings.getDimensionFloorSessionWeight(), 0.8),
                            valueOr(settings.getDimensionFloorDimensionWeight(), 0.2))
                    : DimensionFloor.DISABLED);
        }
        ConsistencyPolicy policy = base.consistencyPolicy();
        builder.consistencyPolicy(new ConsistencyPolicy(
                valueOr(settings.getWarningThreshold(), policy.warningThreshold()),
                valueOr(settings.getMaxDiscrepancy(), policy.maxDiscrepancy()),
                valueOr(settings.getHighPerformerFloor(), policy.highPerformerFloor())));
        return builder.build();
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
