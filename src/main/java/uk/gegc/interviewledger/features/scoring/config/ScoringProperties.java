package uk.gegc.interviewledger.features.scoring.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring configuration. Profiles listed here override a built-in profile of the same name, or
 * create a new one starting from {@link ProfileSettings#basedOn}.
 */
@Configuration
@ConfigurationProperties(prefix = "scoring")
@Validated
@Data
public class ScoringProperties {

    /**
     * Profile used for routes without an explicit mapping.
     */
    @NotBlank
    private String defaultProfile = "usa_f1";

    /**
     * Route name to profile name.
     */
    private Map<String, String> routeProfiles = new HashMap<>(Map.of(
            "usa_f1", "usa_f1",
            "uk_student", "uk_student"
    ));

    @Valid
    private Map<String, ProfileSettings> profiles = new HashMap<>();

    @Data
    public static class ProfileSettings {
        /**
         * Built-in profile a new profile starts from. Ignored when overriding a built-in profile.
         */
        private String basedOn = "usa_f1";

        private Map<String, Double> categoryWeights;
        private Map<String, Double> contentWeights;
        private Map<String, Double> speechWeights;
        private Map<String, Double> bodyWeights;

        private Double brevityBonus;
        private Double financeNumbersBonus;
        private Double majorContradictionPenalty;

        @Valid
        private List<TierSettings> decisionTiers = new ArrayList<>();

        private Boolean dimensionFloorEnabled;
        private Double dimensionFloorSessionWeight;
        private Double dimensionFloorDimensionWeight;

        private Double warningThreshold;
        private Double maxDiscrepancy;
        private Double highPerformerFloor;
    }

    @Data
    public static class TierSettings {
        @NotBlank
        private String label;
        private double floor;
        private String summary;
    }
}
