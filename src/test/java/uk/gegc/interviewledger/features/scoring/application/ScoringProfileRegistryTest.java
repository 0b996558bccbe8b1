package uk.gegc.interviewledger.features.scoring.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.interviewledger.features.scoring.config.ScoringProperties;
import uk.gegc.interviewledger.features.scoring.domain.ScoringProfiles;
import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionTier;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoringProfile;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringProfileRegistryTest {

    @Test
    @DisplayName("routes resolve to their built-in profiles")
    void forRoute_builtIns() {
        ScoringProfileRegistry registry = new ScoringProfileRegistry(new ScoringProperties());

        assertThat(registry.forRoute("usa_f1").name()).isEqualTo(ScoringProfiles.USA_F1);
        assertThat(registry.forRoute("uk_student").name()).isEqualTo(ScoringProfiles.UK_STUDENT);
        assertThat(registry.forRoute("uk_student").dimensionFloor().enabled()).isTrue();
    }

    @Test
    @DisplayName("unknown and missing routes fall back to the default profile")
    void forRoute_unknownRoute_usesDefault() {
        ScoringProperties properties = new ScoringProperties();
        properties.setDefaultProfile(ScoringProfiles.UK_STUDENT);
        ScoringProfileRegistry registry = new ScoringProfileRegistry(properties);

        assertThat(registry.forRoute("canada_sds").name()).isEqualTo(ScoringProfiles.UK_STUDENT);
        assertThat(registry.forRoute(null).name()).isEqualTo(ScoringProfiles.UK_STUDENT);
    }

    @Test
    @DisplayName("overrides replace only the configured parts of a built-in profile")
    void overrides_builtInProfile() {
        ScoringProperties properties = new ScoringProperties();
        ScoringProperties.ProfileSettings settings = new ScoringProperties.ProfileSettings();
        settings.setCategoryWeights(Map.of("content", 0.6, "speech", 0.3, "body", 0.1));
        settings.setWarningThreshold(20.0);
        properties.getProfiles().put(ScoringProfiles.USA_F1, settings);

        ScoringProfile profile = new ScoringProfileRegistry(properties).forRoute("usa_f1");

        assertThat(profile.categoryWeights().weightOf("speech")).isEqualTo(0.3);
        assertThat(profile.contentWeights()).isEqualTo(ScoringProfiles.usaF1().contentWeights());
        assertThat(profile.consistencyPolicy().warningThreshold()).isEqualTo(20.0);
        assertThat(profile.consistencyPolicy().maxDiscrepancy()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("new profiles start from their base and can be routed to")
    void newProfile_basedOnBuiltIn() {
        ScoringProperties properties = new ScoringProperties();
        ScoringProperties.ProfileSettings settings = new ScoringProperties.ProfileSettings();
        settings.setBasedOn(ScoringProfiles.UK_STUDENT);
        ScoringProperties.TierSettings low = new ScoringProperties.TierSettings();
        low.setLabel("not_ready");
        low.setFloor(0);
        ScoringProperties.TierSettings high = new ScoringProperties.TierSettings();
        high.setLabel("ready");
        high.setFloor(70);
        settings.setDecisionTiers(List.of(low, high));
        settings.setDimensionFloorEnabled(false);
        properties.getProfiles().put("uk_graduate", settings);
        properties.getRouteProfiles().put("uk_graduate_route", "uk_graduate");

        ScoringProfile profile = new ScoringProfileRegistry(properties).forRoute("uk_graduate_route");

        assertThat(profile.name()).isEqualTo("uk_graduate");
        assertThat(profile.contentWeights()).isEqualTo(ScoringProfiles.ukStudent().contentWeights());
        assertThat(profile.decisionScale().tiers()).extracting(DecisionTier::label).containsExactly("not_ready", "ready");
        assertThat(profile.dimensionFloor().enabled()).isFalse();
    }

    @Test
    @DisplayName("invalid configured weights fail at construction")
    void invalidWeights_failFast() {
        ScoringProperties properties = new ScoringProperties();
        ScoringProperties.ProfileSettings settings = new ScoringProperties.ProfileSettings();
        settings.setSpeechWeights(Map.of("fluency", 0.7, "clarity", 0.7));
        properties.getProfiles().put(ScoringProfiles.USA_F1, settings);

        assertThatThrownBy(() -> new ScoringProfileRegistry(properties))
                .isInstanceOf(InvalidWeightsException.class);
    }

    @Test
    @DisplayName("category weights must name content, speech and body")
    void invalidCategories_failFast() {
        ScoringProperties properties = new ScoringProperties();
        ScoringProperties.ProfileSettings settings = new ScoringProperties.ProfileSettings();
        settings.setCategoryWeights(Map.of("content", 0.8, "speech", 0.2));
        properties.getProfiles().put(ScoringProfiles.USA_F1, settings);

        assertThatThrownBy(() -> new ScoringProfileRegistry(properties))
                .isInstanceOf(InvalidWeightsException.class)
                .hasMessageContaining("must name exactly");
    }

    @Test
    @DisplayName("routes must map to known profiles")
    void unknownRouteProfile_failFast() {
        ScoringProperties properties = new ScoringProperties();
        properties.getRouteProfiles().put("usa_b1", "missing");

        assertThatThrownBy(() -> new ScoringProfileRegistry(properties))
                .isInstanceOf(InvalidWeightsException.class)
                .hasMessageContaining("missing");
    }
}
