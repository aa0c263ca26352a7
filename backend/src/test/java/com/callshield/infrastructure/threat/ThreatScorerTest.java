package com.callshield.infrastructure.threat;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.threat.model.ThreatAssessment;
import com.callshield.domain.threat.model.ThreatLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThreatScorerTest {

    private static final String IMPERSONATION_AND_THREAT = "this is the bank, your account is blocked";
    private static final String CREDENTIAL_REQUEST = "please share the OTP sent to your phone";

    private ThreatScorer scorer;
    private ThreatScoringState state;

    @BeforeEach
    void setUp() {
        scorer = new ThreatScorer();
        state = new ThreatScoringState();
    }

    private ThreatAssessment score(String text) {
        return scorer.score(state, text, List.of(), OptionalDouble.empty());
    }

    @Nested
    @DisplayName("Bank impersonation scenario")
    class BankScenario {

        @Test
        @DisplayName("impersonation with an account threat lands in MEDIUM")
        void first_fragment() {
            ThreatAssessment result = score(IMPERSONATION_AND_THREAT);

            assertThat(result.signal().keywordPressure()).isCloseTo(0.7, within(1e-9));
            assertThat(result.signal().behavioralEscalation()).isCloseTo(0.6, within(1e-9));
            assertThat(result.signal().classifierProbability()).isNull();
            assertThat(result.signal().fused()).isCloseTo(0.65, within(1e-9));
            assertThat(result.runningScore()).isCloseTo(0.455, within(1e-9));
            assertThat(result.level()).isEqualTo(ThreatLevel.MEDIUM);
            assertThat(result.indicators())
                    .contains("impersonation", "threat", "impersonation_then_threat");
        }

        @Test
        @DisplayName("a credential request right after raises the call to HIGH")
        void second_fragment() {
            score(IMPERSONATION_AND_THREAT);
            ThreatAssessment result = score(CREDENTIAL_REQUEST);

            assertThat(result.signal().behavioralEscalation()).isCloseTo(1.0, within(1e-9));
            assertThat(result.signal().fused()).isCloseTo(0.85, within(1e-9));
            assertThat(result.runningScore()).isCloseTo(0.7315, within(1e-9));
            assertThat(result.level()).isEqualTo(ThreatLevel.HIGH);
            assertThat(result.previousLevel()).isEqualTo(ThreatLevel.MEDIUM);
            assertThat(result.levelChanged()).isTrue();
            assertThat(result.indicators()).contains("impersonation_then_credential");
        }

        @Test
        @DisplayName("classifier probability takes a fifth of the fused score")
        void with_classifier() {
            ThreatAssessment result = scorer.score(state, IMPERSONATION_AND_THREAT, List.of(), OptionalDouble.of(0.9));

            assertThat(result.signal().classifierProbability()).isEqualTo(0.9);
            assertThat(result.signal().fused()).isCloseTo(0.70, within(1e-9));
            assertThat(result.runningScore()).isCloseTo(0.49, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Running score")
    class RunningScore {

        @Test
        @DisplayName("harmless speech stays SAFE")
        void safe_speech() {
            ThreatAssessment result = score("hello, how are you");

            assertThat(result.runningScore()).isZero();
            assertThat(result.level()).isEqualTo(ThreatLevel.SAFE);
            assertThat(result.indicators()).isEmpty();
        }

        @Test
        @DisplayName("the score decays slower than it rises")
        void slow_decay() {
            score(IMPERSONATION_AND_THREAT);
            ThreatAssessment result = score("ok");

            assertThat(result.runningScore()).isCloseTo(0.3185, within(1e-9));
            assertThat(result.level()).isEqualTo(ThreatLevel.MEDIUM);
        }

        @Test
        @DisplayName("a stronger classifier signal never lowers the score")
        void monotonic_in_classifier() {
            ThreatAssessment low = scorer.score(new ThreatScoringState(), IMPERSONATION_AND_THREAT,
                    List.of(), OptionalDouble.of(0.2));
            ThreatAssessment high = scorer.score(new ThreatScoringState(), IMPERSONATION_AND_THREAT,
                    List.of(), OptionalDouble.of(0.9));

            assertThat(high.runningScore()).isGreaterThanOrEqualTo(low.runningScore());
        }

        @Test
        @DisplayName("sensitive entities add a fixed boost")
        void entity_boost() {
            ExtractedEntity code = new ExtractedEntity(EntityType.ONE_TIME_CODE, "482913", "****13", 0.6, 0, 6, false);
            ThreatAssessment result = scorer.score(state, "ok", List.of(code), OptionalDouble.empty());

            assertThat(result.signal().entityBoost()).isEqualTo(0.15);
            assertThat(result.runningScore()).isCloseTo(0.105, within(1e-9));
            assertThat(result.level()).isEqualTo(ThreatLevel.LOW);
            assertThat(result.indicators()).contains("sensitive_entity");
        }

        @Test
        @DisplayName("the score is recorded on the state")
        void state_updated() {
            score(IMPERSONATION_AND_THREAT);

            assertThat(state.getRunningScore()).isCloseTo(0.455, within(1e-9));
            assertThat(state.getLevel()).isEqualTo(ThreatLevel.MEDIUM);
            assertThat(state.getFragmentCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Behavioral escalation")
    class Escalation {

        @Test
        @DisplayName("escalation looks back two turns")
        void within_window() {
            score("this is the bank");
            score("ok");
            ThreatAssessment result = score("share the otp");

            assertThat(result.signal().behavioralEscalation()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("older turns fall out of the window")
        void outside_window() {
            score("this is the bank");
            score("ok");
            score("ok then");
            ThreatAssessment result = score("share the otp");

            assertThat(result.signal().behavioralEscalation()).isZero();
        }

        @Test
        @DisplayName("secrecy requests are flagged")
        void secrecy_flag() {
            ThreatAssessment result = score("do not tell anyone about this");

            assertThat(result.signal().behavioralEscalation()).isCloseTo(0.3, within(1e-9));
            assertThat(result.indicators()).contains("secrecy");
        }

        @Test
        @DisplayName("repeated utterances are noted without changing the score")
        void repetition_indicator() {
            score("hello");
            ThreatAssessment result = score("Hello");

            assertThat(result.indicators()).containsExactly("repetitive_speech");
            assertThat(result.runningScore()).isZero();
        }
    }

    @Nested
    @DisplayName("Levels")
    class Levels {

        @Test
        @DisplayName("boundaries are half-open")
        void boundaries() {
            assertThat(ThreatLevel.fromScore(0.0)).isEqualTo(ThreatLevel.SAFE);
            assertThat(ThreatLevel.fromScore(0.1)).isEqualTo(ThreatLevel.LOW);
            assertThat(ThreatLevel.fromScore(0.3)).isEqualTo(ThreatLevel.MEDIUM);
            assertThat(ThreatLevel.fromScore(0.5999)).isEqualTo(ThreatLevel.MEDIUM);
            assertThat(ThreatLevel.fromScore(0.6)).isEqualTo(ThreatLevel.HIGH);
            assertThat(ThreatLevel.fromScore(0.85)).isEqualTo(ThreatLevel.CRITICAL);
        }

        @Test
        @DisplayName("only HIGH and CRITICAL alert")
        void alerting() {
            assertThat(ThreatLevel.MEDIUM.isAlerting()).isFalse();
            assertThat(ThreatLevel.HIGH.isAlerting()).isTrue();
            assertThat(ThreatLevel.CRITICAL.recommendedAction()).isEqualTo("handoff_to_ai");
        }
    }
}
