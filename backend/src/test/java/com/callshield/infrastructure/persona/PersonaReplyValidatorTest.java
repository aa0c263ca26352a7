package com.callshield.infrastructure.persona;

import com.callshield.domain.persona.model.PersonaProfile;
import com.callshield.domain.persona.model.ReplyIntent;
import com.callshield.domain.persona.model.ReplyIssue;
import com.callshield.domain.persona.model.ReplyIssueType;
import com.callshield.domain.persona.model.ReplyValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PersonaReplyValidatorTest {

    private final PersonaReplyValidator validator = new PersonaReplyValidator();

    @Nested
    @DisplayName("Synthetic-nature disclosure")
    class Disclosure {

        @Test
        @DisplayName("first-person AI statement fails")
        void i_am_an_ai() {
            ReplyValidationResult result = validator.validate("Sorry, I am an AI and cannot help with that.");

            assertThat(result.passed()).isFalse();
            assertThat(result.errors()).extracting(ReplyIssue::type).contains(ReplyIssueType.SYNTHETIC_DISCLOSURE);
        }

        @Test
        @DisplayName("naming the model vendor fails")
        void vendor_name() {
            assertThat(validator.validate("This reply was written by ChatGPT.").passed()).isFalse();
        }

        @Test
        @DisplayName("denying being human fails")
        void not_human() {
            assertThat(validator.validate("Well, I'm not a real person, you see.").passed()).isFalse();
        }

        @Test
        @DisplayName("ordinary persona speech passes")
        void ordinary_speech() {
            ReplyValidationResult result = validator.validate("Robot? My grandson says the same thing. I am just old, beta.");

            assertThat(result.passed()).isTrue();
            assertThat(result.issues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Digits and shape")
    class DigitsAndShape {

        @Test
        @DisplayName("a four-digit run fails and is not echoed")
        void digit_run() {
            ReplyValidationResult result = validator.validate("Okay, the code is 4 8 2 9, is that right?");

            assertThat(result.passed()).isFalse();
            ReplyIssue issue = result.errors().get(0);
            assertThat(issue.type()).isEqualTo(ReplyIssueType.SENSITIVE_DIGITS);
            assertThat(issue.matchedText()).isNull();
            assertThat(issue.message()).doesNotContain("4 8 2 9");
        }

        @Test
        @DisplayName("three digits are allowed")
        void short_number() {
            assertThat(validator.validate("Give me 100 seconds, please.").passed()).isTrue();
        }

        @Test
        @DisplayName("empty reply fails")
        void empty_reply() {
            ReplyValidationResult result = validator.validate("  ");

            assertThat(result.passed()).isFalse();
            assertThat(result.errors()).extracting(ReplyIssue::type).containsExactly(ReplyIssueType.EMPTY_REPLY);
        }

        @Test
        @DisplayName("an overlong reply is only a warning")
        void overlong_reply() {
            ReplyValidationResult result = validator.validate("Hello? ".repeat(80));

            assertThat(result.passed()).isTrue();
            assertThat(result.issues()).extracting(ReplyIssue::type)
                    .containsExactly(ReplyIssueType.LENGTH_OVEREXPANSION);
        }
    }

    @Test
    @DisplayName("every catalogue reply and probe passes validation")
    void catalogue_is_safe() {
        for (PersonaProfile persona : PersonaProfile.values()) {
            for (ReplyIntent intent : ReplyIntent.values()) {
                for (String reply : PersonaReplyCatalog.replies(persona, intent)) {
                    assertThat(validator.validate(reply).passed()).as(reply).isTrue();
                }
            }
            for (String probe : PersonaReplyCatalog.probes(persona)) {
                assertThat(validator.validate(probe).passed()).as(probe).isTrue();
            }
        }
        assertThat(validator.validate(PersonaReplyCatalog.FALLBACK_REPLY).passed()).isTrue();
    }
}
