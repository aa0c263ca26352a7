package com.callshield.application.session.command;

import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.Speaker;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionCommandJsonTest {

    private final ObjectMapper mapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    @Test
    @DisplayName("the type field selects the command")
    void fragment() throws Exception {
        SessionCommand command = mapper.readValue("""
                {"type": "transcript_fragment", "session_id": "s-1", "speaker": "caller",
                 "text": "your account is blocked", "sequence_number": 3}
                """, SessionCommand.class);

        assertThat(command).isEqualTo(new TranscriptFragmentCommand("s-1", Speaker.CALLER, "your account is blocked", 3L));
        assertThat(command.sessionId()).isEqualTo("s-1");
    }

    @Test
    @DisplayName("start and review commands bind their fields")
    void start_and_review() throws Exception {
        SessionCommand start = mapper.readValue("""
                {"type": "start", "session_id": "s-1", "phone_id": "device-7", "direction": "inbound"}
                """, SessionCommand.class);
        SessionCommand review = mapper.readValue("""
                {"type": "review_status_update", "package_id": "EVP-20260301-000001", "new_status": "under_review"}
                """, SessionCommand.class);

        assertThat(start).isEqualTo(new StartCommand("s-1", "device-7", CallDirection.INBOUND, null));
        assertThat(review).isInstanceOfSatisfying(ReviewStatusUpdateCommand.class, r -> {
            assertThat(r.newStatus()).isEqualTo(SubmissionStatus.UNDER_REVIEW);
            assertThat(r.sessionId()).isNull();
        });
    }

    @Test
    @DisplayName("an unknown type is refused")
    void unknown_type() {
        assertThatThrownBy(() -> mapper.readValue("{\"type\": \"reboot\"}", SessionCommand.class))
                .isInstanceOf(InvalidTypeIdException.class);
    }
}
