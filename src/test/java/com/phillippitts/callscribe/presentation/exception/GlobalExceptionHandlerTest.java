package com.phillippitts.callscribe.presentation.exception;

import com.phillippitts.callscribe.exception.InvalidConfigurationException;
import com.phillippitts.callscribe.exception.SessionStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void sessionStateConflictReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleSessionState(new SessionStateException("No active session"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("SessionStateException");
        assertThat(response.getBody().details()).isEqualTo("No active session");
    }

    @Test
    void unknownChannelReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadArgument(new IllegalArgumentException("Unknown voice channel: 42"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).isEqualTo("Invalid request");
        assertThat(response.getBody().details()).contains("42");
    }

    @Test
    void invalidConfigurationNamesPropertyOnly() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleInvalidConfiguration(
                new InvalidConfigurationException("delivery.telegram.bot-token", "is malformed: 123:secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).isEqualTo("Check property delivery.telegram.bot-token");
        assertThat(response.getBody().toString()).doesNotContain("secret");
    }

    @Test
    void unexpectedErrorHidesInternals() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("disk path /var/lib/x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("/var/lib/x");
        assertThat(response.getBody().timestamp()).isAfter(before);
    }
}
