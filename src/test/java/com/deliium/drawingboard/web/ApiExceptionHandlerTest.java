package com.deliium.drawingboard.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void statusExceptionKeepsStatusAndReason() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleStatus(new ResponseStatusException(HttpStatus.CONFLICT, "email exists"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("error", "email exists");
    }

    @Test
    void statusExceptionWithoutReasonStillHasError() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleStatus(new ResponseStatusException(HttpStatus.UNAUTHORIZED));

        assertThat(response.getBody()).containsKey("error");
    }

    @Test
    void storageFailureIsGeneric() {
        assertThat(handler.handleStorage(new DataAccessResourceFailureException("db down")))
            .containsEntry("error", "storage failure")
            .doesNotContainValue("db down");
    }

    @Test
    void illegalArgumentIsBadRequest() {
        assertThat(handler.handleBadRequest(new IllegalArgumentException("nope")))
            .containsEntry("error", "bad request")
            .containsEntry("message", "nope");
    }
}
