package com.workoutapi.refresh.exception;

import com.workoutapi.refresh.model.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void testRunInProgress_Returns409() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/admin/refresh");

        ResponseEntity<ErrorResponse> response = handler.handleRunInProgress(new RefreshInProgressException(),
                request);

        assertEquals(409, response.getStatusCode().value());
        assertEquals(409, response.getBody().getStatus());
        assertEquals("A refresh run is already in progress", response.getBody().getMessage());
        assertEquals("/api/v1/admin/refresh", response.getBody().getPath());
    }

    @Test
    void testSessionFailure_Returns503() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/admin/refresh");

        ResponseEntity<ErrorResponse> response = handler.handleSessionFailure(
                new RefreshSessionException("no client", new IllegalArgumentException("bad url")), request);

        assertEquals(503, response.getStatusCode().value());
        assertEquals("no client", response.getBody().getMessage());
    }
}
