package com.williamcallahan.chatlatex.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.chatlatex.domain.errors.ApiErrorResponse;
import com.williamcallahan.chatlatex.domain.errors.ApiResponse;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describesRootCause() {
        Exception failure = new IllegalStateException("export failed", new IOException("disk full"));

        assertEquals("IllegalStateException: export failed (cause=IOException: disk full)", builder.describeException(failure));
        assertNull(builder.describeException(null));
    }

    @Test
    void errorBodyCarriesDetails() {
        ResponseEntity<ApiResponse> response =
            builder.buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Compilation failed", "/debug/x.tex");

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("error", body.status());
        assertEquals("/debug/x.tex", body.details());
    }
}
