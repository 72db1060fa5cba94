package com.williamcallahan.chatlatex.domain.errors;

/**
 * Common shape of the JSON status bodies returned by the LaTeX endpoints.
 *
 * <p>Kept free of Spring types so the CLI can report outcomes with the same records.</p>
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns "success" or "error".
     */
    String status();

    /**
     * Returns the human readable summary.
     */
    String message();
}
