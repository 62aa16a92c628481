package com.intervue.evaluation.provider;

/**
 * Raw HTTP outcome of one call to the reasoning endpoint, whatever its status.
 */
public record ReasoningEndpointResponse(
        int httpStatus,
        String body
) {
    public ReasoningEndpointResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return httpStatus >= 200 && httpStatus < 300;
    }
}
