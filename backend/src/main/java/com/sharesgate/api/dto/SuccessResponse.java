package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code {success, error?}} envelope used by the gate check and bot registration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuccessResponse(boolean success, String error) {

    public static SuccessResponse ok() {
        return new SuccessResponse(true, null);
    }

    public static SuccessResponse failed(String error) {
        return new SuccessResponse(false, error);
    }
}
