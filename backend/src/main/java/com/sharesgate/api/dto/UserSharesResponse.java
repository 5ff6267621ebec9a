package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UserSharesResponse(
        @JsonProperty("user_address") String userAddress,
        List<SubjectShare> shares,
        @JsonProperty("chain_type") String chainType
) {

    /** Amount as a plain decimal string. */
    public record SubjectShare(
            @JsonProperty("subject_address") String subjectAddress,
            @JsonProperty("shares_amount") String sharesAmount
    ) {
    }
}
