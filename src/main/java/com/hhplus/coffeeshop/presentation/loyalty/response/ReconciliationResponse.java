package com.hhplus.coffeeshop.presentation.loyalty.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResponse {

    private Integer attempted;

    private Integer resolved;

    @JsonProperty("still_failing")
    private Integer stillFailing;
}
