package com.hhplus.coffeeshop.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReorderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("added_lines")
    private Integer addedLines;

    @JsonProperty("skipped_lines")
    private Integer skippedLines;
}
