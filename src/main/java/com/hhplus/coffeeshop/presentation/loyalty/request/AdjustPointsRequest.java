package com.hhplus.coffeeshop.presentation.loyalty.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 포인트 조정 요청 DTO (delta는 음수 가능)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustPointsRequest {

    @NotNull
    @JsonProperty("user_id")
    private Long userId;

    @NotNull
    private Long delta;

    @Size(max = 255)
    private String description;
}
