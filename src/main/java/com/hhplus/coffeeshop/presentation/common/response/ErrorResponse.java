package com.hhplus.coffeeshop.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.coffeeshop.common.exception.BizException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 에러 응답 DTO
 *
 * error_code는 ErrorCode의 코드 값(DOMAIN_*, SYSTEM_*)을 그대로 사용합니다.
 * request_id는 로그와 응답을 맞춰 보기 위한 값으로 응답마다 새로 발급됩니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    public static ErrorResponse from(BizException e) {
        return of(e.getErrorCode(), e.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return ErrorResponse.builder()
                .errorCode(errorCode.getCode())
                .errorMessage(message != null ? message : errorCode.getMessage())
                .timestamp(Instant.now())
                .requestId(newRequestId())
                .build();
    }

    private static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
