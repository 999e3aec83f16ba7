package com.hhplus.coffeeshop.presentation.voucher;

import com.hhplus.coffeeshop.application.voucher.VoucherService;
import com.hhplus.coffeeshop.application.voucher.dto.VoucherCheckResult;
import com.hhplus.coffeeshop.domain.voucher.VoucherRejectedException;
import com.hhplus.coffeeshop.domain.voucher.VoucherRejection;
import com.hhplus.coffeeshop.presentation.common.GlobalExceptionHandler;
import com.hhplus.coffeeshop.presentation.voucher.mapper.VoucherMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("VoucherController 단위 테스트")
class VoucherControllerTest {

    private static final Long USER_ID = 1L;

    @Mock
    private VoucherService voucherService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new VoucherController(voucherService, new VoucherMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("검증 실패는 200과 valid=false, 거부 사유로 응답한다")
    void validateRejected() throws Exception {
        when(voucherService.check(USER_ID, "save10", 20_000L)).thenReturn(VoucherCheckResult.builder()
                .code("SAVE10")
                .ok(false)
                .rejection(VoucherRejection.BELOW_MIN_ORDER)
                .reason("최소 주문 금액 30,000원 이상이어야 합니다")
                .subtotal(20_000L)
                .discountAmount(0L)
                .build());

        mockMvc.perform(get("/vouchers/{code}/validate", "save10")
                        .header("X-USER-ID", USER_ID)
                        .param("subtotal", "20000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.rejection_code").value("BELOW_MIN_ORDER"))
                .andExpect(jsonPath("$.discount_amount").value(0));
    }

    @Test
    @DisplayName("검증 성공 시 예상 할인액을 반환한다")
    void validateAccepted() throws Exception {
        when(voucherService.check(USER_ID, "SAVE10", 55_000L)).thenReturn(VoucherCheckResult.builder()
                .code("SAVE10").ok(true).subtotal(55_000L).discountAmount(5_500L).build());

        mockMvc.perform(get("/vouchers/{code}/validate", "SAVE10")
                        .header("X-USER-ID", USER_ID)
                        .param("subtotal", "55000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.discount_amount").value(5_500))
                .andExpect(jsonPath("$.rejection_code").doesNotExist());
    }

    @Test
    @DisplayName("subtotal 파라미터가 숫자가 아니면 400")
    void invalidSubtotal() throws Exception {
        mockMvc.perform(get("/vouchers/{code}/validate", "SAVE10")
                        .header("X-USER-ID", USER_ID)
                        .param("subtotal", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("명시적 적용이 거부되면 400과 바우처 거부 에러 코드")
    void applyRejected() throws Exception {
        when(voucherService.apply(USER_ID, "SAVE10", 20_000L))
                .thenThrow(new VoucherRejectedException("SAVE10", VoucherRejection.BELOW_MIN_ORDER, "최소 주문 금액 미달"));

        mockMvc.perform(post("/vouchers/{code}/apply", "SAVE10")
                        .header("X-USER-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subtotal\": 20000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_VOUCHER_REJECTED"));
    }
}
