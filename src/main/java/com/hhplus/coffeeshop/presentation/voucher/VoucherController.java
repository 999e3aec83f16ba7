package com.hhplus.coffeeshop.presentation.voucher;

import com.hhplus.coffeeshop.application.voucher.VoucherService;
import com.hhplus.coffeeshop.presentation.voucher.mapper.VoucherMapper;
import com.hhplus.coffeeshop.presentation.voucher.request.ApplyVoucherRequest;
import com.hhplus.coffeeshop.presentation.voucher.response.VoucherResponse;
import com.hhplus.coffeeshop.presentation.voucher.response.VoucherValidationResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * VoucherController - Presentation 계층
 * 바우처 조회/검증 API
 */
@RestController
@RequestMapping("/vouchers")
public class VoucherController {

    private final VoucherService voucherService;
    private final VoucherMapper voucherMapper;

    public VoucherController(VoucherService voucherService, VoucherMapper voucherMapper) {
        this.voucherService = voucherService;
        this.voucherMapper = voucherMapper;
    }

    /**
     * GET /vouchers/{code}/validate?subtotal= - 바우처 사용 가능 여부와 예상 할인액
     */
    @GetMapping("/{code}/validate")
    public ResponseEntity<VoucherValidationResponse> validate(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("code") String code,
            @RequestParam("subtotal") long subtotal) {
        return ResponseEntity.ok(voucherMapper.toValidationResponse(voucherService.check(userId, code, subtotal)));
    }

    /**
     * POST /vouchers/{code}/apply - 바우처 적용 (사용할 수 없으면 400)
     */
    @PostMapping("/{code}/apply")
    public ResponseEntity<VoucherValidationResponse> apply(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("code") String code,
            @Valid @RequestBody ApplyVoucherRequest request) {
        return ResponseEntity.ok(voucherMapper.toValidationResponse(
                voucherService.apply(userId, code, request.getSubtotal())));
    }

    /**
     * GET /vouchers/available - 현재 사용 가능한 바우처 목록
     */
    @GetMapping("/available")
    public ResponseEntity<List<VoucherResponse>> available(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestParam(value = "subtotal", required = false) Long subtotal) {
        return ResponseEntity.ok(voucherMapper.toVoucherResponses(voucherService.availableFor(userId, subtotal)));
    }
}
