package com.hhplus.coffeeshop.presentation.loyalty;

import com.hhplus.coffeeshop.application.loyalty.LoyaltyReconciliationService;
import com.hhplus.coffeeshop.application.loyalty.LoyaltyService;
import com.hhplus.coffeeshop.presentation.loyalty.mapper.LoyaltyMapper;
import com.hhplus.coffeeshop.presentation.loyalty.request.AdjustPointsRequest;
import com.hhplus.coffeeshop.presentation.loyalty.request.RedeemPointsRequest;
import com.hhplus.coffeeshop.presentation.loyalty.response.LoyaltyAccountResponse;
import com.hhplus.coffeeshop.presentation.loyalty.response.LoyaltyTransactionResponse;
import com.hhplus.coffeeshop.presentation.loyalty.response.ReconciliationResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * LoyaltyController - 포인트 / 등급 API
 */
@RestController
@RequestMapping("/loyalty")
public class LoyaltyController {

    private static final String DEFAULT_REDEEM_DESCRIPTION = "포인트 사용";
    private static final String DEFAULT_ADJUST_DESCRIPTION = "관리자 조정";

    private final LoyaltyService loyaltyService;
    private final LoyaltyReconciliationService reconciliationService;
    private final LoyaltyMapper loyaltyMapper;

    public LoyaltyController(LoyaltyService loyaltyService,
                             LoyaltyReconciliationService reconciliationService,
                             LoyaltyMapper loyaltyMapper) {
        this.loyaltyService = loyaltyService;
        this.reconciliationService = reconciliationService;
        this.loyaltyMapper = loyaltyMapper;
    }

    /**
     * GET /loyalty - 포인트 잔액과 등급
     */
    @GetMapping
    public ResponseEntity<LoyaltyAccountResponse> account(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(loyaltyMapper.toAccountResponse(loyaltyService.account(userId)));
    }

    /**
     * GET /loyalty/history - 포인트 내역 (최신순)
     */
    @GetMapping("/history")
    public ResponseEntity<List<LoyaltyTransactionResponse>> history(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(loyaltyMapper.toTransactionResponses(loyaltyService.history(userId)));
    }

    /**
     * POST /loyalty/redeem - 포인트 사용
     */
    @PostMapping("/redeem")
    public ResponseEntity<LoyaltyAccountResponse> redeem(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody RedeemPointsRequest request) {
        String description = request.getDescription() != null ? request.getDescription() : DEFAULT_REDEEM_DESCRIPTION;
        return ResponseEntity.ok(loyaltyMapper.toAccountResponse(
                loyaltyService.debit(userId, request.getPoints(), description)));
    }

    /**
     * POST /loyalty/admin/adjust - 관리자 포인트 조정
     */
    @PostMapping("/admin/adjust")
    public ResponseEntity<LoyaltyAccountResponse> adjust(
            @RequestHeader("X-ADMIN-ID") Long adminId,
            @Valid @RequestBody AdjustPointsRequest request) {
        String description = request.getDescription() != null ? request.getDescription() : DEFAULT_ADJUST_DESCRIPTION;
        return ResponseEntity.ok(loyaltyMapper.toAccountResponse(
                loyaltyService.adjust(request.getUserId(), request.getDelta(), description, adminId)));
    }

    /**
     * POST /loyalty/admin/reconcile - 적립 실패 건 재처리
     */
    @PostMapping("/admin/reconcile")
    public ResponseEntity<ReconciliationResponse> reconcile(@RequestHeader("X-ADMIN-ID") Long adminId) {
        return ResponseEntity.ok(loyaltyMapper.toReconciliationResponse(reconciliationService.retryFailedCredits()));
    }
}
