package com.hhplus.coffeeshop.presentation.cart;

import com.hhplus.coffeeshop.application.cart.CartService;
import com.hhplus.coffeeshop.application.cart.dto.CartLineView;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.presentation.cart.mapper.CartMapper;
import com.hhplus.coffeeshop.presentation.cart.request.AddCartItemRequest;
import com.hhplus.coffeeshop.presentation.cart.request.UpdateCartItemRequest;
import com.hhplus.coffeeshop.presentation.cart.request.UpdateQuantityRequest;
import com.hhplus.coffeeshop.presentation.cart.response.CartCountResponse;
import com.hhplus.coffeeshop.presentation.cart.response.CartLineResponse;
import com.hhplus.coffeeshop.presentation.cart.response.CartResponse;
import com.hhplus.coffeeshop.presentation.cart.response.CheckoutPreviewResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /carts - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.summary(userId)));
    }

    /**
     * POST /carts/items - 장바구니 항목 추가 (동일 옵션이면 수량 병합)
     */
    @PostMapping("/items")
    public ResponseEntity<CartLineResponse> addCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody AddCartItemRequest request) {
        CartLineView line = cartService.addItem(userId, cartMapper.toAddCartItemCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartLineResponse(line));
    }

    /**
     * PATCH /carts/items/{cart_line_id} - 옵션/수량 부분 수정
     * 수량 0 이하로 삭제된 경우 204
     */
    @PatchMapping("/items/{cart_line_id}")
    public ResponseEntity<CartLineResponse> updateCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_line_id") Long cartLineId,
            @RequestBody UpdateCartItemRequest request) {
        Optional<CartLineView> updated = cartService.updateItem(userId, cartLineId, cartMapper.toCartItemPatch(request));
        return updated
                .map(line -> ResponseEntity.ok(cartMapper.toCartLineResponse(line)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * PUT /carts/items/{cart_line_id}/quantity - 수량 변경
     */
    @PutMapping("/items/{cart_line_id}/quantity")
    public ResponseEntity<CartLineResponse> updateCartItemQuantity(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_line_id") Long cartLineId,
            @Valid @RequestBody UpdateQuantityRequest request) {
        Optional<CartLineView> updated = cartService.updateQuantity(userId, cartLineId, request.getQuantity());
        return updated
                .map(line -> ResponseEntity.ok(cartMapper.toCartLineResponse(line)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * DELETE /carts/items/{cart_line_id} - 장바구니 항목 제거
     */
    @DeleteMapping("/items/{cart_line_id}")
    public ResponseEntity<Void> removeCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_line_id") Long cartLineId) {
        cartService.removeItem(userId, cartLineId);
        return ResponseEntity.noContent().build();
    }

    /**
     * DELETE /carts - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(@RequestHeader("X-USER-ID") Long userId) {
        cartService.clear(userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /carts/count - 담긴 수량 합계
     */
    @GetMapping("/count")
    public ResponseEntity<CartCountResponse> count(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(new CartCountResponse(cartService.count(userId)));
    }

    /**
     * GET /carts/preview - 결제 전 금액 미리보기
     */
    @GetMapping("/preview")
    public ResponseEntity<CheckoutPreviewResponse> preview(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestParam(value = "voucher_code", required = false) String voucherCode,
            @RequestParam(value = "order_type", required = false) String orderType) {
        OrderType type = orderType != null ? OrderType.fromString(orderType) : null;
        return ResponseEntity.ok(cartMapper.toCheckoutPreviewResponse(cartService.preview(userId, voucherCode, type)));
    }
}
