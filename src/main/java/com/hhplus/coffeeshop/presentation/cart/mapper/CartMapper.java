package com.hhplus.coffeeshop.presentation.cart.mapper;

import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.cart.dto.CartItemPatch;
import com.hhplus.coffeeshop.application.cart.dto.CartLineView;
import com.hhplus.coffeeshop.application.cart.dto.CartSummary;
import com.hhplus.coffeeshop.application.cart.dto.CheckoutPreview;
import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.product.CupSize;
import com.hhplus.coffeeshop.presentation.cart.request.AddCartItemRequest;
import com.hhplus.coffeeshop.presentation.cart.request.UpdateCartItemRequest;
import com.hhplus.coffeeshop.presentation.cart.response.CartLineResponse;
import com.hhplus.coffeeshop.presentation.cart.response.CartResponse;
import com.hhplus.coffeeshop.presentation.cart.response.CheckoutPreviewResponse;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 문자열 옵션(size, temperature)은 이곳에서 enum으로 변환되며,
 * 알 수 없는 값은 IllegalArgumentException(400)으로 처리됩니다.
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        return AddCartItemCommand.builder()
                .productId(request.getProductId())
                .size(request.getSize() != null ? CupSize.fromString(request.getSize()) : null)
                .quantity(request.getQuantity())
                .sugarLevel(request.getSugarLevel())
                .iceLevel(request.getIceLevel())
                .temperature(request.getTemperature() != null ? Temperature.fromString(request.getTemperature()) : null)
                .toppingIds(request.getToppingIds())
                .build();
    }

    public CartItemPatch toCartItemPatch(UpdateCartItemRequest request) {
        return CartItemPatch.builder()
                .size(Optional.ofNullable(request.getSize()).map(CupSize::fromString))
                .quantity(Optional.ofNullable(request.getQuantity()))
                .sugarLevel(Optional.ofNullable(request.getSugarLevel()))
                .iceLevel(Optional.ofNullable(request.getIceLevel()))
                .temperature(Optional.ofNullable(request.getTemperature()).map(Temperature::fromString))
                .toppingIds(Optional.ofNullable(request.getToppingIds()))
                .build();
    }

    public CartResponse toCartResponse(CartSummary summary) {
        return CartResponse.builder()
                .userId(summary.getUserId())
                .lines(summary.getLines().stream()
                        .map(this::toCartLineResponse)
                        .collect(Collectors.toList()))
                .subtotal(summary.getSubtotal())
                .itemCount(summary.getItemCount())
                .lineCount(summary.getLineCount())
                .build();
    }

    public CartLineResponse toCartLineResponse(CartLineView line) {
        return CartLineResponse.builder()
                .cartLineId(line.getCartLineId())
                .productId(line.getProductId())
                .productName(line.getProductName())
                .size(line.getSize() != null ? line.getSize().name() : null)
                .quantity(line.getQuantity())
                .sugarLevel(line.getSugarLevel())
                .iceLevel(line.getIceLevel())
                .temperature(line.getTemperature() != null ? line.getTemperature().name() : null)
                .toppingIds(line.getToppingIds())
                .basePrice(line.getBasePrice())
                .sizeAdjustment(line.getSizeAdjustment())
                .toppingCost(line.getToppingCost())
                .unitPrice(line.getUnitPrice())
                .lineSubtotal(line.getLineSubtotal())
                .available(line.isPriced())
                .createdAt(line.getCreatedAt())
                .build();
    }

    public CheckoutPreviewResponse toCheckoutPreviewResponse(CheckoutPreview preview) {
        return CheckoutPreviewResponse.builder()
                .cart(toCartResponse(preview.getCart()))
                .orderType(preview.getOrderType().name())
                .voucherCode(preview.getVoucherCode())
                .voucherApplied(preview.isVoucherApplied())
                .voucherRejectionReason(preview.getVoucherRejectionReason())
                .subtotal(preview.getCart().getSubtotal())
                .discountAmount(preview.getDiscountAmount())
                .deliveryFee(preview.getDeliveryFee())
                .totalAmount(preview.getTotalAmount())
                .estimatedReadyAt(preview.getEstimatedReadyAt())
                .build();
    }
}
