package com.hhplus.coffeeshop.application.cart;

import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.cart.dto.CartItemPatch;
import com.hhplus.coffeeshop.application.cart.dto.CartLineView;
import com.hhplus.coffeeshop.application.cart.dto.CartSummary;
import com.hhplus.coffeeshop.application.cart.dto.CheckoutPreview;
import com.hhplus.coffeeshop.application.catalog.PricingService;
import com.hhplus.coffeeshop.application.voucher.VoucherService;
import com.hhplus.coffeeshop.application.voucher.dto.VoucherCheckResult;
import com.hhplus.coffeeshop.config.CommerceProperties;
import com.hhplus.coffeeshop.domain.cart.CartCustomization;
import com.hhplus.coffeeshop.domain.cart.CartLine;
import com.hhplus.coffeeshop.domain.cart.CartLineNotFoundException;
import com.hhplus.coffeeshop.domain.cart.CartRepository;
import com.hhplus.coffeeshop.domain.cart.InvalidQuantityException;
import com.hhplus.coffeeshop.domain.order.DeliveryFeePolicy;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.ReadyTimeEstimator;
import com.hhplus.coffeeshop.domain.product.PriceBreakdown;
import com.hhplus.coffeeshop.domain.product.ProductNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import com.hhplus.coffeeshop.infrastructure.lock.DistributedLock;
import com.hhplus.coffeeshop.infrastructure.lock.LockKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartService - 장바구니 (Application 계층)
 *
 * 핵심 비즈니스 규칙:
 * - 동일 옵션 조합(사용자, 상품, 사이즈, 당도, 얼음, 온도, 토핑 집합)은 한 항목으로 병합되어 수량이 누적
 * - 수량은 1 ~ 최대 수량(기본 100), 0 이하로 수정하면 항목 삭제
 * - 다른 사용자의 항목은 존재하지 않는 항목으로 취급
 * - 알 수 없는 토핑은 저장하지 않음
 *
 * 동시성 제어:
 * - addItem / updateItem: 사용자 단위 분산락 (cart:{userId})
 *   같은 옵션을 동시에 담아도 수량 증가가 유실되지 않음
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final UserRepository userRepository;
    private final PricingService pricingService;
    private final VoucherService voucherService;
    private final DeliveryFeePolicy deliveryFeePolicy;
    private final ReadyTimeEstimator readyTimeEstimator;
    private final CommerceProperties properties;

    public CartService(CartRepository cartRepository,
                       UserRepository userRepository,
                       PricingService pricingService,
                       VoucherService voucherService,
                       DeliveryFeePolicy deliveryFeePolicy,
                       ReadyTimeEstimator readyTimeEstimator,
                       CommerceProperties properties) {
        this.cartRepository = cartRepository;
        this.userRepository = userRepository;
        this.pricingService = pricingService;
        this.voucherService = voucherService;
        this.deliveryFeePolicy = deliveryFeePolicy;
        this.readyTimeEstimator = readyTimeEstimator;
        this.properties = properties;
    }

    // ========== 담기 / 수정 ==========

    /**
     * 장바구니 담기
     *
     * 동일 옵션 조합의 항목이 있으면 수량을 더하고, 없으면 새 항목을 만듭니다.
     *
     * @throws InvalidQuantityException 수량이 1 ~ 최대 수량 범위를 벗어난 경우
     * @throws ProductNotFoundException 가격을 산정할 수 없는 상품
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    @Transactional
    public CartLineView addItem(Long userId, AddCartItemCommand command) {
        ensureUserExists(userId);
        validateQuantity(command.getQuantity());

        CartCustomization requested = CartCustomization.of(
                command.getSize(),
                command.getSugarLevel(),
                command.getIceLevel(),
                command.getTemperature(),
                command.getToppingIds()
        );
        PriceBreakdown price = priceOrThrow(command.getProductId(), requested);
        CartCustomization customization = requested.withToppings(price.getPricedToppingIds());

        Optional<CartLine> existing = findSameIdentity(userId, command.getProductId(), customization, null);
        CartLine line;
        if (existing.isPresent()) {
            line = existing.get();
            line.increaseQuantity(command.getQuantity());
            log.info("[CartService] 동일 옵션 병합 - userId={}, cartLineId={}, quantity={}",
                    userId, line.getCartLineId(), line.getQuantity());
        } else {
            line = CartLine.create(userId, command.getProductId(), customization, command.getQuantity());
            log.info("[CartService] 장바구니 담기 - userId={}, productId={}, quantity={}",
                    userId, command.getProductId(), command.getQuantity());
        }

        return CartLineView.of(cartRepository.save(line), price);
    }

    /**
     * 수량 변경 (0 이하면 삭제)
     *
     * @return 변경된 항목, 삭제된 경우 empty
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    @Transactional
    public Optional<CartLineView> updateQuantity(Long userId, Long cartLineId, Integer quantity) {
        CartLine line = findOwnedLine(userId, cartLineId);
        if (quantity == null) {
            throw new InvalidQuantityException(null, properties.getCart().getMaxQuantity());
        }
        if (quantity <= 0) {
            cartRepository.delete(line);
            log.info("[CartService] 수량 0 이하로 항목 삭제 - userId={}, cartLineId={}", userId, cartLineId);
            return Optional.empty();
        }
        validateQuantity(quantity);
        line.changeQuantity(quantity);
        CartLine saved = cartRepository.save(line);
        return Optional.of(CartLineView.of(saved, priceOf(saved)));
    }

    /**
     * 부분 수정 (옵션 + 수량)
     *
     * 수정 결과가 다른 항목과 같은 옵션 조합이 되면 두 항목을 병합합니다.
     *
     * @return 수정(또는 병합)된 항목, 삭제된 경우 empty
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    @Transactional
    public Optional<CartLineView> updateItem(Long userId, Long cartLineId, CartItemPatch patch) {
        CartLine line = findOwnedLine(userId, cartLineId);

        Optional<Integer> patchedQuantity = patch.getQuantity();
        if (patchedQuantity.isPresent() && patchedQuantity.get() <= 0) {
            cartRepository.delete(line);
            log.info("[CartService] 수량 0 이하로 항목 삭제 - userId={}, cartLineId={}", userId, cartLineId);
            return Optional.empty();
        }
        int quantity = patchedQuantity.orElse(line.getQuantity());
        validateQuantity(quantity);

        CartCustomization current = line.customization();
        CartCustomization requested = CartCustomization.of(
                patch.getSize().orElse(current.getSize()),
                patch.getSugarLevel().orElse(current.getSugarLevel()),
                patch.getIceLevel().orElse(current.getIceLevel()),
                patch.getTemperature().orElse(current.getTemperature()),
                patch.getToppingIds().isPresent() ? patch.getToppingIds().get() : current.getToppingIds()
        );
        PriceBreakdown price = priceOrThrow(line.getProductId(), requested);
        CartCustomization customization = requested.withToppings(price.getPricedToppingIds());

        Optional<CartLine> collision = findSameIdentity(userId, line.getProductId(), customization, cartLineId);
        if (collision.isPresent()) {
            CartLine target = collision.get();
            target.increaseQuantity(quantity);
            cartRepository.delete(line);
            log.info("[CartService] 수정 결과 병합 - userId={}, from={}, into={}, quantity={}",
                    userId, cartLineId, target.getCartLineId(), target.getQuantity());
            return Optional.of(CartLineView.of(cartRepository.save(target), price));
        }

        line.changeCustomization(customization);
        line.changeQuantity(quantity);
        return Optional.of(CartLineView.of(cartRepository.save(line), price));
    }

    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    @Transactional
    public void removeItem(Long userId, Long cartLineId) {
        CartLine line = findOwnedLine(userId, cartLineId);
        cartRepository.delete(line);
        log.info("[CartService] 항목 삭제 - userId={}, cartLineId={}", userId, cartLineId);
    }

    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    @Transactional
    public void clear(Long userId) {
        cartRepository.deleteAllByUserId(userId);
        log.info("[CartService] 장바구니 비우기 - userId={}", userId);
    }

    // ========== 조회 ==========

    /**
     * 장바구니 요약 (항목별 단가/소계 + 합계)
     */
    @Transactional(readOnly = true)
    public CartSummary summary(Long userId) {
        ensureUserExists(userId);
        List<CartLineView> lines = cartRepository.findByUserId(userId).stream()
                .map(line -> CartLineView.of(line, priceOf(line)))
                .collect(Collectors.toList());

        return CartSummary.builder()
                .userId(userId)
                .lines(lines)
                .subtotal(lines.stream().mapToLong(CartLineView::getLineSubtotal).sum())
                .itemCount(lines.stream().mapToInt(CartLineView::getQuantity).sum())
                .build();
    }

    /**
     * 수량 합계
     */
    @Transactional(readOnly = true)
    public int count(Long userId) {
        return cartRepository.sumQuantityByUserId(userId);
    }

    /**
     * 결제 전 미리보기 (상태 변경 없음)
     */
    @Transactional(readOnly = true)
    public CheckoutPreview preview(Long userId, String voucherCode, OrderType orderType) {
        CartSummary cart = summary(userId);
        OrderType type = orderType != null ? orderType : OrderType.PICKUP;

        long discount = 0L;
        boolean applied = false;
        String rejectionReason = null;
        if (voucherCode != null && !voucherCode.isBlank() && !cart.isEmpty()) {
            VoucherCheckResult check = voucherService.check(userId, voucherCode, cart.getSubtotal());
            applied = check.isOk();
            discount = check.getDiscountAmount();
            rejectionReason = check.getReason();
        }
        long deliveryFee = cart.isEmpty() ? 0L : deliveryFeePolicy.feeFor(type, cart.getSubtotal());

        return CheckoutPreview.builder()
                .cart(cart)
                .orderType(type)
                .voucherCode(voucherCode)
                .voucherApplied(applied)
                .voucherRejectionReason(rejectionReason)
                .discountAmount(discount)
                .deliveryFee(deliveryFee)
                .totalAmount(cart.getSubtotal() - discount + deliveryFee)
                .estimatedReadyAt(readyTimeEstimator.estimate(type, cart.getItemCount(), LocalDateTime.now()))
                .build();
    }

    // ========== 내부 ==========

    private void ensureUserExists(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }

    private void validateQuantity(Integer quantity) {
        int max = properties.getCart().getMaxQuantity();
        if (quantity == null || quantity < 1 || quantity > max) {
            throw new InvalidQuantityException(quantity, max);
        }
    }

    /**
     * 본인 소유 항목 조회 (다른 사용자의 항목은 찾을 수 없음으로 처리)
     */
    private CartLine findOwnedLine(Long userId, Long cartLineId) {
        return cartRepository.findById(cartLineId)
                .filter(line -> line.isOwnedBy(userId))
                .orElseThrow(() -> new CartLineNotFoundException(cartLineId));
    }

    private Optional<CartLine> findSameIdentity(Long userId, Long productId, CartCustomization customization, Long excludeId) {
        return cartRepository.findByUserIdAndProductId(userId, productId).stream()
                .filter(line -> excludeId == null || !excludeId.equals(line.getCartLineId()))
                .filter(line -> line.hasSameIdentity(userId, productId, customization))
                .findFirst();
    }

    private PriceBreakdown priceOrThrow(Long productId, CartCustomization customization) {
        PriceBreakdown price = pricingService.quote(productId, customization.getSize(), customization.getToppingIds());
        if (price.isNotFound()) {
            throw new ProductNotFoundException(productId);
        }
        return price;
    }

    private PriceBreakdown priceOf(CartLine line) {
        return pricingService.quote(line.getProductId(), line.getSize(), line.getToppingIds());
    }
}
