package com.hhplus.coffeeshop.application.cart;

import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.cart.dto.CartItemPatch;
import com.hhplus.coffeeshop.application.cart.dto.CartLineView;
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
import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.order.DeliveryFeePolicy;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.ReadyTimeEstimator;
import com.hhplus.coffeeshop.domain.product.CupSize;
import com.hhplus.coffeeshop.domain.product.PriceBreakdown;
import com.hhplus.coffeeshop.domain.product.ProductNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CartService 단위 테스트
 *
 * - 동일 옵션 병합 / 수량 범위 / 알 수 없는 토핑 제거
 * - 수량 0 이하 수정 시 삭제
 * - 부분 수정 / 수정 결과 병합
 * - 결제 전 미리보기 금액 계산
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long USER_ID = 1L;
    private static final Long PRODUCT_ID = 100L;
    private static final Long PEARL_ID = 10L;

    @Mock
    private CartRepository cartRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PricingService pricingService;

    @Mock
    private VoucherService voucherService;

    private CartService cartService;

    @BeforeEach
    void setUp() {
        CommerceProperties properties = new CommerceProperties();
        cartService = new CartService(cartRepository, userRepository, pricingService, voucherService,
                new DeliveryFeePolicy(200_000L, 20_000L, 5),
                new ReadyTimeEstimator(15, 3, 5, 30, 0),
                properties);
    }

    private PriceBreakdown milkTeaWithPearl() {
        return PriceBreakdown.builder()
                .productId(PRODUCT_ID)
                .productName("밀크티")
                .basePrice(50_000L)
                .sizeAdjustment(0L)
                .toppingCost(5_000L)
                .total(55_000L)
                .pricedToppingIds(Set.of(PEARL_ID))
                .build();
    }

    private AddCartItemCommand addCommand(int quantity, List<Long> toppingIds) {
        return AddCartItemCommand.builder()
                .productId(PRODUCT_ID)
                .quantity(quantity)
                .toppingIds(toppingIds)
                .build();
    }

    private CartLine savedLine(Long cartLineId, int sugarLevel, int quantity) {
        CartCustomization customization = CartCustomization.of(CupSize.M, sugarLevel, 50, Temperature.COLD, List.of(PEARL_ID));
        return CartLine.builder()
                .cartLineId(cartLineId)
                .userId(USER_ID)
                .productId(PRODUCT_ID)
                .size(customization.getSize())
                .quantity(quantity)
                .sugarLevel(customization.getSugarLevel())
                .iceLevel(customization.getIceLevel())
                .temperature(customization.getTemperature())
                .toppingIds(new TreeSet<>(customization.getToppingIds()))
                .build();
    }

    @Nested
    @DisplayName("장바구니 담기")
    class AddItem {

        @Test
        @DisplayName("새 옵션 조합이면 새 항목을 만들고 알 수 없는 토핑은 저장하지 않는다")
        void createsNewLine() {
            when(userRepository.existsById(USER_ID)).thenReturn(true);
            when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection())).thenReturn(milkTeaWithPearl());
            when(cartRepository.findByUserIdAndProductId(USER_ID, PRODUCT_ID)).thenReturn(List.of());
            when(cartRepository.save(any(CartLine.class))).thenAnswer(invocation -> invocation.getArgument(0));

            CartLineView result = cartService.addItem(USER_ID, addCommand(2, List.of(PEARL_ID, 999L)));

            assertThat(result.getQuantity()).isEqualTo(2);
            assertThat(result.getToppingIds()).containsExactly(PEARL_ID);
            assertThat(result.getUnitPrice()).isEqualTo(55_000L);
            assertThat(result.getLineSubtotal()).isEqualTo(110_000L);
        }

        @Test
        @DisplayName("같은 옵션 조합이 이미 있으면 수량을 누적한다")
        void mergesSameIdentity() {
            CartLine existing = CartLine.create(USER_ID, PRODUCT_ID,
                    CartCustomization.of(null, null, null, null, List.of(PEARL_ID)), 3);
            when(userRepository.existsById(USER_ID)).thenReturn(true);
            when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection())).thenReturn(milkTeaWithPearl());
            when(cartRepository.findByUserIdAndProductId(USER_ID, PRODUCT_ID)).thenReturn(List.of(existing));
            when(cartRepository.save(existing)).thenReturn(existing);

            CartLineView result = cartService.addItem(USER_ID, addCommand(2, List.of(PEARL_ID)));

            assertThat(result.getQuantity()).isEqualTo(5);
            verify(cartRepository).save(existing);
        }

        @Test
        @DisplayName("최대 수량을 넘으면 가격 조회 전에 거부한다")
        void rejectsQuantityOverMax() {
            when(userRepository.existsById(USER_ID)).thenReturn(true);

            assertThatThrownBy(() -> cartService.addItem(USER_ID, addCommand(101, null)))
                    .isInstanceOf(InvalidQuantityException.class);
            verify(pricingService, never()).quote(any(), any(), any());
        }

        @Test
        @DisplayName("가격을 산정할 수 없는 상품은 담을 수 없다")
        void rejectsUnknownProduct() {
            when(userRepository.existsById(USER_ID)).thenReturn(true);
            when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection()))
                    .thenReturn(PriceBreakdown.notFound(PRODUCT_ID));

            assertThatThrownBy(() -> cartService.addItem(USER_ID, addCommand(1, null)))
                    .isInstanceOf(ProductNotFoundException.class);
            verify(cartRepository, never()).save(any());
        }

        @Test
        @DisplayName("존재하지 않는 사용자는 담을 수 없다")
        void rejectsUnknownUser() {
            when(userRepository.existsById(USER_ID)).thenReturn(false);

            assertThatThrownBy(() -> cartService.addItem(USER_ID, addCommand(1, null)))
                    .isInstanceOf(UserNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("수량 변경")
    class UpdateQuantity {

        @Test
        @DisplayName("0 이하로 변경하면 항목을 삭제한다")
        void deletesOnZero() {
            CartLine line = CartLine.create(USER_ID, PRODUCT_ID, CartCustomization.of(null, null, null, null, null), 2);
            when(cartRepository.findById(7L)).thenReturn(Optional.of(line));

            Optional<CartLineView> result = cartService.updateQuantity(USER_ID, 7L, 0);

            assertThat(result).isEmpty();
            verify(cartRepository).delete(line);
        }

        @Test
        @DisplayName("다른 사용자의 항목은 찾을 수 없는 항목으로 처리한다")
        void otherUsersLine() {
            CartLine line = CartLine.create(2L, PRODUCT_ID, CartCustomization.of(null, null, null, null, null), 2);
            when(cartRepository.findById(7L)).thenReturn(Optional.of(line));

            assertThatThrownBy(() -> cartService.updateQuantity(USER_ID, 7L, 3))
                    .isInstanceOf(CartLineNotFoundException.class);
            verify(cartRepository, never()).delete(any());
        }
    }

    @Nested
    @DisplayName("부분 수정")
    class UpdateItem {

        @Test
        @DisplayName("지정한 필드만 바꾸고 나머지 옵션과 수량은 유지한다")
        void patchesOnlyGivenFields() {
            CartLine line = savedLine(7L, 50, 2);
            when(cartRepository.findById(7L)).thenReturn(Optional.of(line));
            when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection())).thenReturn(milkTeaWithPearl());
            when(cartRepository.findByUserIdAndProductId(USER_ID, PRODUCT_ID)).thenReturn(List.of(line));
            when(cartRepository.save(line)).thenReturn(line);

            Optional<CartLineView> result = cartService.updateItem(USER_ID, 7L, CartItemPatch.builder()
                    .sugarLevel(Optional.of(30))
                    .build());

            assertThat(result).isPresent();
            CartLineView view = result.get();
            assertThat(view.getSugarLevel()).isEqualTo(30);
            assertThat(view.getIceLevel()).isEqualTo(50);
            assertThat(view.getSize()).isEqualTo(CupSize.M);
            assertThat(view.getTemperature()).isEqualTo(Temperature.COLD);
            assertThat(view.getToppingIds()).containsExactly(PEARL_ID);
            assertThat(view.getQuantity()).isEqualTo(2);
            verify(cartRepository, never()).delete(any());
        }

        @Test
        @DisplayName("수량을 0으로 수정하면 가격 조회 없이 항목을 삭제한다")
        void deletesOnZeroQuantity() {
            CartLine line = savedLine(7L, 50, 2);
            when(cartRepository.findById(7L)).thenReturn(Optional.of(line));

            Optional<CartLineView> result = cartService.updateItem(USER_ID, 7L, CartItemPatch.builder()
                    .quantity(Optional.of(0))
                    .sugarLevel(Optional.of(30))
                    .build());

            assertThat(result).isEmpty();
            verify(cartRepository).delete(line);
            verify(pricingService, never()).quote(any(), any(), any());
        }

        @Test
        @DisplayName("수정 결과가 다른 항목과 같은 옵션이 되면 수량을 합치고 원래 항목을 삭제한다")
        void mergesIntoCollidingLine() {
            CartLine source = savedLine(7L, 30, 2);
            CartLine target = savedLine(8L, 50, 3);
            when(cartRepository.findById(7L)).thenReturn(Optional.of(source));
            when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection())).thenReturn(milkTeaWithPearl());
            when(cartRepository.findByUserIdAndProductId(USER_ID, PRODUCT_ID)).thenReturn(List.of(source, target));
            when(cartRepository.save(target)).thenReturn(target);

            Optional<CartLineView> result = cartService.updateItem(USER_ID, 7L, CartItemPatch.builder()
                    .sugarLevel(Optional.of(50))
                    .build());

            assertThat(result).isPresent();
            assertThat(result.get().getCartLineId()).isEqualTo(8L);
            assertThat(result.get().getQuantity()).isEqualTo(5);
            verify(cartRepository).delete(source);
            verify(cartRepository, never()).save(source);
        }
    }

    @Test
    @DisplayName("미리보기는 바우처 할인과 배달비를 반영하고 상태를 바꾸지 않는다")
    void previewWithVoucher() {
        CartLine line = CartLine.create(USER_ID, PRODUCT_ID,
                CartCustomization.of(null, null, null, null, List.of(PEARL_ID)), 1);
        when(userRepository.existsById(USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(USER_ID)).thenReturn(List.of(line));
        when(pricingService.quote(eq(PRODUCT_ID), eq(CupSize.M), anyCollection())).thenReturn(milkTeaWithPearl());
        when(voucherService.check(USER_ID, "save10", 55_000L)).thenReturn(VoucherCheckResult.builder()
                .code("SAVE10").ok(true).subtotal(55_000L).discountAmount(5_500L).build());

        CheckoutPreview preview = cartService.preview(USER_ID, "save10", OrderType.DELIVERY);

        assertThat(preview.isVoucherApplied()).isTrue();
        assertThat(preview.getDiscountAmount()).isEqualTo(5_500L);
        assertThat(preview.getDeliveryFee()).isEqualTo(30_000L);
        assertThat(preview.getTotalAmount()).isEqualTo(79_500L);
        verify(cartRepository, never()).save(any());
    }
}
