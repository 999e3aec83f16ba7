package com.hhplus.coffeeshop.integration;

import com.hhplus.coffeeshop.application.cart.CartService;
import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.cart.dto.CartSummary;
import com.hhplus.coffeeshop.application.loyalty.LoyaltyService;
import com.hhplus.coffeeshop.application.order.OrderService;
import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.domain.cart.EmptyCartException;
import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.order.MissingRequiredFieldException;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.PaymentMethod;
import com.hhplus.coffeeshop.domain.order.PaymentStatus;
import com.hhplus.coffeeshop.domain.product.CupSize;
import com.hhplus.coffeeshop.domain.product.Product;
import com.hhplus.coffeeshop.domain.product.ProductSizeOption;
import com.hhplus.coffeeshop.domain.product.Topping;
import com.hhplus.coffeeshop.domain.user.User;
import com.hhplus.coffeeshop.domain.voucher.DiscountType;
import com.hhplus.coffeeshop.domain.voucher.Voucher;
import com.hhplus.coffeeshop.infrastructure.persistence.product.ProductJpaRepository;
import com.hhplus.coffeeshop.infrastructure.persistence.product.ProductSizeOptionJpaRepository;
import com.hhplus.coffeeshop.infrastructure.persistence.product.ToppingJpaRepository;
import com.hhplus.coffeeshop.infrastructure.persistence.user.UserJpaRepository;
import com.hhplus.coffeeshop.infrastructure.persistence.voucher.VoucherJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("장바구니 → 주문 통합 테스트")
class OrderFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private LoyaltyService loyaltyService;

    @Autowired
    private UserJpaRepository userJpaRepository;

    @Autowired
    private ProductJpaRepository productJpaRepository;

    @Autowired
    private ProductSizeOptionJpaRepository productSizeOptionJpaRepository;

    @Autowired
    private ToppingJpaRepository toppingJpaRepository;

    @Autowired
    private VoucherJpaRepository voucherJpaRepository;

    private Long productId;
    private Long pearlId;

    @BeforeEach
    void setUp() {
        Product milkTea = productJpaRepository.save(Product.builder()
                .productName("밀크티")
                .basePrice(50_000L)
                .build());
        productId = milkTea.getProductId();
        productSizeOptionJpaRepository.save(ProductSizeOption.builder()
                .productId(productId).cupSize(CupSize.L).priceAdjustment(8_000L).build());
        pearlId = toppingJpaRepository.save(Topping.builder()
                .toppingName("펄")
                .price(5_000L)
                .build()).getToppingId();
    }

    private Long newUser(String email) {
        return userJpaRepository.save(User.createUser(email, "고객", "010-0000-0000")).getUserId();
    }

    private Voucher saveTenPercent(Integer usageLimit) {
        return voucherJpaRepository.save(Voucher.create("SAVE10", DiscountType.PERCENTAGE, BigDecimal.TEN,
                30_000L, null, usageLimit, 1,
                LocalDateTime.now().minusDays(1), LocalDateTime.now().plusDays(1)));
    }

    private AddCartItemCommand milkTeaWithPearl(int quantity) {
        return AddCartItemCommand.builder()
                .productId(productId)
                .size(CupSize.M)
                .quantity(quantity)
                .sugarLevel(50)
                .iceLevel(50)
                .temperature(Temperature.COLD)
                .toppingIds(List.of(pearlId))
                .build();
    }

    private CreateOrderCommand pickup(String voucherCode) {
        return CreateOrderCommand.builder()
                .orderType(OrderType.PICKUP)
                .paymentMethod(PaymentMethod.CARD)
                .storeId(1L)
                .voucherCode(voucherCode)
                .build();
    }

    @Test
    @DisplayName("바우처를 적용한 픽업 주문이 확정되고 장바구니가 비워진다")
    void placeOrderWithVoucher() {
        Long userId = newUser("order@coffee.test");
        saveTenPercent(null);
        cartService.addItem(userId, milkTeaWithPearl(1));

        OrderView order = orderService.createFromCart(userId, pickup(" save10 "));

        assertThat(order.getSubtotal()).isEqualTo(55_000L);
        assertThat(order.getDiscountAmount()).isEqualTo(5_500L);
        assertThat(order.getDeliveryFee()).isZero();
        assertThat(order.getTotalAmount()).isEqualTo(49_500L);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.getOrderNumber()).matches("ORD-\\d{8}-[A-Z0-9]{6}");
        assertThat(order.getLines()).hasSize(1);

        CartSummary cart = cartService.summary(userId);
        assertThat(cart.getLines()).isEmpty();

        // 포인트 적립은 주문 커밋 이후 반영된다
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(loyaltyService.account(userId).getPointsBalance()).isEqualTo(495L));
    }

    @Test
    @DisplayName("배달 주소가 없는 배달 주문은 거부되고 장바구니는 그대로 남는다")
    void rejectDeliveryWithoutAddress() {
        Long userId = newUser("delivery@coffee.test");
        cartService.addItem(userId, milkTeaWithPearl(2));

        CreateOrderCommand command = CreateOrderCommand.builder()
                .orderType(OrderType.DELIVERY)
                .paymentMethod(PaymentMethod.CASH)
                .build();

        assertThatThrownBy(() -> orderService.createFromCart(userId, command))
                .isInstanceOf(MissingRequiredFieldException.class);

        CartSummary cart = cartService.summary(userId);
        assertThat(cart.getLines()).hasSize(1);
        assertThat(cart.getItemCount()).isEqualTo(2);
        assertThat(orderService.getForUser(userId)).isEmpty();
    }

    @Test
    @DisplayName("사용 한도 1인 바우처는 동시에 주문해도 한 건에만 할인된다")
    void voucherUsageLimitUnderConcurrency() throws InterruptedException {
        Voucher voucher = saveTenPercent(1);
        int threads = 5;
        Long[] userIds = new Long[threads];
        for (int i = 0; i < threads; i++) {
            userIds[i] = newUser("concurrent" + i + "@coffee.test");
            cartService.addItem(userIds[i], milkTeaWithPearl(1));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger discounted = new AtomicInteger();
        AtomicInteger placed = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            Long userId = userIds[i];
            executor.submit(() -> {
                try {
                    start.await();
                    OrderView order = orderService.createFromCart(userId, pickup("SAVE10"));
                    placed.incrementAndGet();
                    if (order.getDiscountAmount() > 0) {
                        discounted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
                return null;
            });
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(placed.get()).isEqualTo(threads);
        assertThat(discounted.get()).isEqualTo(1);
        assertThat(voucherJpaRepository.findById(voucher.getVoucherId()).orElseThrow().getCurrentUsage()).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 옵션을 동시에 담아도 한 항목으로 합쳐진다")
    void concurrentAddMerges() throws InterruptedException {
        Long userId = newUser("merge@coffee.test");
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    cartService.addItem(userId, milkTeaWithPearl(1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
                return null;
            });
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        CartSummary cart = cartService.summary(userId);
        assertThat(cart.getLines()).hasSize(1);
        assertThat(cart.getLines().get(0).getQuantity()).isEqualTo(threads);
        assertThat(cart.getSubtotal()).isEqualTo(55_000L * threads);
    }

    @Test
    @DisplayName("같은 장바구니로 동시에 주문하면 한 건만 생성되고 나머지는 빈 장바구니로 거부된다")
    void concurrentCheckoutCreatesSingleOrder() throws InterruptedException {
        Long userId = newUser("double@coffee.test");
        cartService.addItem(userId, milkTeaWithPearl(2));

        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger placed = new AtomicInteger();
        AtomicInteger emptyCart = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    orderService.createFromCart(userId, pickup(null));
                    placed.incrementAndGet();
                } catch (EmptyCartException e) {
                    emptyCart.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
                return null;
            });
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(placed.get()).isEqualTo(1);
        assertThat(emptyCart.get()).isEqualTo(1);
        assertThat(orderService.getForUser(userId)).hasSize(1);
        assertThat(cartService.summary(userId).getLines()).isEmpty();
    }

    @Test
    @DisplayName("주문 중에 담은 항목은 주문에 포함되거나 장바구니에 남고 사라지지 않는다")
    void itemAddedDuringCheckoutIsNotLost() throws InterruptedException {
        Long userId = newUser("race@coffee.test");
        cartService.addItem(userId, milkTeaWithPearl(1));
        AddCartItemCommand large = AddCartItemCommand.builder()
                .productId(productId)
                .size(CupSize.L)
                .quantity(1)
                .sugarLevel(50)
                .iceLevel(50)
                .temperature(Temperature.COLD)
                .build();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);

        executor.submit(() -> {
            try {
                start.await();
                orderService.createFromCart(userId, pickup(null));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
            return null;
        });
        executor.submit(() -> {
            try {
                start.await();
                cartService.addItem(userId, large);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
            return null;
        });
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        List<OrderView> orders = orderService.getForUser(userId);
        assertThat(orders).hasSize(1);
        int orderedLines = orders.get(0).getLines().size();
        int remainingLines = cartService.summary(userId).getLines().size();
        assertThat(orderedLines + remainingLines).isEqualTo(2);
    }
}
