package com.hhplus.coffeeshop.application.loyalty;

import com.hhplus.coffeeshop.application.loyalty.dto.LoyaltyAccountView;
import com.hhplus.coffeeshop.application.loyalty.dto.ReconciliationResult;
import com.hhplus.coffeeshop.domain.loyalty.InsufficientPointsException;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyCreditFailure;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyPolicy;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyRepository;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTier;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransaction;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransactionType;
import com.hhplus.coffeeshop.domain.user.User;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoyaltyService 단위 테스트")
class LoyaltyServiceTest {

    private static final Long USER_ID = 1L;
    private static final Long ORDER_ID = 77L;

    @Mock
    private UserRepository userRepository;

    @Mock
    private LoyaltyRepository loyaltyRepository;

    private LoyaltyService loyaltyService;
    private User user;

    @BeforeEach
    void setUp() {
        loyaltyService = new LoyaltyService(userRepository, loyaltyRepository,
                new LoyaltyPolicy(new BigDecimal("0.01"), 1_000L, 5_000L));
        user = User.createUser("user@example.com", "홍길동", "010-0000-0000");
    }

    @Nested
    @DisplayName("주문 적립")
    class CreditForOrder {

        @Test
        @DisplayName("결제 금액의 1%를 적립하고 원장에 EARN 거래를 남긴다")
        void creditsOnePercent() {
            when(loyaltyRepository.existsEarnForOrder(ORDER_ID)).thenReturn(false);
            when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));

            long points = loyaltyService.creditForOrder(USER_ID, ORDER_ID, "ORD-20250601-ABC123", 49_500L);

            assertThat(points).isEqualTo(495L);
            assertThat(user.getLoyalty().balance()).isEqualTo(495L);
            ArgumentCaptor<LoyaltyTransaction> tx = ArgumentCaptor.forClass(LoyaltyTransaction.class);
            verify(loyaltyRepository).saveTransaction(tx.capture());
            assertThat(tx.getValue().getType()).isEqualTo(LoyaltyTransactionType.EARN);
            assertThat(tx.getValue().getDelta()).isEqualTo(495L);
            assertThat(tx.getValue().getOrderId()).isEqualTo(ORDER_ID);
            assertThat(tx.getValue().getDescription()).contains("ORD-20250601-ABC123");
        }

        @Test
        @DisplayName("이미 적립된 주문은 다시 적립하지 않는다")
        void idempotentPerOrder() {
            when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));
            when(loyaltyRepository.existsEarnForOrder(ORDER_ID)).thenReturn(true);

            long points = loyaltyService.creditForOrder(USER_ID, ORDER_ID, "ORD-1", 49_500L);

            assertThat(points).isZero();
            assertThat(user.getLoyalty().balance()).isZero();
            verify(loyaltyRepository, never()).saveTransaction(any());
            verify(userRepository, never()).save(any());
        }

        @Test
        @DisplayName("중복 적립 확인은 사용자 행 락을 잡은 뒤에 한다")
        void checksDuplicateUnderUserLock() {
            when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));
            when(loyaltyRepository.existsEarnForOrder(ORDER_ID)).thenReturn(false);

            loyaltyService.creditForOrder(USER_ID, ORDER_ID, "ORD-1", 49_500L);

            InOrder inOrder = inOrder(userRepository, loyaltyRepository);
            inOrder.verify(userRepository).findByIdForUpdate(USER_ID);
            inOrder.verify(loyaltyRepository).existsEarnForOrder(ORDER_ID);
            inOrder.verify(loyaltyRepository).saveTransaction(any(LoyaltyTransaction.class));
        }

        @Test
        @DisplayName("적립 포인트가 0이면 락도 잡지 않고 거래를 남기지 않는다")
        void zeroPointsSkipped() {
            long points = loyaltyService.creditForOrder(USER_ID, ORDER_ID, "ORD-1", 99L);

            assertThat(points).isZero();
            verify(userRepository, never()).findByIdForUpdate(any());
            verify(loyaltyRepository, never()).saveTransaction(any());
        }
    }

    @Test
    @DisplayName("적립, 사용, 조정을 거친 잔액은 원장 delta 합계와 같다")
    void balanceEqualsLedgerSum() {
        when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));

        loyaltyService.credit(USER_ID, 495L, "주문 적립 #ORD-A", 10L);
        loyaltyService.credit(USER_ID, 1_200L, "주문 적립 #ORD-B", 11L);
        loyaltyService.debit(USER_ID, 300L, "음료 교환");
        loyaltyService.adjust(USER_ID, -150L, "오적립 정정", 900L);
        loyaltyService.adjust(USER_ID, 5_000L, "이벤트 보상", 900L);
        loyaltyService.debit(USER_ID, 45L, "토핑 교환");

        ArgumentCaptor<LoyaltyTransaction> tx = ArgumentCaptor.forClass(LoyaltyTransaction.class);
        verify(loyaltyRepository, times(6)).saveTransaction(tx.capture());
        long ledgerSum = tx.getAllValues().stream().mapToLong(LoyaltyTransaction::getDelta).sum();

        assertThat(ledgerSum).isEqualTo(6_200L);
        assertThat(user.getLoyalty().balance()).isEqualTo(ledgerSum);
        assertThat(tx.getAllValues()).extracting(LoyaltyTransaction::getType).containsExactly(
                LoyaltyTransactionType.EARN, LoyaltyTransactionType.EARN, LoyaltyTransactionType.REDEEM,
                LoyaltyTransactionType.ADMIN_ADJUSTMENT, LoyaltyTransactionType.ADMIN_ADJUSTMENT,
                LoyaltyTransactionType.REDEEM);
    }

    @Nested
    @DisplayName("잔액 변경 실패")
    class Rejections {

        @Test
        @DisplayName("잔액보다 많이 사용하면 InsufficientPointsException이며 원장에 기록되지 않는다")
        void debitInsufficient() {
            when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));

            assertThatThrownBy(() -> loyaltyService.debit(USER_ID, 100L, "음료 교환"))
                    .isInstanceOf(InsufficientPointsException.class);
            verify(loyaltyRepository, never()).saveTransaction(any());
        }
    }

    @Test
    @DisplayName("관리자 조정으로 등급이 오르면 tierChanged가 true")
    void adjustPromotesTier() {
        when(userRepository.findByIdForUpdate(USER_ID)).thenReturn(Optional.of(user));

        LoyaltyAccountView view = loyaltyService.adjust(USER_ID, 5_000L, "이벤트 보상", 900L);

        assertThat(view.getPointsBalance()).isEqualTo(5_000L);
        assertThat(view.getTier()).isEqualTo(LoyaltyTier.GOLD);
        assertThat(view.isTierChanged()).isTrue();
    }

    @Test
    @DisplayName("재처리는 성공한 건만 해결 처리하고 실패 건은 남긴다")
    void reconciliation() {
        LoyaltyService service = mock(LoyaltyService.class);
        LoyaltyCreditFailure ok = LoyaltyCreditFailure.of(USER_ID, 1L, "ORD-A", 10_000L, "timeout");
        LoyaltyCreditFailure stillBroken = LoyaltyCreditFailure.of(USER_ID, 2L, "ORD-B", 20_000L, "timeout");
        when(service.unresolvedFailures()).thenReturn(List.of(ok, stillBroken));
        lenient().doThrow(new QueryTimeoutException("timeout"))
                .when(service).creditForOrder(USER_ID, 2L, "ORD-B", 20_000L);

        ReconciliationResult result = new LoyaltyReconciliationService(service).retryFailedCredits();

        assertThat(result.getAttempted()).isEqualTo(2);
        assertThat(result.getResolved()).isEqualTo(1);
        assertThat(result.getStillFailing()).isEqualTo(1);
        verify(service).markFailureResolved(ok);
        verify(service, never()).markFailureResolved(stillBroken);
    }
}
