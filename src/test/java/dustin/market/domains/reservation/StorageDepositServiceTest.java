package dustin.market.domains.reservation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.market.config.TestConfig;
import dustin.market.domains.reservation.model.dto.StorageBalanceResponse;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.support.MarketTestSupport;

/**
 * 스토리지 예치금 서비스 테스트
 * StorageDepositService Test
 *
 * 목적:
 * - 예치 최소 금액 (단가 1개분), 다른 계정 대신 예치
 * - 인출은 활성 예약에 필요한 금액을 남김
 * - 잔고가 필요 금액보다 적으면 인출 거부
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class StorageDepositServiceTest extends MarketTestSupport {

    private static final String ALICE = "alice.near";

    @BeforeEach
    void fundAlice() {
        fund(ALICE, 10_000);
    }

    @Test
    @DisplayName("단가보다 적은 예치는 거부")
    void minimumDeposit() {
        assertThat(storageDepositService.minimumBalance()).isEqualByComparingTo("1000");

        assertThatThrownBy(() -> storageDepositService.deposit(CallContext.of(ALICE, 999), null))
                .isInstanceOf(MarketException.class)
                .hasMessage("Requires minimum deposit of 1000");
        assertThat(balance(ALICE)).isEqualByComparingTo("10000");
    }

    @Test
    @DisplayName("예치금은 누적되고 다른 계정에 대신 예치할 수 있음")
    void depositForAnotherAccount() {
        storageDepositService.deposit(CallContext.of(ALICE, 1_000), null);
        StorageBalanceResponse bob = storageDepositService.deposit(CallContext.of(ALICE, 1_500), "bob.near");

        assertThat(bob.getAccountId()).isEqualTo("bob.near");
        assertThat(bob.getBalance()).isEqualByComparingTo("1500");
        assertThat(storageDepositService.storageBalance(ALICE)).isEqualByComparingTo("1000");
        assertThat(balance(ALICE)).isEqualByComparingTo("7500");
        assertThat(balance(ESCROW)).isEqualByComparingTo("2500");
    }

    @Test
    @DisplayName("인출은 활성 예약분을 남기고 나머지를 돌려줌")
    void withdrawKeepsRequired() {
        storageDepositService.deposit(CallContext.of(ALICE, 3_000), null);
        listFixedPrice(ALICE, "token-1", 100);

        StorageBalanceResponse after = storageDepositService.withdraw(CallContext.of(ALICE, 1));

        assertThat(after.getBalance()).isEqualByComparingTo("1000");
        assertThat(after.getSupply()).isEqualTo(1L);
        assertThat(after.getRequired()).isEqualByComparingTo("1000");
        assertThat(balance(ALICE)).isEqualByComparingTo("8999");
    }

    @Test
    @DisplayName("예약이 없으면 전액 인출")
    void withdrawAll() {
        storageDepositService.deposit(CallContext.of(ALICE, 2_000), null);

        StorageBalanceResponse after = storageDepositService.withdraw(CallContext.of(ALICE, 1));

        assertThat(after.getBalance()).isEqualByComparingTo("0");
        assertThat(balance(ALICE)).isEqualByComparingTo("9999");
    }

    @Test
    @DisplayName("잔고가 필요 금액보다 적으면 인출 거부")
    void withdrawBelowRequiredRejected() {
        storageDepositService.deposit(CallContext.of(ALICE, 1_000), null);
        listFixedPrice(ALICE, "token-1", 100);
        listFixedPrice(ALICE, "token-2", 100);

        assertThatThrownBy(() -> storageDepositService.withdraw(CallContext.of(ALICE, 1)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: storage balance 1000 is lower than required 2000");
        assertThat(storageDepositService.storageBalance(ALICE)).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("인출은 정확히 1단위 예치금 필요")
    void withdrawRequiresOneUnit() {
        assertThatThrownBy(() -> storageDepositService.withdraw(CallContext.of(ALICE, 0)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: requires attached deposit of exactly 1 unit");
    }

    @Test
    @DisplayName("예약 하나 더 만들 수 있는지 확인")
    void quota() {
        storageDepositService.deposit(CallContext.of(ALICE, 1_000), null);
        storageDepositService.requireQuotaForOneMore(ALICE, "listing");

        listFixedPrice(ALICE, "token-1", 100);

        assertThatThrownBy(() -> storageDepositService.requireQuotaForOneMore(ALICE, "listing"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Insufficient storage paid: 1000, for 2 listing at 1000 rate of per listing");
    }
}
