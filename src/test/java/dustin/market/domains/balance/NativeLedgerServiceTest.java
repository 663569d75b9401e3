package dustin.market.domains.balance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.market.config.TestConfig;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.support.MarketTestSupport;

/**
 * 네이티브 통화 원장 테스트
 * NativeLedgerService Test
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class NativeLedgerServiceTest extends MarketTestSupport {

    @Test
    @DisplayName("입금 → 예치금 수령 → 에스크로 지급")
    void collectAndTransfer() {
        fund("alice.near", 500);

        nativeLedgerService.collectDeposit(CallContext.of("alice.near", 300));
        assertThat(balance("alice.near")).isEqualByComparingTo("200");
        assertThat(balance(ESCROW)).isEqualByComparingTo("300");

        nativeLedgerService.transfer("bob.near", BigDecimal.valueOf(120));
        assertThat(balance("bob.near")).isEqualByComparingTo("120");
        assertThat(balance(ESCROW)).isEqualByComparingTo("180");
    }

    @Test
    @DisplayName("잔고보다 큰 예치금은 거부")
    void insufficientBalance() {
        fund("alice.near", 10);

        assertThatThrownBy(() -> nativeLedgerService.collectDeposit(CallContext.of("alice.near", 11)))
                .isInstanceOf(MarketException.class)
                .hasMessageStartingWith("Error: insufficient balance for attached deposit");
        assertThatThrownBy(() -> nativeLedgerService.collectDeposit(CallContext.of("nobody.near", 1)))
                .isInstanceOf(MarketException.class);
        assertThat(balance("alice.near")).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("에스크로 잔고를 넘는 지급은 불변식 위반")
    void escrowShortfall() {
        assertThatThrownBy(() -> nativeLedgerService.transfer("bob.near", BigDecimal.ONE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("정수가 아니거나 음수인 금액 거부, 0은 아무 일도 하지 않음")
    void amountValidation() {
        assertThatThrownBy(() -> nativeLedgerService.collectDeposit(CallContext.of("alice.near", new BigDecimal("1.5"))))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: attached deposit must be a whole number of units");
        assertThatThrownBy(() -> nativeLedgerService.fund("alice.near", BigDecimal.valueOf(-1)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: amount must not be negative");

        assertThat(nativeLedgerService.collectDeposit(CallContext.of("nobody.near"))).isEqualByComparingTo("0");
        nativeLedgerService.transfer("bob.near", BigDecimal.ZERO);
        assertThat(balance("bob.near")).isEqualByComparingTo("0");
    }
}
