package dustin.market.domains.callback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.market.config.TestConfig;
import dustin.market.domains.callback.model.dto.ApprovalResult;
import dustin.market.domains.callback.service.ApprovalCallbackService;
import dustin.market.domains.offer.service.OfferService;
import dustin.market.domains.settlement.service.SettlementService;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.ErrorCode;
import dustin.market.shared.exception.MarketException;
import dustin.market.support.MarketTestSupport;

/**
 * 레지스트리 승인 콜백 테스트
 * ApprovalCallbackService Test
 *
 * 목적:
 * - sale 메시지 → 리스팅 생성 (스토리지 예치 필요)
 * - accept_offer 메시지 → 오퍼 수락 + 정산 예약
 * - 승인되지 않은 레지스트리, 잘못된 메시지 거부
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class ApprovalCallbackServiceTest extends MarketTestSupport {

    private static final String SELLER = "alice.near";

    @Autowired
    private ApprovalCallbackService approvalCallbackService;

    @Autowired
    private OfferService offerService;

    @Autowired
    private SettlementService settlementService;

    private ApprovalResult approve(String registryId, String assetId, String msg) {
        return approvalCallbackService.onApprove(CallContext.of(registryId), assetId, SELLER, 3L, msg);
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    @Test
    @DisplayName("sale: 고정가 리스팅 생성, 승인 ID 보관")
    void saleCreatesListing() {
        payStorage(SELLER, 1);

        ApprovalResult result = approve(REGISTRY, "token-1",
                "{\"market_type\":\"sale\",\"price\":\"1000\",\"ft_token_id\":\"near\"}");

        assertThat(result.getMarketType()).isEqualTo("sale");
        assertThat(result.getListing().getPrice()).isEqualByComparingTo("1000");
        assertThat(result.getListing().getApprovalId()).isEqualTo(3L);
        assertThat(result.getListing().getRegistryId()).isEqualTo(REGISTRY);
        assertThat(listingService.get(REGISTRY, "token-1").getOwnerId()).isEqualTo(SELLER);
    }

    @Test
    @DisplayName("sale: 경매 + 시간 창 (epoch 나노초)")
    void saleAuctionWithWindow() {
        payStorage(SELLER, 1);
        Instant start = now().plus(Duration.ofHours(1));
        Instant end = now().plus(Duration.ofDays(1));

        ApprovalResult result = approve(REGISTRY, "token-1",
                "{\"market_type\":\"sale\",\"price\":100,\"is_auction\":true,"
                        + "\"started_at\":\"" + nanos(start) + "\",\"ended_at\":" + nanos(end) + "}");

        assertThat(result.getListing().getIsAuction()).isTrue();
        assertThat(result.getListing().getCurrencyId()).isEqualTo(NATIVE);
        assertThat(result.getListing().getStartedAt()).isEqualTo(start);
        assertThat(result.getListing().getEndedAt()).isEqualTo(end);
    }

    @Test
    @DisplayName("sale: 스토리지 예치가 부족하면 거부")
    void saleRequiresStorage() {
        assertThatThrownBy(() -> approve(REGISTRY, "token-1", "{\"market_type\":\"sale\",\"price\":\"1000\"}"))
                .isInstanceOf(MarketException.class)
                .hasMessageStartingWith("Insufficient storage paid: 0, for 1 listing");
        assertThat(listingService.listByOwner(SELLER)).isEmpty();
    }

    @Test
    @DisplayName("sale: 승인되지 않은 통화 거부")
    void saleRejectsUnapprovedCurrency() {
        payStorage(SELLER, 1);

        assertThatThrownBy(() -> approve(REGISTRY, "token-1",
                "{\"market_type\":\"sale\",\"price\":\"1000\",\"ft_token_id\":\"usdc.near\"}"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: ft_token_id is not approved");
    }

    @Test
    @DisplayName("accept_offer: 오퍼 수락 후 정산 예약")
    void acceptOffer() {
        fund("bob.near", 1_000);
        payStorage("bob.near", 1);
        offerService.makeOffer(CallContext.of("bob.near", 1_000), REGISTRY, "token-1", NATIVE, amount(1_000));

        ApprovalResult result = approve(REGISTRY, "token-1",
                "{\"market_type\":\"accept_offer\",\"buyer_id\":\"bob.near\",\"price\":\"1000\"}");

        assertThat(result.getMarketType()).isEqualTo("accept_offer");
        assertThat(result.getSettlementId()).isNotNull();
        assertThat(offerService.listByBuyer("bob.near")).isEmpty();

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(settlementService.get(result.getSettlementId()).getStatus()).isEqualTo("RESOLVED_PAID"));
        assertThat(balance(SELLER)).isEqualByComparingTo("980");
        assertThat(registry.requests().get(0).getApprovalId()).isEqualTo(3L);
    }

    @Test
    @DisplayName("accept_offer: 오퍼가 없으면 NOT_FOUND")
    void acceptMissingOffer() {
        assertThatThrownBy(() -> approve(REGISTRY, "token-1",
                "{\"market_type\":\"accept_offer\",\"buyer_id\":\"bob.near\",\"price\":\"1000\"}"))
                .isInstanceOfSatisfying(MarketException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }

    @Test
    @DisplayName("승인되지 않은 레지스트리의 콜백은 거부")
    void unapprovedRegistry() {
        payStorage(SELLER, 1);

        assertThatThrownBy(() -> approve("other.near", "token-1", "{\"market_type\":\"sale\",\"price\":\"1\"}"))
                .isInstanceOfSatisfying(MarketException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN))
                .hasMessage("Error: registry is not approved");
    }

    @Test
    @DisplayName("해석할 수 없는 메시지, 알 수 없는 market_type 거부")
    void invalidMessages() {
        assertThatThrownBy(() -> approve(REGISTRY, "token-1", "not json"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: invalid approval message");
        assertThatThrownBy(() -> approve(REGISTRY, "token-1", "{\"price\":\"1\"}"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: market_type is required");
        assertThatThrownBy(() -> approve(REGISTRY, "token-1", "{\"market_type\":\"lease\"}"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: unsupported market_type lease");
    }
}
