package dustin.market.domains.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;

import dustin.market.config.TestConfig;
import dustin.market.domains.settlement.model.dto.SettlementResponse;
import dustin.market.domains.settlement.model.dto.SettlementSnapshot;
import dustin.market.domains.settlement.model.dto.SettlementTransferResponse;
import dustin.market.domains.settlement.model.entity.SettlementKind;
import dustin.market.domains.settlement.model.entity.SettlementRecord;
import dustin.market.domains.settlement.model.entity.SettlementStatus;
import dustin.market.domains.settlement.repository.SettlementRecordRepository;
import dustin.market.domains.settlement.scheduler.StuckSettlementMonitor;
import dustin.market.domains.settlement.service.PurchaseService;
import dustin.market.domains.settlement.service.RegistryOutcome;
import dustin.market.domains.settlement.service.SettlementResolver;
import dustin.market.domains.settlement.service.SettlementService;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.support.MarketTestSupport;

/**
 * 정산 흐름 테스트
 * Settlement Flow Test
 *
 * 목적:
 * - 직접 구매 → 정산 예약 → 레지스트리 호출 → 해소의 세 분기 검증
 *   1. 호출 실패: 구매자 전액 환불, 수수료 없음, 리스팅 복구 없음
 *   2. 분배 내역 없음/무효: 판매자 = 가격 - 수수료, 재무 = 수수료
 *   3. 유효한 분배 내역: 판매자 몫에서만 수수료 차감
 * - 해소는 정산 1건당 한 번만 적용
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class SettlementFlowTest extends MarketTestSupport {

    private static final String SELLER = "alice.near";
    private static final String BUYER = "bob.near";

    @Autowired
    private PurchaseService purchaseService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private SettlementResolver settlementResolver;

    @Autowired
    private SettlementRecordRepository settlementRecordRepository;

    @Autowired
    private StuckSettlementMonitor stuckSettlementMonitor;

    @BeforeEach
    void setUpBuyer() {
        fund(BUYER, 10_000);
    }

    private Long buy(long price) {
        return purchaseService.buy(CallContext.of(BUYER, price), REGISTRY, "token-1", null, null);
    }

    private SettlementResponse awaitResolved(Long settlementId) {
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(settlementService.get(settlementId).getStatus()).isNotEqualTo("SCHEDULED"));
        return settlementService.get(settlementId);
    }

    @Test
    @DisplayName("레지스트리 호출 실패 → 구매자 전액 환불, 수수료 0, 리스팅은 복구되지 않음")
    void registryFailureRefundsBuyer() {
        listFixedPrice(SELLER, "token-1", 500);
        registry.failWith("approval is stale");

        Long settlementId = buy(500);
        assertThat(balance(BUYER)).isEqualByComparingTo("9500");

        SettlementResponse settlement = awaitResolved(settlementId);

        assertThat(settlement.getStatus()).isEqualTo("RESOLVED_REFUNDED");
        assertThat(settlement.getOutcome()).isEqualTo("REGISTRY_FAILED");
        assertThat(settlement.getFeeAmount()).isEqualByComparingTo("0");
        assertThat(settlement.getFailureReason()).contains("approval is stale");
        assertThat(balance(BUYER)).isEqualByComparingTo("10000");
        assertThat(balance(SELLER)).isEqualByComparingTo("0");
        assertThat(balance(TREASURY)).isEqualByComparingTo("0");
        assertThat(listingService.listByOwner(SELLER)).isEmpty();

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(events.named(MarketEvent.RESOLVE_PURCHASE_FAIL)).hasSize(1));
        assertThat(events.named(MarketEvent.RESOLVE_PURCHASE)).isEmpty();
    }

    @Test
    @DisplayName("분배 내역 없음 → 판매자 = 가격 - 수수료, 재무 = 수수료")
    void noRoyalties() {
        listFixedPrice(SELLER, "token-1", 1_000);

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getStatus()).isEqualTo("RESOLVED_PAID");
        assertThat(settlement.getOutcome()).isEqualTo("NO_ROYALTIES");
        assertThat(balance(SELLER)).isEqualByComparingTo("980");
        assertThat(balance(TREASURY)).isEqualByComparingTo("20");
        assertThat(settlement.getTransfers())
                .extracting(SettlementTransferResponse::getTransferType)
                .containsExactly("SELLER", "FEE");
    }

    @Test
    @DisplayName("합계가 허용 범위를 벗어난 분배 내역은 로열티 없음으로 처리")
    void payoutOutsideToleranceIsIgnored() {
        listFixedPrice(SELLER, "token-1", 1_000);
        registry.respondWith("{\"alice.near\":\"800\",\"artist.near\":\"50\"}");

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getOutcome()).isEqualTo("NO_ROYALTIES");
        assertThat(balance(SELLER)).isEqualByComparingTo("980");
        assertThat(balance("artist.near")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("계정 ID 길이를 넘는 수신자가 있는 분배 내역은 로열티 없음으로 처리 (정산이 SCHEDULED에 머물지 않음)")
    void oversizedRecipientIsIgnored() {
        listFixedPrice(SELLER, "token-1", 1_000);
        registry.respondWith("{\"alice.near\":\"950\",\"" + "r".repeat(200) + "\":\"50\"}");

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getStatus()).isEqualTo("RESOLVED_PAID");
        assertThat(settlement.getOutcome()).isEqualTo("NO_ROYALTIES");
        assertThat(balance(SELLER)).isEqualByComparingTo("980");
        assertThat(balance(TREASURY)).isEqualByComparingTo("20");
        assertThat(balance(BUYER)).isEqualByComparingTo("9000");
        assertThat(balance(ESCROW)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("분배 내역의 수신자가 에스크로 계정이면 금액은 에스크로에 남고 지급 기록은 남기지 않음")
    void escrowRecipientLeavesNoTransferRow() {
        listFixedPrice(SELLER, "token-1", 1_000);
        registry.respondWith("{\"alice.near\":\"950\",\"" + ESCROW + "\":\"50\"}");

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getOutcome()).isEqualTo("PAYOUT");
        assertThat(balance(SELLER)).isEqualByComparingTo("930");
        assertThat(balance(TREASURY)).isEqualByComparingTo("20");
        assertThat(balance(ESCROW)).isEqualByComparingTo("50");
        assertThat(settlement.getTransfers())
                .extracting(SettlementTransferResponse::getRecipientId)
                .containsExactlyInAnyOrder(SELLER, TREASURY);
    }

    @Test
    @DisplayName("유효한 분배 내역 (감싼 형식) → 판매자 930, 로열티 50, 재무 20")
    void payoutEnvelope() {
        listFixedPrice(SELLER, "token-1", 1_000);
        registry.respondWith("{\"payout\":{\"alice.near\":\"950\",\"artist.near\":\"50\"}}");

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getOutcome()).isEqualTo("PAYOUT");
        assertThat(settlement.getFeeAmount()).isEqualByComparingTo("20");
        assertThat(balance(SELLER)).isEqualByComparingTo("930");
        assertThat(balance("artist.near")).isEqualByComparingTo("50");
        assertThat(balance(TREASURY)).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("판매자가 분배 내역에 없으면 수수료 없음")
    void sellerAbsentFromPayout() {
        listFixedPrice(SELLER, "token-1", 1_000);
        registry.respondWith("{\"artist.near\":\"1000\"}");

        SettlementResponse settlement = awaitResolved(buy(1_000));

        assertThat(settlement.getOutcome()).isEqualTo("PAYOUT");
        assertThat(settlement.getFeeAmount()).isEqualByComparingTo("0");
        assertThat(balance("artist.near")).isEqualByComparingTo("1000");
        assertThat(balance(TREASURY)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("레지스트리에는 구매자, 승인 ID, 가격, 최대 수신자 수가 전달됨")
    void registryRequest() {
        listFixedPrice(SELLER, "token-1", 1_000);

        awaitResolved(buy(1_000));

        assertThat(registry.requests()).hasSize(1);
        assertThat(registry.requests().get(0).getRegistryId()).isEqualTo(REGISTRY);
        assertThat(registry.requests().get(0).getReceiverId()).isEqualTo(BUYER);
        assertThat(registry.requests().get(0).getAssetId()).isEqualTo("token-1");
        assertThat(registry.requests().get(0).getApprovalId()).isEqualTo(1L);
        assertThat(registry.requests().get(0).getMaxLenPayout()).isEqualTo(10);
    }

    @Test
    @DisplayName("구매 조건: 본인 리스팅, 경매 리스팅, 가격 부족, 통화/가격 불일치")
    void buyPreconditions() {
        listFixedPrice(SELLER, "token-1", 1_000);
        listAuction(SELLER, "token-2", 1_000);
        fund(SELLER, 5_000);

        assertThatThrownBy(() -> purchaseService.buy(CallContext.of(SELLER, 1_000), REGISTRY, "token-1", null, null))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Cannot buy your own sale");
        assertThatThrownBy(() -> purchaseService.buy(CallContext.of(BUYER, 1_000), REGISTRY, "token-2", null, null))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: the NFT is on auction");
        assertThatThrownBy(() -> purchaseService.buy(CallContext.of(BUYER, 999), REGISTRY, "token-1", null, null))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Attached deposit is less than price 1000");
        assertThatThrownBy(() -> purchaseService.buy(CallContext.of(BUYER, 1_000), REGISTRY, "token-1",
                "usdc.near", null))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: ft_token_id differs");
        assertThatThrownBy(() -> purchaseService.buy(CallContext.of(BUYER, 1_000), REGISTRY, "token-1",
                NATIVE, amount(900)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: price differs");

        assertThat(balance(BUYER)).isEqualByComparingTo("10000");
        assertThat(registry.requests()).isEmpty();
    }

    @Test
    @DisplayName("가격보다 많이 첨부하면 초과분 즉시 환불")
    void excessRefunded() {
        listFixedPrice(SELLER, "token-1", 1_000);

        Long settlementId = purchaseService.buy(CallContext.of(BUYER, 1_500), REGISTRY, "token-1", NATIVE,
                amount(1_000));

        assertThat(balance(BUYER)).isEqualByComparingTo("9000");
        assertThat(awaitResolved(settlementId).getPrice()).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("이미 해소된 정산은 다시 해소되지 않음")
    void resolveIsIdempotent() {
        fund(ESCROW, 700);
        SettlementRecord record = settlementRecordRepository.save(SettlementRecord.builder()
                .kind(SettlementKind.PURCHASE)
                .status(SettlementStatus.SCHEDULED)
                .sellerId(SELLER)
                .buyerId("carol.near")
                .registryId(REGISTRY)
                .assetId("token-9")
                .currencyId(NATIVE)
                .approvalId(1L)
                .price(amount(700))
                .build());
        SettlementSnapshot snapshot = SettlementSnapshot.builder()
                .kind(SettlementKind.PURCHASE)
                .sellerId(SELLER)
                .buyerId("carol.near")
                .registryId(REGISTRY)
                .assetId("token-9")
                .currencyId(NATIVE)
                .approvalId(1L)
                .price(amount(700))
                .build();

        SettlementStatus first = settlementResolver.resolve(record.getId(), snapshot,
                RegistryOutcome.failure("rejected"));
        SettlementStatus second = settlementResolver.resolve(record.getId(), snapshot,
                RegistryOutcome.success(new byte[0]));

        assertThat(first).isEqualTo(SettlementStatus.RESOLVED_REFUNDED);
        assertThat(second).isEqualTo(SettlementStatus.RESOLVED_REFUNDED);
        assertThat(balance("carol.near")).isEqualByComparingTo("700");
        assertThat(balance(SELLER)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("기준 시간을 넘긴 SCHEDULED 정산은 모니터가 찾아낸다")
    void stuckSettlementMonitor() {
        settlementRecordRepository.save(SettlementRecord.builder()
                .kind(SettlementKind.PURCHASE)
                .status(SettlementStatus.SCHEDULED)
                .sellerId(SELLER)
                .buyerId(BUYER)
                .registryId(REGISTRY)
                .assetId("token-9")
                .currencyId(NATIVE)
                .approvalId(1L)
                .price(amount(100))
                .build());

        assertThat(stuckSettlementMonitor.reportStuckSettlements()).isZero();

        ReflectionTestUtils.setField(stuckSettlementMonitor, "stuckThresholdSeconds", -60L);
        try {
            assertThat(stuckSettlementMonitor.reportStuckSettlements()).isEqualTo(1);
        } finally {
            ReflectionTestUtils.setField(stuckSettlementMonitor, "stuckThresholdSeconds", 300L);
        }
    }

    @Test
    @DisplayName("자산별 정산 목록 조회, 없는 정산은 NOT_FOUND")
    void queries() {
        listFixedPrice(SELLER, "token-1", 1_000);
        Long settlementId = buy(1_000);
        awaitResolved(settlementId);

        assertThat(settlementService.listByAsset(REGISTRY, "token-1"))
                .extracting(SettlementResponse::getId)
                .containsExactly(settlementId);
        assertThatThrownBy(() -> settlementService.get(-1L))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Settlement does not exist");
    }
}
