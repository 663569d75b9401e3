package dustin.market.domains.auction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.market.config.TestConfig;
import dustin.market.domains.auction.service.AuctionService;
import dustin.market.domains.listing.model.dto.BidResponse;
import dustin.market.domains.listing.model.dto.CreateListingCommand;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.domains.settlement.model.dto.SettlementResponse;
import dustin.market.domains.settlement.service.SettlementService;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.ErrorCode;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.support.MarketTestSupport;

/**
 * 경매 서비스 테스트
 * AuctionService Test
 *
 * 목적:
 * - 입찰 목록은 항상 가격 오름차순, 입찰자당 최대 1건
 * - 같은 입찰자의 재입찰은 기존 입찰을 즉시 환불
 * - 낙찰은 최고가 입찰을 고르고 나머지를 정확히 한 번 환불
 * - 시간 창, 소유자 입찰 금지, 스토리지 예치 요구
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class AuctionServiceTest extends MarketTestSupport {

    private static final String SELLER = "alice.near";
    private static final String BOB = "bob.near";
    private static final String CAROL = "carol.near";
    private static final String DAVE = "dave.near";
    private static final String ERIN = "erin.near";

    @Autowired
    private AuctionService auctionService;

    @Autowired
    private SettlementService settlementService;

    @BeforeEach
    void setUpBidders() {
        fund(SELLER, 10);
        fund(BOB, 1_000);
        fund(CAROL, 1_000);
        payStorage(BOB, 1);
        payStorage(CAROL, 1);
    }

    private ListingResponse bid(String bidder, long amount) {
        return auctionService.placeBid(CallContext.of(bidder, amount), REGISTRY, NATIVE, "token-1", amount(amount));
    }

    @Test
    @DisplayName("재입찰 → 기존 입찰 즉시 환불, 낙찰 → 최고가 정산 + 나머지 환불")
    void rebidOutbidAndAccept() {
        listAuction(SELLER, "token-1", 100);

        bid(BOB, 100);
        assertThat(balance(BOB)).isEqualByComparingTo("900");

        ListingResponse afterRebid = bid(BOB, 150);
        assertThat(afterRebid.getBids()).extracting(BidResponse::getBidderId).containsExactly(BOB);
        assertThat(balance(BOB)).isEqualByComparingTo("850");

        ListingResponse afterOutbid = bid(CAROL, 200);
        assertThat(afterOutbid.getBids()).extracting(b -> b.getPrice().longValueExact())
                .containsExactly(150L, 200L);
        assertThat(balance(CAROL)).isEqualByComparingTo("800");

        Long settlementId = auctionService.acceptBid(CallContext.of(SELLER, 1), REGISTRY, "token-1");

        assertThat(balance(BOB)).isEqualByComparingTo("1000");
        assertThatThrownBy(() -> listingService.get(REGISTRY, "token-1"))
                .isInstanceOf(MarketException.class);
        assertThat(storageDepositService.supplyByOwner(SELLER)).isZero();

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(settlementService.get(settlementId).getStatus()).isEqualTo("RESOLVED_PAID"));

        SettlementResponse settlement = settlementService.get(settlementId);
        assertThat(settlement.getBuyerId()).isEqualTo(CAROL);
        assertThat(settlement.getPrice()).isEqualByComparingTo("200");
        assertThat(settlement.getFeeAmount()).isEqualByComparingTo("4");
        assertThat(balance(SELLER)).isEqualByComparingTo("205");
        assertThat(balance(TREASURY)).isEqualByComparingTo("4");
        assertThat(balance(CAROL)).isEqualByComparingTo("800");
        assertThat(registry.requests()).hasSize(1);
        assertThat(registry.requests().get(0).getReceiverId()).isEqualTo(CAROL);
        assertThat(registry.requests().get(0).getBalance()).isEqualByComparingTo("200");
    }

    @Test
    @DisplayName("입찰가는 직전 입찰보다 커야 하고 시작가 이상이어야 함")
    void strictlyIncreasing() {
        listAuction(SELLER, "token-1", 100);

        assertThatThrownBy(() -> bid(BOB, 99))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Can't pay less than starting price: 100");

        bid(BOB, 150);

        assertThatThrownBy(() -> bid(CAROL, 150))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Can't pay less than or equal to current bid price: 150");
        assertThat(balance(CAROL)).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("첨부 예치금이 입찰가보다 적으면 거부, 많으면 초과분 환불")
    void attachedDeposit() {
        listAuction(SELLER, "token-1", 100);

        assertThatThrownBy(() -> auctionService.placeBid(CallContext.of(BOB, 120), REGISTRY, NATIVE, "token-1",
                amount(150)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: attached deposit is less than amount");

        auctionService.placeBid(CallContext.of(BOB, 500), REGISTRY, NATIVE, "token-1", amount(150));
        assertThat(balance(BOB)).isEqualByComparingTo("850");
    }

    @Test
    @DisplayName("소유자 입찰 금지, 고정가 리스팅 입찰 금지, 다른 통화 거부")
    void invalidBids() {
        listAuction(SELLER, "token-1", 100);
        listFixedPrice(SELLER, "token-2", 100);
        fund(SELLER, 1_000);
        payStorage(SELLER, 3);

        assertThatThrownBy(() -> bid(SELLER, 200))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Owner cannot bid their own token");

        assertThatThrownBy(() -> auctionService.placeBid(CallContext.of(BOB, 200), REGISTRY, NATIVE, "token-2",
                amount(200)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: the listing is not an auction");

        assertThatThrownBy(() -> auctionService.placeBid(CallContext.of(BOB, 200), REGISTRY, "usdc.near",
                "token-1", amount(200)))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: only the native currency is supported");

        assertThatThrownBy(() -> auctionService.placeBid(CallContext.of(BOB, 200), REGISTRY, NATIVE,
                "missing", amount(200)))
                .isInstanceOfSatisfying(MarketException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }

    @Test
    @DisplayName("시작 전/종료 후 입찰 거부")
    void timeWindow() {
        listingService.create(CreateListingCommand.builder()
                .ownerId(SELLER)
                .approvalId(1L)
                .registryId(REGISTRY)
                .assetId("token-1")
                .currencyId(NATIVE)
                .price(amount(100))
                .startedAt(now().plus(Duration.ofHours(1)))
                .endedAt(now().plus(Duration.ofHours(2)))
                .isAuction(true)
                .build());

        assertThatThrownBy(() -> bid(BOB, 100))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Sale has not started yet");

        clock.advance(Duration.ofMinutes(90));
        bid(BOB, 100);

        clock.advance(Duration.ofHours(1));
        assertThatThrownBy(() -> bid(CAROL, 200))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Sale has ended");
    }

    @Test
    @DisplayName("종료 후에도 판매자는 낙찰 가능")
    void acceptAfterEnd() {
        listingService.create(CreateListingCommand.builder()
                .ownerId(SELLER)
                .approvalId(1L)
                .registryId(REGISTRY)
                .assetId("token-1")
                .currencyId(NATIVE)
                .price(amount(100))
                .endedAt(now().plus(Duration.ofHours(1)))
                .isAuction(true)
                .build());
        bid(BOB, 100);
        clock.advance(Duration.ofHours(3));

        Long settlementId = auctionService.acceptBid(CallContext.of(SELLER, 1), REGISTRY, "token-1");

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(settlementService.get(settlementId).getStatus()).isEqualTo("RESOLVED_PAID"));
    }

    @Test
    @DisplayName("스토리지 예치가 없으면 입찰 거부")
    void requiresStorage() {
        listAuction(SELLER, "token-1", 100);
        fund("dave.near", 1_000);

        assertThatThrownBy(() -> bid("dave.near", 100))
                .isInstanceOf(MarketException.class)
                .hasMessageStartingWith("Insufficient storage paid: 0, for 1 bid");
    }

    @Test
    @DisplayName("낙찰은 판매자만, 입찰이 없으면 거부")
    void acceptBidRules() {
        listAuction(SELLER, "token-1", 100);
        fund(BOB, 10);

        assertThatThrownBy(() -> auctionService.acceptBid(CallContext.of(SELLER, 1), REGISTRY, "token-1"))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Cannot accept bid with empty bid");

        bid(CAROL, 100);

        assertThatThrownBy(() -> auctionService.acceptBid(CallContext.of(BOB, 1), REGISTRY, "token-1"))
                .isInstanceOfSatisfying(MarketException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN))
                .hasMessage("Error: Only seller can call accept_bid");
        assertThat(listingService.get(REGISTRY, "token-1").getBids()).hasSize(1);
    }

    @Test
    @DisplayName("입찰 취소: 본인 또는 마켓 소유자, 취소된 입찰 환불")
    void cancelBid() {
        listAuction(SELLER, "token-1", 100);
        bid(BOB, 100);
        bid(CAROL, 200);
        fund(BOB, 10);
        fund(CAROL, 10);
        fund(OWNER, 10);

        assertThatThrownBy(() -> auctionService.cancelBid(CallContext.of(CAROL, 1), REGISTRY, "token-1", BOB))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Bidder or owner only");

        ListingResponse afterCancel = auctionService.cancelBid(CallContext.of(BOB, 1), REGISTRY, "token-1", BOB);
        assertThat(afterCancel.getBids()).extracting(BidResponse::getBidderId).containsExactly(CAROL);
        assertThat(balance(BOB)).isEqualByComparingTo("1009");

        auctionService.cancelBid(CallContext.of(OWNER, 1), REGISTRY, "token-1", CAROL);
        assertThat(listingService.get(REGISTRY, "token-1").getBids()).isEmpty();
        assertThat(balance(CAROL)).isEqualByComparingTo("1010");
        assertThat(events.named(MarketEvent.CANCEL_BID)).hasSize(2);

        assertThatThrownBy(() -> auctionService.cancelBid(CallContext.of(BOB, 1), REGISTRY, "token-1", BOB))
                .isInstanceOf(MarketException.class)
                .hasMessage("Error: Bids data does not exist");
    }

    @Test
    @DisplayName("무작위 입찰/재입찰/취소 순서에서도 입찰 목록은 가격 오름차순, 입찰자당 1건, 에스크로 보존")
    void randomBidSequenceKeepsBookOrdered() {
        List<String> bidders = List.of(BOB, CAROL, DAVE, ERIN);
        for (String bidder : bidders) {
            fund(bidder, 100_000);
        }
        payStorage(DAVE, 1);
        payStorage(ERIN, 1);
        listAuction(SELLER, "token-1", 100);

        BigDecimal escrowBase = balance(ESCROW);
        BigDecimal total = totalBalance(bidders).add(escrowBase);
        long oneUnitCalls = 0;
        Random random = new Random(20260101L);

        for (int step = 0; step < 120; step++) {
            String bidder = bidders.get(random.nextInt(bidders.size()));
            List<BidResponse> before = listingService.get(REGISTRY, "token-1").getBids();

            if (random.nextInt(5) == 0) {
                if (before.isEmpty()) {
                    assertThatThrownBy(() -> auctionService.cancelBid(CallContext.of(bidder, 1), REGISTRY,
                            "token-1", bidder))
                            .isInstanceOf(MarketException.class);
                } else {
                    auctionService.cancelBid(CallContext.of(bidder, 1), REGISTRY, "token-1", bidder);
                    oneUnitCalls++;
                }
            } else {
                long top = before.isEmpty() ? 99 : before.get(before.size() - 1).getPrice().longValueExact();
                long amount = top + random.nextInt(30) - 9;
                if (amount > top) {
                    bid(bidder, amount);
                } else {
                    assertThatThrownBy(() -> bid(bidder, amount)).isInstanceOf(MarketException.class);
                }
            }

            List<BidResponse> bids = listingService.get(REGISTRY, "token-1").getBids();
            BigDecimal held = BigDecimal.ZERO;
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < bids.size(); i++) {
                BidResponse current = bids.get(i);
                assertThat(seen.add(current.getBidderId()))
                        .as("step %d: one bid per bidder", step).isTrue();
                if (i > 0) {
                    assertThat(current.getPrice()).as("step %d: strictly increasing", step)
                            .isGreaterThan(bids.get(i - 1).getPrice());
                }
                held = held.add(current.getPrice());
            }
            assertThat(balance(ESCROW)).as("step %d: escrow", step)
                    .isEqualByComparingTo(escrowBase.add(held).add(BigDecimal.valueOf(oneUnitCalls)));
            assertThat(totalBalance(bidders).add(balance(ESCROW))).as("step %d: conservation", step)
                    .isEqualByComparingTo(total);
        }
    }

    @Test
    @DisplayName("같은 리스팅에 대한 동시 입찰/가격 변경/입찰 취소는 교착 없이 직렬화")
    void concurrentCallsOnOneListingAreSerialized() throws Exception {
        fund(SELLER, 1_000);
        fund(BOB, 100_000);
        fund(CAROL, 100_000);
        listAuction(SELLER, "token-1", 100);

        BigDecimal escrowBase = balance(ESCROW);
        AtomicLong nextAmount = new AtomicLong(100);
        AtomicLong oneUnitCalls = new AtomicLong();
        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);

        List<Future<Object>> futures = new ArrayList<>();
        for (int worker = 0; worker < 4; worker++) {
            final int role = worker;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 10; i++) {
                    try {
                        if (role == 0) {
                            listingService.updatePrice(CallContext.of(SELLER, 1), REGISTRY, "token-1", NATIVE,
                                    amount(100));
                            oneUnitCalls.incrementAndGet();
                        } else if (role == 1) {
                            auctionService.cancelBid(CallContext.of(BOB, 1), REGISTRY, "token-1", BOB);
                            oneUnitCalls.incrementAndGet();
                        } else {
                            bid(role == 2 ? BOB : CAROL, nextAmount.addAndGet(10));
                        }
                    } catch (MarketException e) {
                        // 직렬화된 순서에 따른 전제 조건 실패 (빈 입찰 목록 등)
                        assertThat(e.getMessage()).startsWith("Error:");
                    } catch (RuntimeException e) {
                        unexpected.add(e);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<Object> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(unexpected).isEmpty();
        List<BidResponse> bids = listingService.get(REGISTRY, "token-1").getBids();
        assertThat(bids).extracting(BidResponse::getBidderId).doesNotHaveDuplicates();
        BigDecimal held = bids.stream().map(BidResponse::getPrice).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(balance(ESCROW))
                .isEqualByComparingTo(escrowBase.add(held).add(BigDecimal.valueOf(oneUnitCalls.get())));
    }

    private BigDecimal totalBalance(List<String> accounts) {
        BigDecimal total = BigDecimal.ZERO;
        for (String account : accounts) {
            total = total.add(balance(account));
        }
        return total;
    }
}
