package dustin.market.domains.auction.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.domains.listing.model.entity.Bid;
import dustin.market.domains.listing.model.entity.Listing;
import dustin.market.domains.listing.repository.ListingRepository;
import dustin.market.domains.listing.service.ListingService;
import dustin.market.domains.reservation.service.StorageDepositService;
import dustin.market.domains.settlement.service.PurchaseService;
import dustin.market.shared.context.Amounts;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.shared.kafka.MarketEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 경매 서비스
 * Auction Service
 *
 * 역할:
 * - 입찰 (placeBid): 시간 창/금액/보증금 검증 후 목록 끝에 추가
 * - 낙찰 (acceptBid): 마지막(최고가) 입찰 선택, 나머지 환불, 정산 예약
 * - 입찰 취소 (cancelBid): 대상 입찰자의 입찰 전부 환불/제거
 *
 * 입찰 목록 불변식:
 * - 가격이 목록 순서대로 엄격히 증가
 * - 입찰자당 최대 1개 (재입찰 시 이전 입찰을 먼저 환불/제거)
 * - 마지막 항목 = 현재 최고가
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionService {

    private static final String QUOTA_LABEL = "bid";

    private final ListingService listingService;
    private final ListingRepository listingRepository;
    private final PurchaseService purchaseService;
    private final StorageDepositService storageDepositService;
    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;
    private final MarketEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 입찰
     * Place bid
     *
     * @param context 입찰자 + 첨부 예치금 (입찰가 이상, 초과분 환불)
     */
    @Transactional
    public ListingResponse placeBid(CallContext context, String registryId, String currencyId,
                                    String assetId, BigDecimal amount) {
        nativeLedgerService.lockEscrow();
        Listing listing = listingService.lockListing(registryId, assetId, "Error: Token id does not exist");
        String bidderId = context.getCallerId();
        Instant now = Instant.now(clock);

        MarketException.check(listing.auction(), "Error: the listing is not an auction");
        if (listing.getStartedAt() != null) {
            MarketException.check(!now.isBefore(listing.getStartedAt()), "Error: Sale has not started yet");
        }
        if (listing.getEndedAt() != null) {
            MarketException.check(!now.isAfter(listing.getEndedAt()), "Error: Sale has ended");
        }
        MarketException.check(!listing.getOwnerId().equals(bidderId), "Error: Owner cannot bid their own token");

        Amounts.requireWhole(amount, "amount");
        MarketException.check(context.getAttachedDeposit().compareTo(amount) >= 0,
                "Error: attached deposit is less than amount");
        MarketException.check(marketConfigService.isNative(currencyId),
                "Error: only the native currency is supported");
        MarketException.check(currencyId.equals(listing.getCurrencyId()), "Error: ft_token_id differs");

        storageDepositService.requireQuotaForOneMore(bidderId, QUOTA_LABEL);

        List<Bid> bids = listing.getBids();
        if (!bids.isEmpty()) {
            BigDecimal current = bids.get(bids.size() - 1).getPrice();
            MarketException.check(amount.compareTo(current) > 0,
                    "Error: Can't pay less than or equal to current bid price: " + current.toPlainString());
        }
        MarketException.check(amount.compareTo(listing.getPrice()) >= 0,
                "Error: Can't pay less than starting price: " + listing.getPrice().toPlainString());

        nativeLedgerService.collectDeposit(context);
        BigDecimal excess = context.getAttachedDeposit().subtract(amount);
        if (excess.signum() > 0) {
            nativeLedgerService.transfer(bidderId, excess);
        }

        removeBidsOf(listing, bidderId);
        bids.add(Bid.builder()
                .bidderId(bidderId)
                .price(amount)
                .build());
        listingRepository.save(listing);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.ADD_BID)
                .param("bidder_id", bidderId)
                .param("registry_id", registryId)
                .param("asset_id", assetId)
                .param("currency_id", currencyId)
                .param("amount", amount.toPlainString())
                .build());

        log.info("[AuctionService] 입찰: key={}, bidder={}, amount={}, bids={}",
                listing.getListingKey(), bidderId, amount.toPlainString(), bids.size());
        return listingService.toResponse(listing);
    }

    /**
     * 낙찰
     * Accept the highest bid (seller only, one-unit deposit)
     *
     * 시간 창은 확인하지 않는다.
     *
     * @return 정산 ID
     */
    @Transactional
    public Long acceptBid(CallContext context, String registryId, String assetId) {
        nativeLedgerService.requireOneUnit(context);
        Listing listing = listingService.lockListing(registryId, assetId, "Error: Token id does not exist");

        if (!listing.getOwnerId().equals(context.getCallerId())) {
            throw MarketException.forbidden("Error: Only seller can call accept_bid");
        }

        List<Bid> bids = listing.getBids();
        MarketException.check(!bids.isEmpty(), "Error: Cannot accept bid with empty bid");

        Bid winner = bids.remove(bids.size() - 1);
        for (Bid bid : bids) {
            nativeLedgerService.transfer(bid.getBidderId(), bid.getPrice());
            log.debug("[AuctionService] 낙찰 외 입찰 환불: bidder={}, amount={}",
                    bid.getBidderId(), bid.getPrice().toPlainString());
        }
        bids.clear();
        listingRepository.saveAndFlush(listing);

        log.info("[AuctionService] 낙찰: key={}, winner={}, price={}",
                listing.getListingKey(), winner.getBidderId(), winner.getPrice().toPlainString());
        return purchaseService.processPurchase(listing, winner.getBidderId(), winner.getPrice());
    }

    /**
     * 입찰 취소
     * Cancel every bid of the target bidder (the bidder or the marketplace owner, one-unit deposit)
     */
    @Transactional
    public ListingResponse cancelBid(CallContext context, String registryId, String assetId, String targetBidderId) {
        nativeLedgerService.requireOneUnit(context);
        Listing listing = listingService.lockListing(registryId, assetId, "Error: Token id does not exist");

        MarketException.check(!listing.getBids().isEmpty(), "Error: Bids data does not exist");

        String caller = context.getCallerId();
        if (!caller.equals(targetBidderId) && !marketConfigService.isOwner(caller)) {
            throw MarketException.forbidden("Error: Bidder or owner only");
        }

        int removed = removeBidsOf(listing, targetBidderId);
        listingRepository.save(listing);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.CANCEL_BID)
                .param("bidder_id", targetBidderId)
                .param("registry_id", registryId)
                .param("asset_id", assetId)
                .build());

        log.info("[AuctionService] 입찰 취소: key={}, bidder={}, removed={}, caller={}",
                listing.getListingKey(), targetBidderId, removed, caller);
        return listingService.toResponse(listing);
    }

    /**
     * 입찰자의 입찰을 모두 환불하고 목록에서 제거
     */
    private int removeBidsOf(Listing listing, String bidderId) {
        int removed = 0;
        Iterator<Bid> iterator = listing.getBids().iterator();
        while (iterator.hasNext()) {
            Bid bid = iterator.next();
            if (bid.getBidderId().equals(bidderId)) {
                nativeLedgerService.transfer(bid.getBidderId(), bid.getPrice());
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }
}
