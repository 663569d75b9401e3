package dustin.market.domains.settlement.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.listing.model.entity.Listing;
import dustin.market.domains.listing.service.ListingService;
import dustin.market.domains.settlement.model.dto.SettlementSnapshot;
import dustin.market.domains.settlement.model.entity.SettlementKind;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 구매 서비스
 * Purchase Service
 *
 * 역할:
 * - 고정가 리스팅 직접 구매 (buy)
 * - 리스팅 삭제 후 정산 예약 (직접 구매와 경매 낙찰 공용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseService {

    private final ListingService listingService;
    private final SettlementService settlementService;
    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;

    /**
     * 직접 구매
     * Buy a fixed-price listing
     *
     * @param currencyId 지정 시 리스팅 통화와 같아야 함
     * @param price 지정 시 리스팅 가격과 같아야 함
     * @return 정산 ID
     */
    @Transactional
    public Long buy(CallContext context, String registryId, String assetId, String currencyId, BigDecimal price) {
        nativeLedgerService.lockEscrow();
        Listing listing = listingService.lockListing(registryId, assetId, "Error: Market data does not exist");
        String buyerId = context.getCallerId();

        MarketException.check(!buyerId.equals(listing.getOwnerId()), "Error: Cannot buy your own sale");
        MarketException.check(marketConfigService.isNative(listing.getCurrencyId()),
                "Error: only the native currency is supported");
        if (currencyId != null) {
            MarketException.check(currencyId.equals(listing.getCurrencyId()), "Error: ft_token_id differs");
        }
        if (price != null) {
            MarketException.check(price.compareTo(listing.getPrice()) == 0, "Error: price differs");
        }
        MarketException.check(!listing.auction(), "Error: the NFT is on auction");

        BigDecimal listingPrice = listing.getPrice();
        MarketException.check(context.getAttachedDeposit().compareTo(listingPrice) >= 0,
                "Error: Attached deposit is less than price " + listingPrice.toPlainString());

        nativeLedgerService.collectDeposit(context);
        BigDecimal excess = context.getAttachedDeposit().subtract(listingPrice);
        if (excess.signum() > 0) {
            nativeLedgerService.transfer(buyerId, excess);
        }

        log.info("[PurchaseService] 직접 구매: key={}, buyer={}, price={}",
                listing.getListingKey(), buyerId, listingPrice.toPlainString());
        return processPurchase(listing, buyerId, listingPrice);
    }

    /**
     * 리스팅 삭제 후 정산 예약
     * Remove the listing and schedule its settlement
     *
     * 가격 금액은 이미 에스크로에 있어야 한다.
     */
    @Transactional
    public Long processPurchase(Listing listing, String buyerId, BigDecimal price) {
        listingService.removeListing(listing);
        return settlementService.schedule(SettlementSnapshot.builder()
                .kind(SettlementKind.PURCHASE)
                .sellerId(listing.getOwnerId())
                .buyerId(buyerId)
                .registryId(listing.getRegistryId())
                .assetId(listing.getAssetId())
                .currencyId(listing.getCurrencyId())
                .approvalId(listing.getApprovalId())
                .price(price)
                .build());
    }
}
