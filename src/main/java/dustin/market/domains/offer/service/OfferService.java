package dustin.market.domains.offer.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.listing.service.ListingService;
import dustin.market.domains.offer.model.dto.OfferResponse;
import dustin.market.domains.offer.model.entity.Offer;
import dustin.market.domains.offer.repository.OfferRepository;
import dustin.market.domains.reservation.model.entity.ReservationKind;
import dustin.market.domains.reservation.service.ReservationIndexService;
import dustin.market.domains.reservation.service.StorageDepositService;
import dustin.market.domains.settlement.model.dto.SettlementSnapshot;
import dustin.market.domains.settlement.model.entity.SettlementKind;
import dustin.market.domains.settlement.service.SettlementService;
import dustin.market.shared.context.Amounts;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.shared.kafka.MarketEventPublisher;
import dustin.market.shared.key.MarketKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 오퍼 서비스
 * Offer Service
 *
 * 역할:
 * - 오퍼 제안 (제안가 전액 에스크로, 기존 오퍼는 환불 후 교체)
 * - 오퍼 취소 (제안자 본인만, 에스크로 환불)
 * - 오퍼 수락 (레지스트리 승인 콜백 경로, 정산 예약)
 * - 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfferService {

    private static final String QUOTA_LABEL = "offer";

    private final OfferRepository offerRepository;
    private final ListingService listingService;
    private final SettlementService settlementService;
    private final ReservationIndexService reservationIndexService;
    private final StorageDepositService storageDepositService;
    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;
    private final MarketEventPublisher eventPublisher;

    /**
     * 오퍼 제안
     * Make offer
     *
     * @param context 구매자 + 첨부 예치금 (제안가와 정확히 같아야 함)
     */
    @Transactional
    public OfferResponse makeOffer(CallContext context, String registryId, String assetId,
                                   String currencyId, BigDecimal price) {
        String buyerId = context.getCallerId();
        nativeLedgerService.lockEscrow();

        marketConfigService.requireApprovedRegistry(registryId,
                "Error: offers are only accepted for approved registries");
        Amounts.requireWhole(price, "price");
        MarketException.check(context.getAttachedDeposit().compareTo(price) == 0, "Error: Attached deposit != price");
        MarketException.check(marketConfigService.isNative(currencyId),
                "Error: only the native currency is supported");

        nativeLedgerService.collectDeposit(context);

        String offerKey = MarketKeys.offerKey(registryId, buyerId, assetId);
        Optional<Offer> previous = offerRepository.findByOfferKeyForUpdate(offerKey);
        if (previous.isPresent()) {
            removeOffer(previous.get());
            nativeLedgerService.transfer(buyerId, previous.get().getPrice());
            offerRepository.flush();
            log.info("[OfferService] 기존 오퍼 교체: key={}, refunded={}",
                    offerKey, previous.get().getPrice().toPlainString());
        }

        storageDepositService.requireQuotaForOneMore(buyerId, QUOTA_LABEL);

        Offer offer = offerRepository.save(Offer.builder()
                .offerKey(offerKey)
                .buyerId(buyerId)
                .registryId(registryId)
                .assetId(assetId)
                .currencyId(currencyId)
                .price(price)
                .build());
        reservationIndexService.add(buyerId, ReservationKind.OFFER, offerKey);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.ADD_OFFER)
                .param("buyer_id", buyerId)
                .param("registry_id", registryId)
                .param("asset_id", assetId)
                .param("currency_id", currencyId)
                .param("price", price.toPlainString())
                .build());

        log.info("[OfferService] 오퍼 제안: key={}, price={}", offerKey, price.toPlainString());
        return toResponse(offer);
    }

    /**
     * 오퍼 취소
     * Cancel offer (the offer's buyer only, one-unit deposit)
     */
    @Transactional
    public void cancelOffer(CallContext context, String registryId, String assetId) {
        nativeLedgerService.requireOneUnit(context);
        String buyerId = context.getCallerId();
        String offerKey = MarketKeys.offerKey(registryId, buyerId, assetId);

        Offer offer = offerRepository.findByOfferKeyForUpdate(offerKey)
                .orElseThrow(() -> MarketException.notFound("Error: Offer does not exist"));
        if (!offer.getBuyerId().equals(buyerId)) {
            throw MarketException.forbidden("Error: Caller not offer's buyer");
        }

        removeOffer(offer);
        nativeLedgerService.transfer(buyerId, offer.getPrice());

        eventPublisher.publish(MarketEvent.builder(MarketEvent.DELETE_OFFER)
                .param("registry_id", registryId)
                .param("buyer_id", buyerId)
                .param("asset_id", assetId)
                .build());

        log.info("[OfferService] 오퍼 취소: key={}, refunded={}", offerKey, offer.getPrice().toPlainString());
    }

    /**
     * 오퍼 수락
     * Accept offer
     *
     * 같은 자산의 직접 리스팅이 있으면 먼저 삭제(입찰 환불)하고, 오퍼를 삭제한 뒤
     * 오퍼 에스크로를 분배 총액으로 정산을 예약한다.
     *
     * @param sellerId 자산 소유자 (레지스트리 승인 콜백이 전달)
     * @return 정산 ID
     */
    @Transactional
    public Long acceptOffer(String sellerId, String registryId, String buyerId, String assetId,
                            long approvalId, BigDecimal price) {
        nativeLedgerService.lockEscrow();
        String offerKey = MarketKeys.offerKey(registryId, buyerId, assetId);
        Offer offer = offerRepository.findByOfferKeyForUpdate(offerKey)
                .orElseThrow(() -> MarketException.notFound("Error: Offer does not exist"));

        listingService.removeListingIfPresent(registryId, assetId)
                .ifPresent(listing -> log.info("[OfferService] 오퍼 수락으로 리스팅 삭제: key={}",
                        listing.getListingKey()));

        MarketException.check(price != null && offer.getPrice().compareTo(price) == 0,
                "Error: offer price differs");

        removeOffer(offer);

        log.info("[OfferService] 오퍼 수락: key={}, seller={}, price={}",
                offerKey, sellerId, offer.getPrice().toPlainString());
        return settlementService.schedule(SettlementSnapshot.builder()
                .kind(SettlementKind.OFFER)
                .sellerId(sellerId)
                .buyerId(offer.getBuyerId())
                .registryId(registryId)
                .assetId(assetId)
                .currencyId(offer.getCurrencyId())
                .approvalId(approvalId)
                .price(offer.getPrice())
                .build());
    }

    // ===== 조회 =====

    @Transactional(readOnly = true)
    public OfferResponse get(String registryId, String buyerId, String assetId) {
        return offerRepository.findByOfferKey(MarketKeys.offerKey(registryId, buyerId, assetId))
                .map(this::toResponse)
                .orElseThrow(() -> MarketException.notFound("Error: Offer does not exist"));
    }

    @Transactional(readOnly = true)
    public List<OfferResponse> listByBuyer(String buyerId) {
        return offerRepository.findByBuyerIdOrderByIdAsc(buyerId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    private void removeOffer(Offer offer) {
        offerRepository.delete(offer);
        reservationIndexService.remove(offer.getBuyerId(), ReservationKind.OFFER, offer.getOfferKey());
    }

    private OfferResponse toResponse(Offer offer) {
        return OfferResponse.builder()
                .buyerId(offer.getBuyerId())
                .registryId(offer.getRegistryId())
                .assetId(offer.getAssetId())
                .currencyId(offer.getCurrencyId())
                .price(offer.getPrice())
                .build();
    }
}
