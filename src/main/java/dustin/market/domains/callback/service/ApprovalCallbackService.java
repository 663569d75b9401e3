package dustin.market.domains.callback.service;

import java.time.Instant;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.market.domains.callback.model.dto.ApprovalMessage;
import dustin.market.domains.callback.model.dto.ApprovalResult;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.listing.model.dto.CreateListingCommand;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.domains.listing.service.ListingService;
import dustin.market.domains.offer.service.OfferService;
import dustin.market.domains.reservation.service.StorageDepositService;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 레지스트리 승인 콜백 서비스
 * Approval Callback Service
 *
 * 역할:
 * - 레지스트리가 자산 승인 직후 호출하는 진입점
 * - market_type = sale         → 리스팅 생성 (고정가 또는 경매)
 * - market_type = accept_offer → 해당 자산의 오퍼 수락, 정산 예약
 *
 * 처리 흐름:
 * 1. 호출자(레지스트리)가 승인 목록에 있는지 확인
 * 2. msg JSON 해석
 * 3. 유형별 처리 (하나의 트랜잭션)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalCallbackService {

    private static final String LISTING_QUOTA_LABEL = "listing";

    private final MarketConfigService marketConfigService;
    private final StorageDepositService storageDepositService;
    private final ListingService listingService;
    private final OfferService offerService;
    private final ObjectMapper objectMapper;

    /**
     * 승인 콜백 처리
     * Handle approval callback
     *
     * @param context    호출자 = 레지스트리
     * @param assetId    승인된 자산
     * @param ownerId    자산 소유자 (판매자)
     * @param approvalId 레지스트리 승인 ID (이후 이전 호출에 그대로 사용)
     * @param msg        승인 메시지 JSON
     */
    @Transactional
    public ApprovalResult onApprove(CallContext context, String assetId, String ownerId, long approvalId, String msg) {
        String registryId = context.getCallerId();
        marketConfigService.requireApprovedRegistry(registryId, "Error: registry is not approved");

        ApprovalMessage message = parse(msg);
        String marketType = message.getMarketType();

        if (ApprovalMessage.SALE.equals(marketType)) {
            return ApprovalResult.builder()
                    .marketType(marketType)
                    .listing(createListing(registryId, assetId, ownerId, approvalId, message))
                    .build();
        }
        if (ApprovalMessage.ACCEPT_OFFER.equals(marketType)) {
            MarketException.check(message.getBuyerId() != null && !message.getBuyerId().isBlank(),
                    "Error: buyer_id is required");
            MarketException.check(message.getPrice() != null, "Error: price is required");
            Long settlementId = offerService.acceptOffer(
                    ownerId, registryId, message.getBuyerId(), assetId, approvalId, message.getPrice());
            return ApprovalResult.builder()
                    .marketType(marketType)
                    .settlementId(settlementId)
                    .build();
        }
        throw MarketException.badRequest("Error: unsupported market_type " + marketType);
    }

    private ListingResponse createListing(String registryId, String assetId, String ownerId,
                                          long approvalId, ApprovalMessage message) {
        MarketException.check(message.getPrice() != null, "Error: price is required");
        String currencyId = message.getCurrencyId() != null
                ? message.getCurrencyId()
                : marketConfigService.nativeCurrency();
        MarketException.check(marketConfigService.isApprovedCurrency(currencyId),
                "Error: ft_token_id is not approved");

        storageDepositService.requireQuotaForOneMore(ownerId, LISTING_QUOTA_LABEL);

        return listingService.create(CreateListingCommand.builder()
                .ownerId(ownerId)
                .approvalId(approvalId)
                .registryId(registryId)
                .assetId(assetId)
                .currencyId(currencyId)
                .price(message.getPrice())
                .startedAt(toInstant(message.getStartedAtNanos()))
                .endedAt(toInstant(message.getEndedAtNanos()))
                .isAuction(message.getIsAuction())
                .build());
    }

    private ApprovalMessage parse(String msg) {
        try {
            ApprovalMessage message = objectMapper.readValue(msg, ApprovalMessage.class);
            if (message == null || message.getMarketType() == null) {
                throw MarketException.badRequest("Error: market_type is required");
            }
            return message;
        } catch (JsonProcessingException e) {
            log.warn("[ApprovalCallbackService] 승인 메시지 해석 실패: {}", e.getOriginalMessage());
            throw MarketException.badRequest("Error: invalid approval message");
        }
    }

    private static Instant toInstant(Long epochNanos) {
        return epochNanos == null ? null : Instant.ofEpochSecond(0, epochNanos);
    }
}
