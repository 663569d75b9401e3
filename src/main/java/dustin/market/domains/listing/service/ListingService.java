package dustin.market.domains.listing.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.listing.model.dto.BidResponse;
import dustin.market.domains.listing.model.dto.CreateListingCommand;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.domains.listing.model.entity.Bid;
import dustin.market.domains.listing.model.entity.Listing;
import dustin.market.domains.listing.repository.ListingRepository;
import dustin.market.domains.reservation.model.entity.ReservationKind;
import dustin.market.domains.reservation.service.ReservationIndexService;
import dustin.market.shared.context.Amounts;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.shared.kafka.MarketEventPublisher;
import dustin.market.shared.key.MarketKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 리스팅 서비스
 * Listing Service
 *
 * 역할:
 * - 리스팅 생성 / 가격 변경 / 삭제 / 조회
 * - 삭제 시 남은 입찰 환불 + 예약 인덱스 제거
 * - 구매/경매 낙찰/오퍼 수락 경로에서 쓰는 내부 삭제(removeListing) 제공
 *
 * 처리 흐름 (상태 변경):
 * 1. 필요 시 1단위 예치금 수령
 * 2. 리스팅 행 잠금 (PESSIMISTIC_WRITE)
 * 3. 권한/가격/시간 검증
 * 4. 저장 + 예약 인덱스 갱신
 * 5. 이벤트 발행 (커밋 이후)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingService {

    private final ListingRepository listingRepository;
    private final ReservationIndexService reservationIndexService;
    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;
    private final MarketEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 리스팅 생성
     * Create listing
     *
     * 같은 키의 리스팅이 이미 있으면 교체한다 (기존 입찰은 환불).
     */
    @Transactional
    public ListingResponse create(CreateListingCommand command) {
        String listingKey = MarketKeys.listingKey(command.getRegistryId(), command.getAssetId());
        Instant now = Instant.now(clock);
        nativeLedgerService.lockEscrow();

        if (command.getStartedAt() != null) {
            MarketException.check(!command.getStartedAt().isBefore(now),
                    "Error: started_at must not be in the past");
            if (command.getEndedAt() != null) {
                MarketException.check(command.getStartedAt().isBefore(command.getEndedAt()),
                        "Error: started_at must be before ended_at");
            }
        }
        if (command.getEndedAt() != null) {
            MarketException.check(!command.getEndedAt().isBefore(now),
                    "Error: ended_at must not be in the past");
        }
        Amounts.requireBelowMaxPrice(command.getPrice());

        Optional<Listing> existing = listingRepository.findByListingKeyForUpdate(listingKey);
        if (existing.isPresent()) {
            log.info("[ListingService] 기존 리스팅 교체: key={}, previousOwner={}",
                    listingKey, existing.get().getOwnerId());
            removeListing(existing.get());
            listingRepository.flush();
        }

        Listing listing = listingRepository.save(Listing.builder()
                .listingKey(listingKey)
                .ownerId(command.getOwnerId())
                .approvalId(command.getApprovalId())
                .registryId(command.getRegistryId())
                .assetId(command.getAssetId())
                .currencyId(command.getCurrencyId())
                .price(command.getPrice())
                .startedAt(command.getStartedAt())
                .endedAt(command.getEndedAt())
                .isAuction(command.getIsAuction())
                .bids(new ArrayList<>())
                .build());
        reservationIndexService.add(command.getOwnerId(), ReservationKind.LISTING, listingKey);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.ADD_MARKET_DATA)
                .param("owner_id", listing.getOwnerId())
                .param("approval_id", listing.getApprovalId())
                .param("registry_id", listing.getRegistryId())
                .param("asset_id", listing.getAssetId())
                .param("currency_id", listing.getCurrencyId())
                .param("price", listing.getPrice().toPlainString())
                .param("started_at", listing.getStartedAt())
                .param("ended_at", listing.getEndedAt())
                .param("is_auction", listing.getIsAuction())
                .build());

        log.info("[ListingService] 리스팅 생성: key={}, owner={}, price={}, auction={}",
                listingKey, listing.getOwnerId(), listing.getPrice().toPlainString(), listing.auction());
        return toResponse(listing);
    }

    /**
     * 리스팅 가격 변경
     * Update listing price (seller only, one-unit deposit)
     */
    @Transactional
    public ListingResponse updatePrice(CallContext context, String registryId, String assetId,
                                       String currencyId, BigDecimal newPrice) {
        nativeLedgerService.requireOneUnit(context);
        Listing listing = lockListing(registryId, assetId, "Error: Token id does not exist");

        if (!listing.getOwnerId().equals(context.getCallerId())) {
            throw MarketException.forbidden("Error: Seller only");
        }
        MarketException.check(listing.getCurrencyId().equals(currencyId), "Error: ft_token_id differs");
        Amounts.requireBelowMaxPrice(newPrice);

        listing.setPrice(newPrice);
        listingRepository.save(listing);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.UPDATE_MARKET_DATA)
                .param("owner_id", listing.getOwnerId())
                .param("registry_id", registryId)
                .param("asset_id", assetId)
                .param("currency_id", currencyId)
                .param("price", newPrice.toPlainString())
                .build());

        log.info("[ListingService] 가격 변경: key={}, price={}", listing.getListingKey(), newPrice.toPlainString());
        return toResponse(listing);
    }

    /**
     * 리스팅 삭제
     * Delete listing (seller or marketplace owner, one-unit deposit)
     */
    @Transactional
    public void delete(CallContext context, String registryId, String assetId) {
        nativeLedgerService.requireOneUnit(context);
        Listing listing = lockListing(registryId, assetId, "Error: Market data does not exist");

        String caller = context.getCallerId();
        if (!listing.getOwnerId().equals(caller) && !marketConfigService.isOwner(caller)) {
            throw MarketException.forbidden("Error: Seller or owner only");
        }

        removeListing(listing);

        eventPublisher.publish(MarketEvent.builder(MarketEvent.DELETE_MARKET_DATA)
                .param("owner_id", listing.getOwnerId())
                .param("registry_id", registryId)
                .param("asset_id", assetId)
                .build());

        log.info("[ListingService] 리스팅 삭제: key={}, caller={}", listing.getListingKey(), caller);
    }

    /**
     * 리스팅 제거 (내부용)
     * Remove a listing: refund outstanding bids, delete the row, drop the reservation key
     *
     * 호출자 트랜잭션 안에서만 사용한다. 반환된 엔티티는 삭제 전 상태의 값을 가진다.
     */
    @Transactional
    public Listing removeListing(Listing listing) {
        for (Bid bid : listing.getBids()) {
            nativeLedgerService.transfer(bid.getBidderId(), bid.getPrice());
            log.debug("[ListingService] 입찰 환불: key={}, bidder={}, amount={}",
                    listing.getListingKey(), bid.getBidderId(), bid.getPrice().toPlainString());
        }
        listingRepository.delete(listing);
        reservationIndexService.remove(listing.getOwnerId(), ReservationKind.LISTING, listing.getListingKey());
        return listing;
    }

    /**
     * 키로 리스팅을 찾아 제거 (없으면 empty)
     */
    @Transactional
    public Optional<Listing> removeListingIfPresent(String registryId, String assetId) {
        return listingRepository.findByListingKeyForUpdate(MarketKeys.listingKey(registryId, assetId))
                .map(this::removeListing);
    }

    /**
     * 리스팅 잠금 조회 (없으면 NOT_FOUND)
     */
    @Transactional
    public Listing lockListing(String registryId, String assetId, String notFoundMessage) {
        return listingRepository.findByListingKeyForUpdate(MarketKeys.listingKey(registryId, assetId))
                .orElseThrow(() -> MarketException.notFound(notFoundMessage));
    }

    // ===== 조회 =====

    @Transactional(readOnly = true)
    public ListingResponse get(String registryId, String assetId) {
        return listingRepository.findByListingKey(MarketKeys.listingKey(registryId, assetId))
                .map(this::toResponse)
                .orElseThrow(() -> MarketException.notFound("Error: Market data does not exist"));
    }

    @Transactional(readOnly = true)
    public List<ListingResponse> listByOwner(String ownerId) {
        return listingRepository.findByOwnerIdOrderByIdAsc(ownerId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public ListingResponse toResponse(Listing listing) {
        List<BidResponse> bids = null;
        if (listing.auction()) {
            bids = listing.getBids().stream()
                    .map(bid -> BidResponse.builder()
                            .bidderId(bid.getBidderId())
                            .price(bid.getPrice())
                            .build())
                    .collect(Collectors.toList());
        }
        return ListingResponse.builder()
                .ownerId(listing.getOwnerId())
                .approvalId(listing.getApprovalId())
                .registryId(listing.getRegistryId())
                .assetId(listing.getAssetId())
                .currencyId(listing.getCurrencyId())
                .price(listing.getPrice())
                .startedAt(listing.getStartedAt())
                .endedAt(listing.getEndedAt())
                .isAuction(listing.getIsAuction())
                .bids(bids)
                .build();
    }
}
