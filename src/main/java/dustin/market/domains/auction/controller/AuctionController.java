package dustin.market.domains.auction.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.auction.model.dto.CancelBidRequest;
import dustin.market.domains.auction.model.dto.PlaceBidRequest;
import dustin.market.domains.auction.service.AuctionService;
import dustin.market.domains.listing.model.dto.ListingKeyRequest;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.shared.context.RequestContexts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 경매 컨트롤러
 * Auction Controller
 *
 * API 엔드포인트:
 * - POST /api/market/auctions/bids    - 입찰 (X-Attached-Deposit ≥ 입찰가)
 * - POST /api/market/auctions/accept  - 최고 입찰 수락 (판매자, X-Attached-Deposit = 1)
 * - POST /api/market/auctions/cancel  - 입찰 취소 (입찰자/소유자, X-Attached-Deposit = 1)
 */
@RestController
@RequestMapping("/api/market/auctions")
@RequiredArgsConstructor
@Tag(name = "Auction", description = "경매 입찰 API 엔드포인트")
public class AuctionController {

    private final AuctionService auctionService;

    @Operation(
            summary = "입찰",
            description = "경매 리스팅에 입찰합니다. 직전 입찰가보다 높고 시작가 이상이어야 합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/bids")
    public ResponseEntity<ListingResponse> placeBid(
            @Valid @RequestBody PlaceBidRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(auctionService.placeBid(
                RequestContexts.from(httpRequest),
                request.getRegistryId(),
                request.getCurrencyId(),
                request.getAssetId(),
                request.getAmount()));
    }

    @Operation(
            summary = "최고 입찰 수락",
            description = "판매자가 최고 입찰을 수락합니다. 나머지 입찰은 환불되고 정산 ID를 반환합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/accept")
    public ResponseEntity<Map<String, Long>> acceptBid(
            @Valid @RequestBody ListingKeyRequest request,
            HttpServletRequest httpRequest
    ) {
        Long settlementId = auctionService.acceptBid(
                RequestContexts.from(httpRequest), request.getRegistryId(), request.getAssetId());
        return ResponseEntity.ok(Map.of("settlementId", settlementId));
    }

    @Operation(
            summary = "입찰 취소",
            description = "입찰자 본인 또는 마켓 소유자가 입찰을 취소합니다. 취소된 입찰은 환불됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/cancel")
    public ResponseEntity<ListingResponse> cancelBid(
            @Valid @RequestBody CancelBidRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(auctionService.cancelBid(
                RequestContexts.from(httpRequest),
                request.getRegistryId(),
                request.getAssetId(),
                request.getBidderId()));
    }
}
