package dustin.market.domains.listing.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.listing.model.dto.BuyRequest;
import dustin.market.domains.listing.model.dto.ListingResponse;
import dustin.market.domains.listing.model.dto.UpdatePriceRequest;
import dustin.market.domains.listing.service.ListingService;
import dustin.market.domains.settlement.service.PurchaseService;
import dustin.market.shared.context.RequestContexts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 리스팅 컨트롤러
 * Listing Controller
 *
 * API 엔드포인트:
 * - GET    /api/market/listings/{registryId}/{assetId}  - 리스팅 조회
 * - GET    /api/market/listings?ownerId=                - 판매자별 리스팅 목록
 * - PUT    /api/market/listings/price                   - 가격 변경 (판매자, X-Attached-Deposit = 1)
 * - DELETE /api/market/listings/{registryId}/{assetId}  - 리스팅 삭제 (판매자/소유자, X-Attached-Deposit = 1)
 * - POST   /api/market/listings/buy                     - 고정가 구매 (X-Attached-Deposit ≥ 가격)
 *
 * 리스팅 생성은 레지스트리 승인 콜백(/api/market/callbacks/nft-on-approve)으로만 이루어진다.
 */
@RestController
@RequestMapping("/api/market/listings")
@RequiredArgsConstructor
@Tag(name = "Listing", description = "리스팅 API 엔드포인트")
public class ListingController {

    private final ListingService listingService;
    private final PurchaseService purchaseService;

    @Operation(summary = "리스팅 조회", description = "(registry, asset) 리스팅을 조회합니다. 경매가 아니면 bids는 비어 있습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "리스팅 없음")
    })
    @GetMapping("/{registryId}/{assetId}")
    public ResponseEntity<ListingResponse> get(@PathVariable String registryId, @PathVariable String assetId) {
        return ResponseEntity.ok(listingService.get(registryId, assetId));
    }

    @Operation(summary = "판매자별 리스팅 목록")
    @GetMapping
    public ResponseEntity<List<ListingResponse>> listByOwner(@RequestParam String ownerId) {
        return ResponseEntity.ok(listingService.listByOwner(ownerId));
    }

    @Operation(
            summary = "가격 변경",
            description = "판매자만 가격을 변경할 수 있습니다. 통화는 리스팅 통화와 같아야 합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PutMapping("/price")
    public ResponseEntity<ListingResponse> updatePrice(
            @Valid @RequestBody UpdatePriceRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(listingService.updatePrice(
                RequestContexts.from(httpRequest),
                request.getRegistryId(),
                request.getAssetId(),
                request.getCurrencyId(),
                request.getPrice()));
    }

    @Operation(
            summary = "리스팅 삭제",
            description = "판매자 또는 마켓 소유자가 리스팅을 삭제합니다. 남은 입찰은 모두 환불됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @DeleteMapping("/{registryId}/{assetId}")
    public ResponseEntity<Void> delete(
            @PathVariable String registryId,
            @PathVariable String assetId,
            HttpServletRequest httpRequest
    ) {
        listingService.delete(RequestContexts.from(httpRequest), registryId, assetId);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "고정가 구매",
            description = "리스팅 가격 이상을 첨부해 구매합니다. 자산 이전은 비동기로 정산되며 정산 ID를 반환합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "구매 접수, 정산 예약됨"),
            @ApiResponse(responseCode = "400", description = "가격 부족, 판매 기간 외, 경매 리스팅 등")
    })
    @PostMapping("/buy")
    public ResponseEntity<Map<String, Long>> buy(
            @Valid @RequestBody BuyRequest request,
            HttpServletRequest httpRequest
    ) {
        Long settlementId = purchaseService.buy(
                RequestContexts.from(httpRequest),
                request.getRegistryId(),
                request.getAssetId(),
                request.getCurrencyId(),
                request.getPrice());
        return ResponseEntity.ok(Map.of("settlementId", settlementId));
    }
}
