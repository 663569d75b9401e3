package dustin.market.domains.offer.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.offer.model.dto.MakeOfferRequest;
import dustin.market.domains.offer.model.dto.OfferResponse;
import dustin.market.domains.offer.service.OfferService;
import dustin.market.shared.context.RequestContexts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 오퍼 컨트롤러
 * Offer Controller
 *
 * API 엔드포인트:
 * - POST   /api/market/offers                                  - 오퍼 제안 (X-Attached-Deposit = 제안가)
 * - DELETE /api/market/offers/{registryId}/{assetId}           - 오퍼 취소 (제안자, X-Attached-Deposit = 1)
 * - GET    /api/market/offers/{registryId}/{buyerId}/{assetId} - 오퍼 조회
 * - GET    /api/market/offers?buyerId=                         - 제안자별 오퍼 목록
 *
 * 오퍼 수락은 레지스트리 승인 콜백(market_type = accept_offer)으로 이루어진다.
 */
@RestController
@RequestMapping("/api/market/offers")
@RequiredArgsConstructor
@Tag(name = "Offer", description = "오퍼 API 엔드포인트")
public class OfferController {

    private final OfferService offerService;

    @Operation(
            summary = "오퍼 제안",
            description = "승인된 레지스트리의 자산에 네이티브 통화로 오퍼를 제안합니다. 같은 자산의 기존 오퍼는 환불 후 교체됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping
    public ResponseEntity<OfferResponse> makeOffer(
            @Valid @RequestBody MakeOfferRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(offerService.makeOffer(
                RequestContexts.from(httpRequest),
                request.getRegistryId(),
                request.getAssetId(),
                request.getCurrencyId(),
                request.getPrice()));
    }

    @Operation(summary = "오퍼 취소", security = @SecurityRequirement(name = "BearerAuth"))
    @DeleteMapping("/{registryId}/{assetId}")
    public ResponseEntity<Void> cancelOffer(
            @PathVariable String registryId,
            @PathVariable String assetId,
            HttpServletRequest httpRequest
    ) {
        offerService.cancelOffer(RequestContexts.from(httpRequest), registryId, assetId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{registryId}/{buyerId}/{assetId}")
    public ResponseEntity<OfferResponse> get(
            @PathVariable String registryId,
            @PathVariable String buyerId,
            @PathVariable String assetId
    ) {
        return ResponseEntity.ok(offerService.get(registryId, buyerId, assetId));
    }

    @GetMapping
    public ResponseEntity<List<OfferResponse>> listByBuyer(@RequestParam String buyerId) {
        return ResponseEntity.ok(offerService.listByBuyer(buyerId));
    }
}
