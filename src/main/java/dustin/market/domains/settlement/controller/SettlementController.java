package dustin.market.domains.settlement.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.settlement.model.dto.SettlementResponse;
import dustin.market.domains.settlement.service.SettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 정산 조회 컨트롤러
 * Settlement Controller
 *
 * API 엔드포인트:
 * - GET /api/market/settlements/{id}                       - 정산 단건 조회
 * - GET /api/market/settlements?registryId=...&assetId=... - 자산별 정산 이력
 */
@RestController
@RequestMapping("/api/market/settlements")
@RequiredArgsConstructor
@Tag(name = "Settlements", description = "정산 조회 API 엔드포인트")
public class SettlementController {

    private final SettlementService settlementService;

    @Operation(
            summary = "정산 조회",
            description = "정산 상태, 해소 분기, 지급 내역을 조회합니다."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "조회 성공",
                    content = @Content(schema = @Schema(implementation = SettlementResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "정산을 찾을 수 없음")
    })
    @GetMapping("/{id}")
    public ResponseEntity<SettlementResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(settlementService.get(id));
    }

    @Operation(summary = "자산별 정산 이력", description = "최신 정산부터 반환합니다.")
    @GetMapping
    public ResponseEntity<List<SettlementResponse>> listByAsset(
            @RequestParam String registryId,
            @RequestParam String assetId
    ) {
        return ResponseEntity.ok(settlementService.listByAsset(registryId, assetId));
    }
}
