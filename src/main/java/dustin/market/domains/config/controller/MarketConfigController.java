package dustin.market.domains.config.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.config.model.dto.AccountIdRequest;
import dustin.market.domains.config.model.dto.ApprovedAccountsRequest;
import dustin.market.domains.config.model.dto.MarketConfigResponse;
import dustin.market.domains.config.model.dto.TransactionFeeRequest;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.shared.context.RequestContexts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 마켓 설정 컨트롤러
 * Market Config Controller
 *
 * API 엔드포인트:
 * - GET  /api/market/config                          - 전체 설정 조회
 * - GET  /api/market/config/fee | owner | treasury   - 개별 조회
 * - GET  /api/market/config/approved-registries      - 승인 레지스트리 조회
 * - GET  /api/market/config/approved-currencies      - 승인 통화 조회
 * - PUT  /api/market/config/treasury                 - 재무 계정 변경 (소유자, 1단위 예치금)
 * - PUT  /api/market/config/fee                      - 수수료 변경 (소유자, 1단위 예치금)
 * - PUT  /api/market/config/owner                    - 소유권 이전 (소유자, 1단위 예치금)
 * - POST /api/market/config/approved-registries        - 레지스트리 승인 추가
 * - POST /api/market/config/approved-registries/remove - 레지스트리 승인 제거
 * - POST /api/market/config/approved-currencies        - 통화 승인 추가
 */
@RestController
@RequestMapping("/api/market/config")
@RequiredArgsConstructor
@Tag(name = "Config", description = "마켓 설정 API 엔드포인트")
public class MarketConfigController {

    private final MarketConfigService marketConfigService;

    @Operation(summary = "마켓 설정 조회", description = "소유자, 재무 계정, 수수료, 승인 목록을 조회합니다.")
    @ApiResponse(
            responseCode = "200",
            description = "조회 성공",
            content = @Content(schema = @Schema(implementation = MarketConfigResponse.class))
    )
    @GetMapping
    public ResponseEntity<MarketConfigResponse> getConfig() {
        return ResponseEntity.ok(marketConfigService.getConfig());
    }

    @GetMapping("/fee")
    public ResponseEntity<Map<String, Integer>> getTransactionFee() {
        return ResponseEntity.ok(Map.of("transactionFeeBps", marketConfigService.getTransactionFeeBps()));
    }

    @GetMapping("/owner")
    public ResponseEntity<Map<String, String>> getOwner() {
        return ResponseEntity.ok(Map.of("ownerId", marketConfigService.getOwnerId()));
    }

    @GetMapping("/treasury")
    public ResponseEntity<Map<String, String>> getTreasury() {
        return ResponseEntity.ok(Map.of("treasuryId", marketConfigService.getTreasuryId()));
    }

    @GetMapping("/approved-registries")
    public ResponseEntity<List<String>> getApprovedRegistries() {
        return ResponseEntity.ok(marketConfigService.getApprovedRegistries());
    }

    @GetMapping("/approved-currencies")
    public ResponseEntity<List<String>> getApprovedCurrencies() {
        return ResponseEntity.ok(marketConfigService.getApprovedCurrencies());
    }

    /**
     * 재무 계정 변경
     * Set Treasury
     *
     * 요구사항:
     * - X-Attached-Deposit: 1
     * - 호출자 = 소유자
     */
    @Operation(
            summary = "재무 계정 변경",
            description = "수수료를 받을 재무 계정을 변경합니다. X-Attached-Deposit 헤더에 정확히 1을 첨부해야 합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "400", description = "예치금이 1이 아님"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "403", description = "소유자가 아님")
    })
    @PutMapping("/treasury")
    public ResponseEntity<MarketConfigResponse> setTreasury(
            @Valid @RequestBody AccountIdRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.setTreasury(
                RequestContexts.from(httpRequest), request.getAccountId()));
    }

    @Operation(
            summary = "거래 수수료 변경",
            description = "거래 수수료(bps)를 변경합니다. 10000 미만이어야 하며 1단위 예치금이 필요합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PutMapping("/fee")
    public ResponseEntity<MarketConfigResponse> setTransactionFee(
            @Valid @RequestBody TransactionFeeRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.setTransactionFee(
                RequestContexts.from(httpRequest), request.getFeeBps()));
    }

    @Operation(summary = "소유권 이전", security = @SecurityRequirement(name = "BearerAuth"))
    @PutMapping("/owner")
    public ResponseEntity<MarketConfigResponse> transferOwnership(
            @Valid @RequestBody AccountIdRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.transferOwnership(
                RequestContexts.from(httpRequest), request.getAccountId()));
    }

    @Operation(summary = "레지스트리 승인 추가", security = @SecurityRequirement(name = "BearerAuth"))
    @PostMapping("/approved-registries")
    public ResponseEntity<MarketConfigResponse> addApprovedRegistries(
            @Valid @RequestBody ApprovedAccountsRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.addApprovedRegistries(
                RequestContexts.from(httpRequest), request.getAccountIds()));
    }

    @Operation(summary = "레지스트리 승인 제거", security = @SecurityRequirement(name = "BearerAuth"))
    @PostMapping("/approved-registries/remove")
    public ResponseEntity<MarketConfigResponse> removeApprovedRegistries(
            @Valid @RequestBody ApprovedAccountsRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.removeApprovedRegistries(
                RequestContexts.from(httpRequest), request.getAccountIds()));
    }

    @Operation(summary = "통화 승인 추가", security = @SecurityRequirement(name = "BearerAuth"))
    @PostMapping("/approved-currencies")
    public ResponseEntity<MarketConfigResponse> addApprovedCurrencies(
            @Valid @RequestBody ApprovedAccountsRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(marketConfigService.addApprovedCurrencies(
                RequestContexts.from(httpRequest), request.getAccountIds()));
    }
}
