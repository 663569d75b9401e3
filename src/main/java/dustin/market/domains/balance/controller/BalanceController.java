package dustin.market.domains.balance.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.balance.model.dto.BalanceResponse;
import dustin.market.domains.balance.model.dto.FundRequest;
import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.shared.context.CallContext;
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
 * 잔고 컨트롤러
 * Balance Controller
 *
 * API 엔드포인트:
 * - GET  /api/market/balances/{accountId} - 계정 잔고 조회
 * - POST /api/market/balances/fund        - 외부 입금 반영 (소유자 전용)
 */
@RestController
@RequestMapping("/api/market/balances")
@RequiredArgsConstructor
@Tag(name = "Balances", description = "잔고 API 엔드포인트")
public class BalanceController {

    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;

    @Operation(
            summary = "계정 잔고 조회",
            description = "계정의 네이티브 통화 잔고를 조회합니다. 행이 없는 계정은 0입니다."
    )
    @ApiResponse(
            responseCode = "200",
            description = "잔고 조회 성공",
            content = @Content(schema = @Schema(implementation = BalanceResponse.class))
    )
    @GetMapping("/{accountId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String accountId) {
        return ResponseEntity.ok(nativeLedgerService.getBalance(accountId));
    }

    /**
     * 외부 입금 반영
     * Fund an account
     *
     * 체인 밖에서 들어온 입금을 원장에 반영한다. 소유자만 호출 가능.
     */
    @Operation(
            summary = "외부 입금 반영",
            description = "외부 입금을 계정 잔고에 반영합니다. 마켓 소유자만 호출할 수 있습니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "반영 성공"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "403", description = "소유자가 아님")
    })
    @PostMapping("/fund")
    public ResponseEntity<BalanceResponse> fund(
            @Valid @RequestBody FundRequest request,
            HttpServletRequest httpRequest
    ) {
        CallContext context = RequestContexts.from(httpRequest);
        marketConfigService.requireOwner(context.getCallerId());
        return ResponseEntity.ok(nativeLedgerService.fund(request.getAccountId(), request.getAmount()));
    }
}
