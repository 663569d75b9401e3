package dustin.market.domains.callback.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.callback.model.dto.ApprovalResult;
import dustin.market.domains.callback.model.dto.ApproveCallbackRequest;
import dustin.market.domains.callback.service.ApprovalCallbackService;
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
 * 레지스트리 콜백 컨트롤러
 * Callback Controller
 *
 * API 엔드포인트:
 * - POST /api/market/callbacks/nft-on-approve - 자산 승인 통지 (호출자 = 레지스트리)
 */
@RestController
@RequestMapping("/api/market/callbacks")
@RequiredArgsConstructor
@Tag(name = "Callback", description = "자산 레지스트리 콜백 API 엔드포인트")
public class CallbackController {

    private final ApprovalCallbackService approvalCallbackService;

    @Operation(
            summary = "자산 승인 통지",
            description = "레지스트리가 마켓에 자산을 승인한 뒤 호출합니다. msg의 market_type에 따라 리스팅을 만들거나 오퍼를 수락합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "처리 성공"),
            @ApiResponse(responseCode = "400", description = "메시지 형식 오류, 스토리지 부족 등"),
            @ApiResponse(responseCode = "403", description = "승인되지 않은 레지스트리")
    })
    @PostMapping("/nft-on-approve")
    public ResponseEntity<ApprovalResult> onApprove(
            @Valid @RequestBody ApproveCallbackRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(approvalCallbackService.onApprove(
                RequestContexts.from(httpRequest),
                request.getAssetId(),
                request.getOwnerId(),
                request.getApprovalId(),
                request.getMsg()));
    }
}
