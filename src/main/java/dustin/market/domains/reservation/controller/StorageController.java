package dustin.market.domains.reservation.controller;

import java.math.BigDecimal;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.market.domains.reservation.model.dto.StorageBalanceResponse;
import dustin.market.domains.reservation.model.dto.StorageDepositRequest;
import dustin.market.domains.reservation.service.StorageDepositService;
import dustin.market.shared.context.RequestContexts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 스토리지 예치금 컨트롤러
 * Storage Controller
 *
 * API 엔드포인트:
 * - POST /api/market/storage/deposit            - 예치 (X-Attached-Deposit ≥ 단가)
 * - POST /api/market/storage/withdraw           - 인출 (X-Attached-Deposit = 1)
 * - GET  /api/market/storage/minimum-balance    - 예약 하나당 단가
 * - GET  /api/market/storage/{accountId}        - 예치금/예약 수 조회
 */
@RestController
@RequestMapping("/api/market/storage")
@RequiredArgsConstructor
@Tag(name = "Storage", description = "스토리지 예치금 API 엔드포인트")
public class StorageController {

    private final StorageDepositService storageDepositService;

    @Operation(
            summary = "스토리지 예치",
            description = "리스팅/오퍼/입찰 보증금을 예치합니다. 본문의 accountId를 생략하면 호출자 계정에 적립됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "예치 성공"),
            @ApiResponse(responseCode = "400", description = "예치금이 단가보다 적음")
    })
    @PostMapping("/deposit")
    public ResponseEntity<StorageBalanceResponse> deposit(
            @RequestBody(required = false) StorageDepositRequest request,
            HttpServletRequest httpRequest
    ) {
        String accountId = request != null ? request.getAccountId() : null;
        return ResponseEntity.ok(storageDepositService.deposit(RequestContexts.from(httpRequest), accountId));
    }

    @Operation(
            summary = "스토리지 인출",
            description = "활성 예약에 필요한 금액을 제외한 나머지를 돌려받습니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/withdraw")
    public ResponseEntity<StorageBalanceResponse> withdraw(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(storageDepositService.withdraw(RequestContexts.from(httpRequest)));
    }

    @GetMapping("/minimum-balance")
    public ResponseEntity<Map<String, BigDecimal>> minimumBalance() {
        return ResponseEntity.ok(Map.of("minimumBalance", storageDepositService.minimumBalance()));
    }

    @Operation(summary = "스토리지 예치금 조회", description = "예치금 잔고와 활성 리스팅/오퍼 수를 조회합니다.")
    @GetMapping("/{accountId}")
    public ResponseEntity<StorageBalanceResponse> balanceOf(@PathVariable String accountId) {
        return ResponseEntity.ok(storageDepositService.balanceOf(accountId));
    }
}
