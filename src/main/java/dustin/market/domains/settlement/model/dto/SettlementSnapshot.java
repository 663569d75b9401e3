package dustin.market.domains.settlement.model.dto;

import java.math.BigDecimal;

import dustin.market.domains.settlement.model.entity.SettlementKind;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 정산 스냅샷
 * Settlement Snapshot
 *
 * 예약 시점에 삭제된 리스팅/오퍼의 값. 해소 단계는 저장소를 다시 읽지 않고 이 값만 사용한다.
 */
@Getter
@Builder
@ToString
public final class SettlementSnapshot {

    private final SettlementKind kind;

    /** 판매자 (리스팅 소유자 또는 오퍼 수락자) */
    private final String sellerId;

    /** 구매자 (구매자, 낙찰자, 오퍼 제안자) */
    private final String buyerId;

    private final String registryId;
    private final String assetId;
    private final String currencyId;
    private final long approvalId;

    /** 분배 총액 (에스크로에 보관된 금액) */
    private final BigDecimal price;
}
