package dustin.market.domains.settlement.model.entity;

/**
 * 정산 상태
 * Settlement Status
 *
 * SCHEDULED → RESOLVED_PAID | RESOLVED_REFUNDED (종료 상태는 다시 바뀌지 않음)
 */
public enum SettlementStatus {
    SCHEDULED,
    RESOLVED_PAID,
    RESOLVED_REFUNDED
}
