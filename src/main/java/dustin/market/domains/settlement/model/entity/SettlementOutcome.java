package dustin.market.domains.settlement.model.entity;

/**
 * 정산 해소 분기
 * Settlement resolution branch
 */
public enum SettlementOutcome {
    /** 레지스트리 호출 실패 → 구매자 전액 환불 */
    REGISTRY_FAILED,
    /** 분배 내역 없음/무효 → 판매자(가격-수수료) + 재무(수수료) */
    NO_ROYALTIES,
    /** 유효한 분배 내역 → 수신자별 지급, 판매자 몫에서 수수료 차감 */
    PAYOUT
}
