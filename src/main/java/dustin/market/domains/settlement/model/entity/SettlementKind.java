package dustin.market.domains.settlement.model.entity;

/**
 * 정산 발생 경로
 * PURCHASE: 직접 구매 또는 경매 낙찰 / OFFER: 오퍼 수락
 */
public enum SettlementKind {
    PURCHASE,
    OFFER
}
