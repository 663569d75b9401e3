package dustin.market.domains.settlement.model.entity;

public enum TransferType {
    REFUND,
    SELLER,
    ROYALTY,
    FEE
}
