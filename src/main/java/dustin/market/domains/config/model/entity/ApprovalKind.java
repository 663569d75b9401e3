package dustin.market.domains.config.model.entity;

/**
 * 승인 목록 종류
 */
public enum ApprovalKind {
    REGISTRY,
    CURRENCY
}
