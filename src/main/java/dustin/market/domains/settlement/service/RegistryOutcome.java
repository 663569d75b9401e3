package dustin.market.domains.settlement.service;

import lombok.Getter;

/**
 * 레지스트리 호출 결과
 * Result of the transfer-and-report-payout call
 */
@Getter
public final class RegistryOutcome {

    private final boolean success;
    private final byte[] payload;
    private final String failureReason;

    private RegistryOutcome(boolean success, byte[] payload, String failureReason) {
        this.success = success;
        this.payload = payload;
        this.failureReason = failureReason;
    }

    public static RegistryOutcome success(byte[] payload) {
        return new RegistryOutcome(true, payload != null ? payload : new byte[0], null);
    }

    public static RegistryOutcome failure(String reason) {
        return new RegistryOutcome(false, new byte[0], reason);
    }
}
