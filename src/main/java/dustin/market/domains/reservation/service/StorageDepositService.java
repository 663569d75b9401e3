package dustin.market.domains.reservation.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.config.MarketplaceProperties;
import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.reservation.model.dto.StorageBalanceResponse;
import dustin.market.domains.reservation.model.entity.StorageDeposit;
import dustin.market.domains.reservation.repository.StorageDepositRepository;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 스토리지 예치금 서비스
 * Storage Deposit Service
 *
 * 역할:
 * - 예약(리스팅/오퍼/입찰) 생성 전 보증금 확인
 * - 예치 / 인출 / 조회
 *
 * 필요 금액 = 활성 예약 수 × 단가 (marketplace.storage-unit-cost)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageDepositService {

    private final StorageDepositRepository storageDepositRepository;
    private final ReservationIndexService reservationIndexService;
    private final NativeLedgerService nativeLedgerService;
    private final MarketplaceProperties marketplaceProperties;

    /**
     * 스토리지 예치
     * Storage deposit
     *
     * @param context 호출자 + 첨부 예치금 (단가 이상)
     * @param accountId 적립 대상 (null이면 호출자)
     */
    @Transactional
    public StorageBalanceResponse deposit(CallContext context, String accountId) {
        String target = (accountId == null || accountId.isBlank()) ? context.getCallerId() : accountId;
        BigDecimal unit = minimumBalance();
        BigDecimal amount = context.getAttachedDeposit();

        MarketException.check(amount.compareTo(unit) >= 0,
                "Requires minimum deposit of " + unit.toPlainString());

        nativeLedgerService.collectDeposit(context);

        StorageDeposit deposit = storageDepositRepository.findByAccountIdForUpdate(target)
                .orElseGet(() -> StorageDeposit.builder()
                        .accountId(target)
                        .balance(BigDecimal.ZERO)
                        .build());
        deposit.setBalance(deposit.getBalance().add(amount));
        storageDepositRepository.save(deposit);

        log.info("[StorageDepositService] 스토리지 예치: payer={}, account={}, amount={}, balance={}",
                context.getCallerId(), target, amount.toPlainString(), deposit.getBalance().toPlainString());
        return balanceOf(target);
    }

    /**
     * 스토리지 인출
     * Storage withdraw
     *
     * 활성 예약에 필요한 금액은 남기고 나머지를 돌려준다.
     * 잔고가 필요 금액보다 적으면 거부한다.
     */
    @Transactional
    public StorageBalanceResponse withdraw(CallContext context) {
        nativeLedgerService.requireOneUnit(context);
        String accountId = context.getCallerId();

        StorageDeposit deposit = storageDepositRepository.findByAccountIdForUpdate(accountId).orElse(null);
        BigDecimal balance = deposit != null ? deposit.getBalance() : BigDecimal.ZERO;
        BigDecimal required = requiredFor(reservationIndexService.count(accountId));

        MarketException.check(balance.compareTo(required) >= 0,
                "Error: storage balance " + balance.toPlainString()
                        + " is lower than required " + required.toPlainString());

        BigDecimal refund = balance.subtract(required);
        if (refund.signum() > 0) {
            nativeLedgerService.transfer(accountId, refund);
        }

        if (deposit != null) {
            if (required.signum() > 0) {
                deposit.setBalance(required);
                storageDepositRepository.save(deposit);
            } else {
                storageDepositRepository.delete(deposit);
            }
        }

        log.info("[StorageDepositService] 스토리지 인출: account={}, refund={}, kept={}",
                accountId, refund.toPlainString(), required.toPlainString());
        return balanceOf(accountId);
    }

    /**
     * 예약 하나를 더 만들 수 있는지 확인
     * Require storage to cover the account's reservations plus one
     *
     * @param label 오류 메시지용 (listing, offer, bid)
     */
    @Transactional(readOnly = true)
    public void requireQuotaForOneMore(String accountId, String label) {
        BigDecimal unit = minimumBalance();
        BigDecimal paid = storageBalance(accountId);
        BigDecimal required = requiredFor(reservationIndexService.count(accountId) + 1);

        if (paid.compareTo(required) < 0) {
            throw MarketException.badRequest("Insufficient storage paid: " + paid.toPlainString()
                    + ", for " + required.divideToIntegralValue(unit).toBigInteger() + " " + label
                    + " at " + unit.toPlainString() + " rate of per " + label);
        }
    }

    // ===== 조회 =====

    public BigDecimal minimumBalance() {
        return marketplaceProperties.getStorageUnitCost();
    }

    @Transactional(readOnly = true)
    public BigDecimal storageBalance(String accountId) {
        return storageDepositRepository.findByAccountId(accountId)
                .map(StorageDeposit::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public long supplyByOwner(String accountId) {
        return reservationIndexService.count(accountId);
    }

    @Transactional(readOnly = true)
    public StorageBalanceResponse balanceOf(String accountId) {
        long supply = reservationIndexService.count(accountId);
        return StorageBalanceResponse.builder()
                .accountId(accountId)
                .balance(storageBalance(accountId))
                .supply(supply)
                .required(requiredFor(supply))
                .build();
    }

    private BigDecimal requiredFor(long reservations) {
        return minimumBalance().multiply(BigDecimal.valueOf(reservations));
    }
}
