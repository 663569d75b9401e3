package dustin.market.domains.balance.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.config.MarketplaceProperties;
import dustin.market.domains.balance.model.dto.BalanceResponse;
import dustin.market.domains.balance.model.entity.AccountBalance;
import dustin.market.domains.balance.repository.AccountBalanceRepository;
import dustin.market.shared.context.Amounts;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 네이티브 통화 원장 서비스
 * Native Ledger Service
 *
 * 역할:
 * - 호출에 첨부된 예치금을 호출자 계정에서 마켓 에스크로로 이동
 * - 에스크로에서 환불/지급 (에스크로 → 수령자)
 * - 외부 입금 반영 (fund)
 *
 * 락 순서:
 * - 상태를 바꾸는 모든 트랜잭션은 다른 행(리스팅, 오퍼, 잔고, 스토리지)보다 에스크로 행을 먼저 잠근다
 * - 리스팅/오퍼를 먼저 읽어야 하는 호출은 시작 시 {@link #lockEscrow()}를 호출한다
 * - 에스크로가 트랜잭션 간 단일 진입점이 되어 행 간 교착이 생기지 않음
 *
 * 주의사항:
 * - 호출자 트랜잭션에 참여 (MANDATORY 아님, 단독 호출 시 자체 트랜잭션)
 * - 잔고 부족은 MarketException → 호출 전체 롤백
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NativeLedgerService {

    private final AccountBalanceRepository accountBalanceRepository;
    private final MarketplaceProperties marketplaceProperties;

    /**
     * 첨부 예치금 수령
     * Collect the attached deposit into escrow
     *
     * @return 수령한 금액 (0이면 아무것도 하지 않음)
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public BigDecimal collectDeposit(CallContext context) {
        return collectDeposit(context.getCallerId(), context.getAttachedDeposit());
    }

    @Transactional(propagation = Propagation.REQUIRED)
    public BigDecimal collectDeposit(String accountId, BigDecimal amount) {
        Amounts.requireWhole(amount, "attached deposit");
        if (amount.signum() == 0) {
            return BigDecimal.ZERO;
        }

        AccountBalance escrow = lockEscrow();
        if (escrow.getAccountId().equals(accountId)) {
            return amount;
        }
        AccountBalance payer = accountBalanceRepository.findByAccountIdForUpdate(accountId)
                .orElseThrow(() -> MarketException.badRequest(
                        "Error: insufficient balance for attached deposit: " + accountId));

        if (payer.getBalance().compareTo(amount) < 0) {
            throw MarketException.badRequest("Error: insufficient balance for attached deposit: "
                    + accountId + " has " + payer.getBalance().toPlainString()
                    + ", needs " + amount.toPlainString());
        }

        payer.setBalance(payer.getBalance().subtract(amount));
        escrow.setBalance(escrow.getBalance().add(amount));
        accountBalanceRepository.save(payer);
        accountBalanceRepository.save(escrow);

        log.debug("[NativeLedgerService] 예치금 수령: account={}, amount={}", accountId, amount.toPlainString());
        return amount;
    }

    /**
     * 정확히 1단위 예치금 요구 후 수령
     * Require (and collect) an attached deposit of exactly one unit
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public void requireOneUnit(CallContext context) {
        MarketException.check(Amounts.ONE_UNIT.compareTo(context.getAttachedDeposit()) == 0,
                "Error: requires attached deposit of exactly 1 unit");
        collectDeposit(context);
    }

    /**
     * 에스크로에서 지급
     * Transfer from escrow to a payee
     *
     * @param payeeId 수령자 (처음 받는 계정은 행을 새로 만든다)
     * @param amount 금액 (0이면 아무것도 하지 않음)
     * @return 잔고가 실제로 이동했으면 true (금액 0 또는 수령자가 에스크로 자신이면 false)
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public boolean transfer(String payeeId, BigDecimal amount) {
        Amounts.requireWhole(amount, "transfer amount");
        if (amount.signum() == 0) {
            return false;
        }

        AccountBalance escrow = lockEscrow();
        if (escrow.getAccountId().equals(payeeId)) {
            return false;
        }
        if (escrow.getBalance().compareTo(amount) < 0) {
            // 에스크로 부족은 원장 불변식 위반
            log.error("[NativeLedgerService] 에스크로 잔고 부족: escrow={}, amount={}, payee={}",
                    escrow.getBalance().toPlainString(), amount.toPlainString(), payeeId);
            throw new IllegalStateException("Escrow balance is lower than the transfer amount");
        }

        AccountBalance payee = lockOrCreate(payeeId);
        escrow.setBalance(escrow.getBalance().subtract(amount));
        payee.setBalance(payee.getBalance().add(amount));
        accountBalanceRepository.save(escrow);
        accountBalanceRepository.save(payee);

        log.debug("[NativeLedgerService] 지급: payee={}, amount={}", payeeId, amount.toPlainString());
        return true;
    }

    /**
     * 외부 입금 반영
     * Credit an account from outside the marketplace
     */
    @Transactional
    public BalanceResponse fund(String accountId, BigDecimal amount) {
        Amounts.requireWhole(amount, "amount");
        lockEscrow();
        AccountBalance account = lockOrCreate(accountId);
        account.setBalance(account.getBalance().add(amount));
        AccountBalance saved = accountBalanceRepository.save(account);
        log.info("[NativeLedgerService] 입금 반영: account={}, amount={}", accountId, amount.toPlainString());
        return toResponse(saved);
    }

    /**
     * 잔고 조회 (행이 없으면 0)
     */
    @Transactional(readOnly = true)
    public BigDecimal balanceOf(String accountId) {
        return accountBalanceRepository.findByAccountId(accountId)
                .map(AccountBalance::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public BalanceResponse getBalance(String accountId) {
        return BalanceResponse.builder()
                .accountId(accountId)
                .balance(balanceOf(accountId))
                .build();
    }

    /**
     * 에스크로 계정 행 생성 (최초 기동)
     */
    @Transactional
    public void ensureEscrowAccount() {
        String escrowId = marketplaceProperties.getAccountId();
        if (accountBalanceRepository.findByAccountId(escrowId).isEmpty()) {
            accountBalanceRepository.save(AccountBalance.builder()
                    .accountId(escrowId)
                    .balance(BigDecimal.ZERO)
                    .build());
            log.info("[NativeLedgerService] 에스크로 계정 생성: {}", escrowId);
        }
    }

    /**
     * 에스크로 행 잠금
     * Lock the escrow row (first lock of every mutating transaction)
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public AccountBalance lockEscrow() {
        String escrowId = marketplaceProperties.getAccountId();
        return accountBalanceRepository.findByAccountIdForUpdate(escrowId)
                .orElseGet(() -> accountBalanceRepository.save(AccountBalance.builder()
                        .accountId(escrowId)
                        .balance(BigDecimal.ZERO)
                        .build()));
    }

    private AccountBalance lockOrCreate(String accountId) {
        return accountBalanceRepository.findByAccountIdForUpdate(accountId)
                .orElseGet(() -> AccountBalance.builder()
                        .accountId(accountId)
                        .balance(BigDecimal.ZERO)
                        .build());
    }

    private BalanceResponse toResponse(AccountBalance balance) {
        return BalanceResponse.builder()
                .accountId(balance.getAccountId())
                .balance(balance.getBalance())
                .build();
    }
}
