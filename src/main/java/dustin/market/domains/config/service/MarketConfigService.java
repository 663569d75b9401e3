package dustin.market.domains.config.service;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.config.MarketplaceProperties;
import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.model.dto.MarketConfigResponse;
import dustin.market.domains.config.model.entity.ApprovalKind;
import dustin.market.domains.config.model.entity.ApprovedAccount;
import dustin.market.domains.config.model.entity.MarketConfig;
import dustin.market.domains.config.repository.ApprovedAccountRepository;
import dustin.market.domains.config.repository.MarketConfigRepository;
import dustin.market.shared.context.CallContext;
import dustin.market.shared.exception.MarketException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마켓 설정 서비스
 * Market Config Service
 *
 * 역할:
 * - 소유자/재무 계정/수수료/승인 목록 관리
 * - 수수료 계산 (정산 해소 시점의 수수료율 사용)
 * - 네이티브 통화 판별
 *
 * 설정 변경 규칙:
 * - 정확히 1단위 예치금 첨부 (실수 호출 방지)
 * - 소유자만 호출 가능
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketConfigService {

    public static final int BPS_DENOMINATOR = 10_000;

    private final MarketConfigRepository marketConfigRepository;
    private final ApprovedAccountRepository approvedAccountRepository;
    private final NativeLedgerService nativeLedgerService;
    private final MarketplaceProperties marketplaceProperties;

    /**
     * 서버 시작 시 설정 행 생성
     * Create the config row on server startup
     */
    @PostConstruct
    public void init() {
        bootstrap();
    }

    /**
     * 설정이 없으면 MarketplaceProperties 값으로 초기화
     * 이미 있으면 승인 목록/에스크로 계정만 보충
     */
    @Transactional
    public void bootstrap() {
        if (marketConfigRepository.findById(MarketConfig.SINGLETON_ID).isEmpty()) {
            int feeBps = marketplaceProperties.getTransactionFeeBps();
            if (feeBps < 0 || feeBps >= BPS_DENOMINATOR) {
                throw new IllegalStateException("marketplace.transaction-fee-bps must be in [0, 10000): " + feeBps);
            }
            marketConfigRepository.save(MarketConfig.builder()
                    .id(MarketConfig.SINGLETON_ID)
                    .ownerId(marketplaceProperties.getOwnerId())
                    .treasuryId(marketplaceProperties.getTreasuryId())
                    .transactionFeeBps(feeBps)
                    .build());
            log.info("[MarketConfigService] 설정 초기화: owner={}, treasury={}, feeBps={}",
                    marketplaceProperties.getOwnerId(), marketplaceProperties.getTreasuryId(), feeBps);

            addAccounts(ApprovalKind.REGISTRY, marketplaceProperties.getApprovedRegistries());
            addAccounts(ApprovalKind.CURRENCY, marketplaceProperties.getApprovedCurrencies());
        }
        addAccounts(ApprovalKind.CURRENCY, List.of(marketplaceProperties.getNativeCurrency()));
        nativeLedgerService.ensureEscrowAccount();
    }

    // ===== 설정 변경 (소유자 전용) =====

    @Transactional
    public MarketConfigResponse setTreasury(CallContext context, String treasuryId) {
        MarketConfig config = lockOwnedConfig(context);
        config.setTreasuryId(requireAccountId(treasuryId));
        marketConfigRepository.save(config);
        log.info("[MarketConfigService] 재무 계정 변경: treasury={}", treasuryId);
        return getConfig();
    }

    @Transactional
    public MarketConfigResponse setTransactionFee(CallContext context, int nextFeeBps) {
        MarketConfig config = lockOwnedConfig(context);
        MarketException.check(nextFeeBps >= 0, "Error: fee must not be negative");
        MarketException.check(nextFeeBps < BPS_DENOMINATOR, "Error: fee is higher than 10_000");
        config.setTransactionFeeBps(nextFeeBps);
        marketConfigRepository.save(config);
        log.info("[MarketConfigService] 거래 수수료 변경: feeBps={}", nextFeeBps);
        return getConfig();
    }

    @Transactional
    public MarketConfigResponse transferOwnership(CallContext context, String ownerId) {
        MarketConfig config = lockOwnedConfig(context);
        String previous = config.getOwnerId();
        config.setOwnerId(requireAccountId(ownerId));
        marketConfigRepository.save(config);
        log.info("[MarketConfigService] 소유권 이전: {} -> {}", previous, ownerId);
        return getConfig();
    }

    @Transactional
    public MarketConfigResponse addApprovedRegistries(CallContext context, List<String> registryIds) {
        lockOwnedConfig(context);
        addAccounts(ApprovalKind.REGISTRY, registryIds);
        return getConfig();
    }

    @Transactional
    public MarketConfigResponse removeApprovedRegistries(CallContext context, List<String> registryIds) {
        lockOwnedConfig(context);
        for (String registryId : distinct(registryIds)) {
            long removed = approvedAccountRepository.deleteByKindAndAccountId(ApprovalKind.REGISTRY, registryId);
            if (removed > 0) {
                log.info("[MarketConfigService] 승인 레지스트리 제거: {}", registryId);
            }
        }
        return getConfig();
    }

    @Transactional
    public MarketConfigResponse addApprovedCurrencies(CallContext context, List<String> currencyIds) {
        lockOwnedConfig(context);
        addAccounts(ApprovalKind.CURRENCY, currencyIds);
        return getConfig();
    }

    // ===== 조회 =====

    @Transactional(readOnly = true)
    public MarketConfigResponse getConfig() {
        MarketConfig config = loadConfig();
        return MarketConfigResponse.builder()
                .ownerId(config.getOwnerId())
                .treasuryId(config.getTreasuryId())
                .transactionFeeBps(config.getTransactionFeeBps())
                .approvedRegistries(listAccounts(ApprovalKind.REGISTRY))
                .approvedCurrencies(listAccounts(ApprovalKind.CURRENCY))
                .build();
    }

    @Transactional(readOnly = true)
    public int getTransactionFeeBps() {
        return loadConfig().getTransactionFeeBps();
    }

    @Transactional(readOnly = true)
    public String getOwnerId() {
        return loadConfig().getOwnerId();
    }

    @Transactional(readOnly = true)
    public String getTreasuryId() {
        return loadConfig().getTreasuryId();
    }

    @Transactional(readOnly = true)
    public List<String> getApprovedRegistries() {
        return listAccounts(ApprovalKind.REGISTRY);
    }

    @Transactional(readOnly = true)
    public List<String> getApprovedCurrencies() {
        return listAccounts(ApprovalKind.CURRENCY);
    }

    // ===== 다른 도메인에서 사용하는 검증/계산 =====

    /**
     * 수수료 계산
     * Calculate the platform fee: price * bps / 10000, rounded down
     */
    @Transactional(readOnly = true)
    public BigDecimal calculateFee(BigDecimal price) {
        return calculateFee(price, getTransactionFeeBps());
    }

    public static BigDecimal calculateFee(BigDecimal price, int feeBps) {
        return price.multiply(BigDecimal.valueOf(feeBps))
                .divideToIntegralValue(BigDecimal.valueOf(BPS_DENOMINATOR))
                .setScale(0);
    }

    public boolean isNative(String currencyId) {
        return marketplaceProperties.getNativeCurrency().equals(currencyId);
    }

    public String nativeCurrency() {
        return marketplaceProperties.getNativeCurrency();
    }

    @Transactional(readOnly = true)
    public boolean isApprovedRegistry(String registryId) {
        return approvedAccountRepository.existsByKindAndAccountId(ApprovalKind.REGISTRY, registryId);
    }

    @Transactional(readOnly = true)
    public void requireApprovedRegistry(String registryId, String message) {
        if (!isApprovedRegistry(registryId)) {
            throw MarketException.forbidden(message);
        }
    }

    @Transactional(readOnly = true)
    public boolean isApprovedCurrency(String currencyId) {
        return isNative(currencyId)
                || approvedAccountRepository.existsByKindAndAccountId(ApprovalKind.CURRENCY, currencyId);
    }

    @Transactional(readOnly = true)
    public boolean isOwner(String accountId) {
        return loadConfig().getOwnerId().equals(accountId);
    }

    @Transactional(readOnly = true)
    public void requireOwner(String accountId) {
        if (!isOwner(accountId)) {
            throw MarketException.forbidden("Error: Owner only");
        }
    }

    // ===== 내부 =====

    private MarketConfig lockOwnedConfig(CallContext context) {
        nativeLedgerService.requireOneUnit(context);
        MarketConfig config = marketConfigRepository.findByIdForUpdate(MarketConfig.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Market config is not initialised"));
        if (!config.getOwnerId().equals(context.getCallerId())) {
            throw MarketException.forbidden("Error: Owner only");
        }
        return config;
    }

    private MarketConfig loadConfig() {
        return marketConfigRepository.findById(MarketConfig.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Market config is not initialised"));
    }

    private void addAccounts(ApprovalKind kind, List<String> accountIds) {
        for (String accountId : distinct(accountIds)) {
            if (!approvedAccountRepository.existsByKindAndAccountId(kind, accountId)) {
                approvedAccountRepository.save(ApprovedAccount.builder()
                        .kind(kind)
                        .accountId(accountId)
                        .build());
                log.info("[MarketConfigService] 승인 목록 추가: kind={}, account={}", kind, accountId);
            }
        }
    }

    private List<String> listAccounts(ApprovalKind kind) {
        return approvedAccountRepository.findByKindOrderByIdAsc(kind).stream()
                .map(ApprovedAccount::getAccountId)
                .collect(Collectors.toList());
    }

    private Set<String> distinct(List<String> accountIds) {
        Set<String> result = new LinkedHashSet<>();
        if (accountIds == null) {
            return result;
        }
        for (String accountId : accountIds) {
            result.add(requireAccountId(accountId));
        }
        return result;
    }

    private String requireAccountId(String accountId) {
        MarketException.check(accountId != null && !accountId.isBlank(), "Error: account id must not be blank");
        return accountId.trim();
    }
}
