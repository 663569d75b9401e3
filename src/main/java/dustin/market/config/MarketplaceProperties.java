package dustin.market.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * 마켓 설정
 * Marketplace Properties
 *
 * 역할:
 * - 마켓 에스크로 계정, 최초 소유자/재무 계정
 * - 기본 거래 수수료 (basis points)
 * - 스토리지 예치 단가
 * - 최초 승인 레지스트리/통화 목록
 *
 * 설정 방법:
 * - application.yml의 marketplace.* 에서 설정
 * - 소유자/재무/수수료는 최초 기동 시에만 반영되고 이후에는 소유자 전용 API로 변경
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    /**
     * 마켓 자신의 계정 (에스크로 보관)
     * Marketplace escrow account
     */
    private String accountId = "market.near";

    /**
     * 최초 소유자
     */
    private String ownerId = "owner.near";

    /**
     * 최초 재무 계정 (수수료 수령)
     */
    private String treasuryId = "treasury.near";

    /**
     * 네이티브 통화 식별자
     * Native currency identifier
     */
    private String nativeCurrency = "near";

    /**
     * 기본 거래 수수료 (bps, 200 = 2%)
     */
    private int transactionFeeBps = 200;

    /**
     * 리스팅/오퍼 하나당 스토리지 예치 단가
     */
    private BigDecimal storageUnitCost = new BigDecimal("8590000000000000000000");

    /**
     * 분배 수신자 최대 수
     */
    private int maxPayoutRecipients = 10;

    /**
     * 최초 승인 레지스트리
     */
    private List<String> approvedRegistries = new ArrayList<>();

    /**
     * 최초 승인 통화 (네이티브 통화는 항상 포함)
     */
    private List<String> approvedCurrencies = new ArrayList<>();
}
