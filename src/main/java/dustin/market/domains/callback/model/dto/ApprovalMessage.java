package dustin.market.domains.callback.model.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 승인 메시지 (msg 필드의 JSON)
 * Approval Message
 *
 * 예시:
 * - {"market_type":"sale","price":"1000","ft_token_id":"near","is_auction":true,
 *    "started_at":"1700000000000000000","ended_at":"1700086400000000000"}
 * - {"market_type":"accept_offer","buyer_id":"bob.near","price":"1000"}
 *
 * started_at/ended_at은 epoch 나노초 (숫자 또는 10진수 문자열).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApprovalMessage {

    public static final String SALE = "sale";
    public static final String ACCEPT_OFFER = "accept_offer";

    @JsonProperty("market_type")
    private String marketType;

    private BigDecimal price;

    @JsonProperty("ft_token_id")
    private String currencyId;

    @JsonProperty("buyer_id")
    private String buyerId;

    @JsonProperty("started_at")
    private Long startedAtNanos;

    @JsonProperty("ended_at")
    private Long endedAtNanos;

    @JsonProperty("is_auction")
    private Boolean isAuction;
}
