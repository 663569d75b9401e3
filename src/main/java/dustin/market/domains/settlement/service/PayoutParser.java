package dustin.market.domains.settlement.service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.market.config.MarketplaceProperties;
import dustin.market.shared.context.Amounts;
import lombok.extern.slf4j.Slf4j;

/**
 * 분배 내역 파서
 * Payout Parser
 *
 * 역할:
 * - 레지스트리 응답을 수신자 → 금액 맵으로 해석
 * - 허용 형식: {"alice": "950", ...} 또는 {"payout": {"alice": "950", ...}}
 *   (맵 형식을 먼저 시도하고, 실패할 때만 감싼 형식을 시도)
 * - 금액은 10진수 문자열 또는 정수 JSON 숫자
 *
 * 유효 조건:
 * - price - 100 ≤ 합계 ≤ price
 * - 수신자 수 ≤ 요청한 최대 수신자 수
 * - 수신자 ID는 비어 있지 않고 계정 ID 최대 길이(128) 이하
 * 무효/해석 불가 응답은 empty (호출자는 "로열티 없음" 분기로 처리)
 */
@Slf4j
@Component
public class PayoutParser {

    private static final String ENVELOPE_FIELD = "payout";

    public static final int MAX_RECIPIENT_ID_LENGTH = 128;
    public static final int DEFAULT_MAX_RECIPIENTS = 10;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int maxRecipients;

    public PayoutParser() {
        this(DEFAULT_MAX_RECIPIENTS);
    }

    public PayoutParser(int maxRecipients) {
        this.maxRecipients = maxRecipients;
    }

    @Autowired
    public PayoutParser(MarketplaceProperties marketplaceProperties) {
        this(marketplaceProperties.getMaxPayoutRecipients());
    }

    public Optional<Map<String, BigDecimal>> parse(byte[] payload, BigDecimal price) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            log.debug("[PayoutParser] JSON 해석 실패: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        Optional<Map<String, BigDecimal>> bare = readAmountMap(root);
        if (bare.isPresent()) {
            return withinTolerance(bare.get(), price);
        }

        JsonNode envelope = root.get(ENVELOPE_FIELD);
        if (envelope == null || !envelope.isObject()) {
            return Optional.empty();
        }
        return readAmountMap(envelope).flatMap(payout -> withinTolerance(payout, price));
    }

    private Optional<Map<String, BigDecimal>> readAmountMap(JsonNode node) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!isUsableRecipient(field.getKey())) {
                log.debug("[PayoutParser] 사용할 수 없는 수신자 ID: length={}", field.getKey().length());
                return Optional.empty();
            }
            if (result.size() >= maxRecipients) {
                log.debug("[PayoutParser] 수신자 수 초과: max={}", maxRecipients);
                return Optional.empty();
            }
            Optional<BigDecimal> amount = readAmount(field.getValue());
            if (amount.isEmpty()) {
                return Optional.empty();
            }
            result.put(field.getKey(), amount.get());
        }
        return Optional.of(result);
    }

    private boolean isUsableRecipient(String recipientId) {
        return !recipientId.isBlank() && recipientId.length() <= MAX_RECIPIENT_ID_LENGTH;
    }

    private Optional<BigDecimal> readAmount(JsonNode value) {
        BigDecimal amount;
        if (value.isTextual()) {
            String text = value.asText();
            if (!text.matches("\\d+")) {
                return Optional.empty();
            }
            amount = new BigDecimal(text);
        } else if (value.isIntegralNumber()) {
            amount = new BigDecimal(value.bigIntegerValue());
        } else {
            return Optional.empty();
        }
        if (amount.signum() < 0 || !Amounts.isWhole(amount)) {
            return Optional.empty();
        }
        return Optional.of(amount);
    }

    private Optional<Map<String, BigDecimal>> withinTolerance(Map<String, BigDecimal> payout, BigDecimal price) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal amount : payout.values()) {
            sum = sum.add(amount);
        }
        if (sum.compareTo(price) > 0) {
            log.debug("[PayoutParser] 분배 합계가 가격 초과: sum={}, price={}", sum, price);
            return Optional.empty();
        }
        if (price.subtract(sum).compareTo(Amounts.PAYOUT_TOLERANCE) > 0) {
            log.debug("[PayoutParser] 분배 합계 부족: sum={}, price={}", sum, price);
            return Optional.empty();
        }
        return Optional.of(payout);
    }
}
