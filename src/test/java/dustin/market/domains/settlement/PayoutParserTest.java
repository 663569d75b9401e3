package dustin.market.domains.settlement;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.market.domains.settlement.service.PayoutParser;

/**
 * 분배 내역 파서 테스트
 * PayoutParser Test
 *
 * 목적:
 * - 두 가지 응답 형식(맵, {"payout": 맵})을 모두 인식하는지 검증
 * - 합계 허용 범위 (price - 100 ≤ sum ≤ price) 검증
 * - 해석 불가 응답은 empty
 */
class PayoutParserTest {

    private static final BigDecimal PRICE = BigDecimal.valueOf(1000);

    private final PayoutParser parser = new PayoutParser();

    private Optional<Map<String, BigDecimal>> parse(String body) {
        return parser.parse(body.getBytes(StandardCharsets.UTF_8), PRICE);
    }

    @Test
    @DisplayName("맵 형식 응답")
    void bareMap() {
        Optional<Map<String, BigDecimal>> payout = parse("{\"alice.near\":\"950\",\"artist.near\":\"50\"}");

        assertThat(payout).isPresent();
        assertThat(payout.get()).containsOnlyKeys("alice.near", "artist.near");
        assertThat(payout.get().get("alice.near")).isEqualByComparingTo("950");
    }

    @Test
    @DisplayName("감싼 형식 응답")
    void envelope() {
        Optional<Map<String, BigDecimal>> payout =
                parse("{\"payout\":{\"alice.near\":\"950\",\"artist.near\":\"50\"}}");

        assertThat(payout).isPresent();
        assertThat(payout.get().get("artist.near")).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("정수 JSON 숫자 금액도 허용")
    void integralNumbers() {
        assertThat(parse("{\"alice.near\":1000}")).isPresent();
    }

    @Test
    @DisplayName("합계가 가격 - 100 이상이면 유효, 미만이면 무효")
    void tolerance() {
        assertThat(parse("{\"alice.near\":\"900\"}")).isPresent();
        assertThat(parse("{\"alice.near\":\"899\"}")).isEmpty();
    }

    @Test
    @DisplayName("합계가 가격을 넘으면 무효")
    void sumAbovePrice() {
        assertThat(parse("{\"alice.near\":\"950\",\"artist.near\":\"51\"}")).isEmpty();
    }

    @Test
    @DisplayName("금액 하나라도 숫자가 아니면 전체 무효")
    void invalidAmount() {
        assertThat(parse("{\"alice.near\":\"950\",\"artist.near\":\"fifty\"}")).isEmpty();
        assertThat(parse("{\"alice.near\":\"-1000\"}")).isEmpty();
        assertThat(parse("{\"alice.near\":950.5,\"artist.near\":\"50\"}")).isEmpty();
    }

    @Test
    @DisplayName("빈 응답, JSON이 아닌 응답, 객체가 아닌 응답은 empty")
    void garbage() {
        assertThat(parser.parse(new byte[0], PRICE)).isEmpty();
        assertThat(parser.parse(null, PRICE)).isEmpty();
        assertThat(parse("not json")).isEmpty();
        assertThat(parse("[\"alice.near\"]")).isEmpty();
        assertThat(parse("{\"payout\":\"alice.near\"}")).isEmpty();
    }

    @Test
    @DisplayName("빈 수신자 ID 또는 128자를 넘는 수신자 ID가 있으면 무효")
    void unusableRecipientId() {
        assertThat(parse("{\"alice.near\":\"950\",\"\":\"50\"}")).isEmpty();
        assertThat(parse("{\"alice.near\":\"950\",\"" + "r".repeat(129) + "\":\"50\"}")).isEmpty();
        assertThat(parse("{\"payout\":{\"alice.near\":\"950\",\"" + "r".repeat(200) + "\":\"50\"}}")).isEmpty();
        assertThat(parse("{\"alice.near\":\"950\",\"" + "r".repeat(128) + "\":\"50\"}")).isPresent();
    }

    @Test
    @DisplayName("최대 수신자 수를 넘으면 무효")
    void tooManyRecipients() {
        assertThat(parse(payoutOf(10, 100))).isPresent();
        assertThat(parse(payoutOf(11, 90))).isEmpty();
        assertThat(new PayoutParser(2).parse(payoutOf(3, 300).getBytes(StandardCharsets.UTF_8), BigDecimal.valueOf(900)))
                .isEmpty();
    }

    private String payoutOf(int recipients, long each) {
        StringBuilder body = new StringBuilder("{");
        for (int i = 0; i < recipients; i++) {
            if (i > 0) {
                body.append(',');
            }
            body.append("\"r").append(i).append(".near\":\"").append(each).append('"');
        }
        return body.append('}').toString();
    }
}
