package dustin.market.shared.kafka;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * 마켓 이벤트
 * Market Event
 *
 * 형식: {"event": "...", "params": {...}}
 * 정산 단계 결과는 호출자 트랜잭션이 이미 끝난 뒤이므로 이벤트로만 노출된다.
 */
@Getter
@ToString
public class MarketEvent {

    public static final String ADD_MARKET_DATA = "add_market_data";
    public static final String UPDATE_MARKET_DATA = "update_market_data";
    public static final String DELETE_MARKET_DATA = "delete_market_data";
    public static final String ADD_BID = "add_bid";
    public static final String CANCEL_BID = "cancel_bid";
    public static final String ADD_OFFER = "add_offer";
    public static final String DELETE_OFFER = "delete_offer";
    public static final String RESOLVE_PURCHASE = "resolve_purchase";
    public static final String RESOLVE_PURCHASE_FAIL = "resolve_purchase_fail";

    private final String event;
    private final Map<String, Object> params;

    private MarketEvent(String event, Map<String, Object> params) {
        this.event = event;
        this.params = Collections.unmodifiableMap(params);
    }

    public static Builder builder(String event) {
        return new Builder(event);
    }

    public Object param(String name) {
        return params.get(name);
    }

    public static final class Builder {

        private final String event;
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder(String event) {
            this.event = event;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public MarketEvent build() {
            return new MarketEvent(event, params);
        }
    }
}
