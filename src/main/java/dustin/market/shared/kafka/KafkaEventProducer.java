package dustin.market.shared.kafka;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 *
 * 역할:
 * - 리스팅/입찰/오퍼/정산 이벤트를 Kafka로 발행
 * - 트랜잭션 안에서 호출되면 커밋 이후에만 발행 (롤백된 호출은 이벤트 없음)
 * - 비동기 처리 (논블로킹)
 *
 * 주의사항:
 * - 발행 실패는 상태 변경에 영향 없음 (로깅만)
 */
@Slf4j
@Component
public class KafkaEventProducer implements MarketEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Value("${marketplace.events.topic:market-events}")
    private String topic;

    public KafkaEventProducer(KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    @Override
    public void publish(MarketEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
            return;
        }
        send(event);
    }

    /**
     * 이벤트 전송
     * Send event to the topic
     */
    protected void send(MarketEvent event) {
        String json;
        try {
            json = toJson(event);
        } catch (JsonProcessingException e) {
            log.error("[KafkaEventProducer] 이벤트 직렬화 실패: event={}, error={}", event.getEvent(), e.getMessage());
            return;
        }
        log.info("[KafkaEventProducer] {}", json);

        CompletableFuture.runAsync(() -> kafkaTemplate.send(topic, event.getEvent(), json)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.error("[KafkaEventProducer] 이벤트 전송 실패: event={}, error={}",
                                        event.getEvent(), ex.getMessage());
                            }
                        }))
                .exceptionally(ex -> {
                    log.error("[KafkaEventProducer] 이벤트 발행 실패: event={}, error={}", event.getEvent(), ex.getMessage());
                    return null;
                });
    }

    protected String toJson(MarketEvent event) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event.getEvent());
        body.put("params", event.getParams());
        return objectMapper.writeValueAsString(body);
    }
}
