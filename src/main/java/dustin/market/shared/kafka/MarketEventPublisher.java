package dustin.market.shared.kafka;

/**
 * 마켓 이벤트 발행 포트
 * Market event publishing port
 */
public interface MarketEventPublisher {

    /**
     * 이벤트 발행. 트랜잭션 안에서 호출되면 커밋 이후에만 내보낸다.
     */
    void publish(MarketEvent event);
}
