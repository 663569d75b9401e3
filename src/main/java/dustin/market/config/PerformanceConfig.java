package dustin.market.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 실행 환경 설정
 * Execution Configuration
 * 레지스트리 호출/정산 해소용 스레드 풀과 원장 시각
 */
@Configuration
@EnableAsync
public class PerformanceConfig {

    @Value("${marketplace.settlement.pool-size:4}")
    private int settlementPoolSize;

    @Value("${marketplace.settlement.queue-capacity:1000}")
    private int settlementQueueCapacity;

    /**
     * 정산 실행기
     * Settlement executor
     *
     * 예약된 레지스트리 호출과 그 해소(resolve)는 호출자 트랜잭션과 별개로 여기서 실행된다.
     */
    @Bean(name = "settlementExecutor")
    public Executor settlementExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settlementPoolSize);
        executor.setMaxPoolSize(settlementPoolSize * 2);
        executor.setQueueCapacity(settlementQueueCapacity);
        executor.setThreadNamePrefix("settlement-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        // 호출자 스레드의 트랜잭션 동기화 상태가 새어 들어오지 않도록 정리
        executor.setTaskDecorator(runnable -> () -> {
            try {
                runnable.run();
            } finally {
                TransactionSynchronizationManager.clear();
            }
        });
        executor.initialize();
        return executor;
    }

    /**
     * 원장 시각 (경매 시간 창 비교용)
     * Ledger clock
     */
    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
