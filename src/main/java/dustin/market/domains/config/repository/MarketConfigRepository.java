package dustin.market.domains.config.repository;

import dustin.market.domains.config.model.entity.MarketConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * 마켓 설정 Repository
 * Market Config Repository
 */
@Repository
public interface MarketConfigRepository extends JpaRepository<MarketConfig, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM MarketConfig c WHERE c.id = :id")
    Optional<MarketConfig> findByIdForUpdate(@Param("id") Long id);
}
