package dustin.market.domains.offer.repository;

import dustin.market.domains.offer.model.entity.Offer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * 오퍼 Repository
 * Offer Repository
 */
@Repository
public interface OfferRepository extends JpaRepository<Offer, Long> {

    Optional<Offer> findByOfferKey(String offerKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Offer o WHERE o.offerKey = :offerKey")
    Optional<Offer> findByOfferKeyForUpdate(@Param("offerKey") String offerKey);

    List<Offer> findByBuyerIdOrderByIdAsc(String buyerId);
}
