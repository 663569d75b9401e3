package dustin.market.domains.listing.repository;

import dustin.market.domains.listing.model.entity.Listing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * 리스팅 Repository
 * Listing Repository
 */
@Repository
public interface ListingRepository extends JpaRepository<Listing, Long> {

    Optional<Listing> findByListingKey(String listingKey);

    /**
     * 리스팅 조회 (비관적 락)
     * 같은 키에 대한 입찰/구매/삭제를 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Listing l WHERE l.listingKey = :listingKey")
    Optional<Listing> findByListingKeyForUpdate(@Param("listingKey") String listingKey);

    List<Listing> findByOwnerIdOrderByIdAsc(String ownerId);
}
