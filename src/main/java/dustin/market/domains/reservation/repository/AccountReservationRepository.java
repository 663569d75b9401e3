package dustin.market.domains.reservation.repository;

import dustin.market.domains.reservation.model.entity.AccountReservation;
import dustin.market.domains.reservation.model.entity.ReservationKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 계정 예약 인덱스 Repository
 * Account Reservation Repository
 */
@Repository
public interface AccountReservationRepository extends JpaRepository<AccountReservation, Long> {

    long countByAccountId(String accountId);

    boolean existsByAccountIdAndKindAndReservationKey(String accountId, ReservationKind kind, String reservationKey);

    long deleteByAccountIdAndKindAndReservationKey(String accountId, ReservationKind kind, String reservationKey);

    List<AccountReservation> findByAccountIdOrderByIdAsc(String accountId);
}
