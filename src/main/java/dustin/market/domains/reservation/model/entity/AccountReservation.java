package dustin.market.domains.reservation.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 예약 인덱스 엔티티
 * Account Reservation Entity
 *
 * 역할:
 * - 계정이 보유한 리스팅/오퍼 키 하나당 한 행
 * - 행 수 = 스토리지 예치금이 커버해야 하는 예약 수
 *
 * 리스팅 키와 오퍼 키는 kind로 구분된다 (같은 문자열이라도 충돌하지 않음).
 */
@Entity
@Table(name = "account_reservations",
       uniqueConstraints = @UniqueConstraint(columnNames = {"account_id", "kind", "reservation_key"}),
       indexes = {
           @Index(name = "idx_account_reservations_account", columnList = "account_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountReservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ReservationKind kind;

    /**
     * 리스팅 키 (registry||asset) 또는 오퍼 키 (registry||buyer||asset)
     */
    @Column(name = "reservation_key", nullable = false, length = 512)
    private String reservationKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
