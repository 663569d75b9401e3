package dustin.market.domains.config.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 승인 계정 엔티티
 * Approved Account Entity
 *
 * 승인된 자산 레지스트리 또는 통화 식별자 하나
 */
@Entity
@Table(name = "approved_accounts",
       uniqueConstraints = @UniqueConstraint(columnNames = {"kind", "account_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovedAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ApprovalKind kind;

    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
