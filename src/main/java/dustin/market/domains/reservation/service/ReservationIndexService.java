package dustin.market.domains.reservation.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.reservation.model.entity.AccountReservation;
import dustin.market.domains.reservation.model.entity.ReservationKind;
import dustin.market.domains.reservation.repository.AccountReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 예약 인덱스 서비스
 * Reservation Index Service
 *
 * 역할:
 * - 계정별 활성 리스팅/오퍼 키 집합 유지
 * - 리스팅/오퍼가 저장될 때 추가, 삭제될 때 제거 (같은 트랜잭션)
 * - 스토리지 예치금 계산용 예약 수 제공
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationIndexService {

    private final AccountReservationRepository accountReservationRepository;

    /**
     * 예약 키 추가 (이미 있으면 무시)
     */
    @Transactional
    public void add(String accountId, ReservationKind kind, String key) {
        if (accountReservationRepository.existsByAccountIdAndKindAndReservationKey(accountId, kind, key)) {
            return;
        }
        accountReservationRepository.save(AccountReservation.builder()
                .accountId(accountId)
                .kind(kind)
                .reservationKey(key)
                .build());
        log.debug("[ReservationIndexService] 예약 추가: account={}, kind={}, key={}", accountId, kind, key);
    }

    /**
     * 예약 키 제거 (없으면 무시)
     */
    @Transactional
    public void remove(String accountId, ReservationKind kind, String key) {
        long removed = accountReservationRepository.deleteByAccountIdAndKindAndReservationKey(accountId, kind, key);
        if (removed > 0) {
            log.debug("[ReservationIndexService] 예약 제거: account={}, kind={}, key={}", accountId, kind, key);
        }
    }

    /**
     * 계정의 활성 예약 수 (리스팅 + 오퍼)
     */
    @Transactional(readOnly = true)
    public long count(String accountId) {
        return accountReservationRepository.countByAccountId(accountId);
    }

    @Transactional(readOnly = true)
    public boolean contains(String accountId, ReservationKind kind, String key) {
        return accountReservationRepository.existsByAccountIdAndKindAndReservationKey(accountId, kind, key);
    }

    @Transactional(readOnly = true)
    public List<String> keys(String accountId, ReservationKind kind) {
        return accountReservationRepository.findByAccountIdOrderByIdAsc(accountId).stream()
                .filter(reservation -> reservation.getKind() == kind)
                .map(AccountReservation::getReservationKey)
                .collect(Collectors.toList());
    }
}
