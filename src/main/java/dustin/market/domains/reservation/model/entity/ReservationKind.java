package dustin.market.domains.reservation.model.entity;

/**
 * 예약 키 종류
 * Reservation key kind (listing key or offer key)
 */
public enum ReservationKind {
    LISTING,
    OFFER
}
