package dustin.market.domains.listing.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 리스팅 생성 명령
 * Create Listing Command
 *
 * 레지스트리 승인 콜백에서 만들어진다 (외부 API로 직접 받지 않음).
 */
@Getter
@Builder
@ToString
public class CreateListingCommand {

    private final String ownerId;
    private final long approvalId;
    private final String registryId;
    private final String assetId;
    private final String currencyId;
    private final BigDecimal price;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Boolean isAuction;
}
