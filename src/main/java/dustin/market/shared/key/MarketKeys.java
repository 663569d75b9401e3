package dustin.market.shared.key;

/**
 * 복합 키 생성기
 * Composite Key Builder
 *
 * 역할:
 * - 리스팅 키: registry||asset
 * - 오퍼 키: registry||buyer||asset
 *
 * 같은 입력에 대해 항상 같은 키를 만든다 (저장소 조회/인덱스 공용).
 * 구분자를 포함한 구성 요소는 서로 다른 입력이 같은 키로 겹치므로 거부한다.
 */
public final class MarketKeys {

    public static final String DELIMITER = "||";

    private MarketKeys() {
    }

    /**
     * 리스팅 키 생성
     * Build listing key
     *
     * @param registryId 자산 레지스트리 ID
     * @param assetId 자산 ID
     * @return "registryId||assetId"
     */
    public static String listingKey(String registryId, String assetId) {
        requirePart(registryId, "registryId");
        requirePart(assetId, "assetId");
        return registryId + DELIMITER + assetId;
    }

    /**
     * 오퍼 키 생성
     * Build offer key
     *
     * @param registryId 자산 레지스트리 ID
     * @param buyerId 구매자 계정
     * @param assetId 자산 ID
     * @return "registryId||buyerId||assetId"
     */
    public static String offerKey(String registryId, String buyerId, String assetId) {
        requirePart(registryId, "registryId");
        requirePart(buyerId, "buyerId");
        requirePart(assetId, "assetId");
        return registryId + DELIMITER + buyerId + DELIMITER + assetId;
    }

    private static void requirePart(String part, String name) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (part.contains(DELIMITER)) {
            throw new IllegalArgumentException(name + " must not contain '" + DELIMITER + "'");
        }
    }
}
