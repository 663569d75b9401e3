package dustin.market.shared.registry;

/**
 * 자산 레지스트리 클라이언트
 * Asset Registry Client
 *
 * 레지스트리는 토큰 보관과 승인 의미를 소유한다. 마켓은 호출하고 응답에 반응만 한다.
 */
public interface AssetRegistryClient {

    /**
     * 자산을 이전하고 분배 내역(payout) 원문을 받는다.
     *
     * @param request 이전 요청
     * @return 응답 본문 (파싱은 호출자가 수행, 비어 있을 수 있음)
     * @throws AssetRegistryException 레지스트리가 이전을 거부했거나 통신 실패 시
     */
    byte[] transferPayout(TransferPayoutRequest request);
}
