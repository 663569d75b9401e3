package dustin.market.support;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import dustin.market.shared.registry.AssetRegistryClient;
import dustin.market.shared.registry.AssetRegistryException;
import dustin.market.shared.registry.TransferPayoutRequest;

/**
 * 레지스트리 스텁
 * 기본 응답은 빈 본문 (분배 내역 없음)
 */
public class StubAssetRegistryClient implements AssetRegistryClient {

    private final List<TransferPayoutRequest> requests = new CopyOnWriteArrayList<>();

    private volatile byte[] response = new byte[0];
    private volatile String failure;

    @Override
    public byte[] transferPayout(TransferPayoutRequest request) {
        requests.add(request);
        if (failure != null) {
            throw new AssetRegistryException(failure);
        }
        return response;
    }

    public void respondWith(String body) {
        this.failure = null;
        this.response = body.getBytes(StandardCharsets.UTF_8);
    }

    public void failWith(String message) {
        this.failure = message;
    }

    public List<TransferPayoutRequest> requests() {
        return List.copyOf(requests);
    }

    public void reset() {
        requests.clear();
        response = new byte[0];
        failure = null;
    }
}
