package dustin.market.shared.registry;

/**
 * 자산 레지스트리 호출 실패
 * Asset registry call failure (rejected transfer, transport error)
 */
public class AssetRegistryException extends RuntimeException {

    public AssetRegistryException(String message) {
        super(message);
    }

    public AssetRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
