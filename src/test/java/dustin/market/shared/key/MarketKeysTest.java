package dustin.market.shared.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 복합 키 테스트
 * MarketKeys Test
 */
class MarketKeysTest {

    @Test
    @DisplayName("리스팅 키는 registry||asset")
    void listingKey() {
        assertThat(MarketKeys.listingKey("nft.near", "token-1")).isEqualTo("nft.near||token-1");
    }

    @Test
    @DisplayName("오퍼 키는 registry||buyer||asset")
    void offerKey() {
        assertThat(MarketKeys.offerKey("nft.near", "bob.near", "token-1"))
                .isEqualTo("nft.near||bob.near||token-1");
    }

    @Test
    @DisplayName("같은 구성 요소라도 리스팅 키와 오퍼 키는 겹치지 않음")
    void listingAndOfferKeysDiffer() {
        assertThat(MarketKeys.offerKey("nft.near", "bob.near", "token-1"))
                .isNotEqualTo(MarketKeys.listingKey("nft.near", "token-1"));
    }

    @Test
    @DisplayName("빈 구성 요소는 거부")
    void blankPartRejected() {
        assertThatThrownBy(() -> MarketKeys.listingKey(" ", "token-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registryId");
        assertThatThrownBy(() -> MarketKeys.offerKey("nft.near", null, "token-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("buyerId");
    }

    @Test
    @DisplayName("구분자를 포함한 구성 요소는 거부 (a||b + c 와 a + b||c 충돌 방지)")
    void delimiterInPartRejected() {
        assertThatThrownBy(() -> MarketKeys.listingKey("a||b", "c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registryId");
        assertThatThrownBy(() -> MarketKeys.listingKey("a", "b||c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("assetId");
        assertThatThrownBy(() -> MarketKeys.offerKey("nft.near", "bob||near", "token-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("buyerId");
        assertThat(MarketKeys.listingKey("nft.near", "token|1")).isEqualTo("nft.near||token|1");
    }
}
