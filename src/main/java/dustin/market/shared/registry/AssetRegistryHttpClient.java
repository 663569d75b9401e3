package dustin.market.shared.registry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * 자산 레지스트리 HTTP 클라이언트
 * Asset Registry HTTP Client
 *
 * 역할:
 * - 레지스트리 게이트웨이에 nft_transfer_payout 호출 전달
 * - 응답 본문은 해석하지 않고 그대로 반환 (정산 단계에서 파싱)
 *
 * 처리 흐름:
 * 1. 요청 본문 생성 (snake_case JSON)
 * 2. POST {baseUrl}/registries/{registryId}/nft_transfer_payout
 * 3. 2xx 이외 응답 또는 통신 오류는 AssetRegistryException
 *
 * 주의사항:
 * - 정산 실행기 스레드에서 호출됨 (호출자 트랜잭션 밖)
 * - 재시도하지 않음 (이전은 멱등하지 않음)
 */
@Slf4j
@Component
public class AssetRegistryHttpClient implements AssetRegistryClient {

    @Value("${registry.http.url:http://localhost:3030}")
    private String registryBaseUrl;

    @Value("${registry.http.connect-timeout:3000}")
    private int connectTimeoutMs;

    @Value("${registry.http.read-timeout:10000}")
    private int readTimeoutMs;

    private RestTemplate restTemplate;
    private ObjectMapper objectMapper;

    /**
     * 서버 시작 시 HTTP 클라이언트 초기화
     * Initialize HTTP client on server startup
     */
    @PostConstruct
    public void init() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        this.restTemplate = new RestTemplate(requestFactory);
        this.objectMapper = new ObjectMapper();
        log.info("[AssetRegistryHttpClient] HTTP 클라이언트 초기화 완료: baseUrl={}", registryBaseUrl);
    }

    @Override
    public byte[] transferPayout(TransferPayoutRequest request) {
        String url = registryBaseUrl + "/registries/" + request.getRegistryId() + "/nft_transfer_payout";
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<String> requestEntity = new HttpEntity<>(buildRequestBody(request), headers);

            ResponseEntity<byte[]> response = restTemplate.exchange(
                    url,
                    HttpMethod.POST,
                    requestEntity,
                    byte[].class
            );

            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("[AssetRegistryHttpClient] 이전 거부: registry={}, asset={}, status={}",
                        request.getRegistryId(), request.getAssetId(), response.getStatusCode());
                throw new AssetRegistryException("Registry rejected transfer: " + response.getStatusCode());
            }

            log.debug("[AssetRegistryHttpClient] 이전 완료: registry={}, asset={}, receiver={}",
                    request.getRegistryId(), request.getAssetId(), request.getReceiverId());
            return response.getBody() != null ? response.getBody() : new byte[0];

        } catch (RestClientException e) {
            log.warn("[AssetRegistryHttpClient] 레지스트리 호출 실패: registry={}, asset={}, error={}",
                    request.getRegistryId(), request.getAssetId(), e.getMessage());
            throw new AssetRegistryException("Registry call failed: " + e.getMessage(), e);
        }
    }

    /**
     * 요청 본문 생성
     * Build request body
     */
    private String buildRequestBody(TransferPayoutRequest request) {
        ObjectNode node = objectMapper.createObjectNode()
                .put("receiver_id", request.getReceiverId())
                .put("token_id", request.getAssetId())
                .put("approval_id", request.getApprovalId())
                .put("balance", request.getBalance().toPlainString())
                .put("max_len_payout", request.getMaxLenPayout());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AssetRegistryException("Failed to build request body: " + e.getMessage(), e);
        }
    }
}
