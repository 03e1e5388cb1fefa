package com.bulut.rail.circle;

import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.UpstreamException;
import com.bulut.config.BulutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the Circle Wallets API.
 *
 * Handles:
 * - Authentication (Bearer API key)
 * - Bounded connect/read timeouts
 * - Mapping transport errors to {@link UpstreamException}
 */
@Component
@ConditionalOnProperty(prefix = "bulut.rail", name = "mode", havingValue = "circle")
@Slf4j
public class CircleClient {

    static final String SERVICE = "circle";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public CircleClient(RestTemplateBuilder restTemplateBuilder, BulutProperties properties) {
        BulutProperties.Circle config = properties.getRail().getCircle();
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(config.getConnectTimeout())
            .setReadTimeout(config.getReadTimeout())
            .build();
        this.baseUrl = config.getBaseUrl();
        this.apiKey = config.getApiKey();

        log.info("Circle client initialized: baseUrl={}, readTimeout={}", baseUrl, config.getReadTimeout());
    }

    /**
     * Submit a transfer. Circle-reported rejections (4xx/5xx) come back as an
     * {@link UpstreamException} carrying Circle's response body verbatim.
     */
    public CircleDTOs.TransferData createTransfer(CircleDTOs.TransferRequest request) {
        String url = baseUrl + "/developer/transactions/transfer";

        log.debug("Creating Circle transfer: refId={}, destination={}, amounts={}",
            request.getRefId(), request.getDestinationAddress(), request.getAmounts());

        try {
            ResponseEntity<CircleDTOs.TransferResponse> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(request, createHeaders()),
                CircleDTOs.TransferResponse.class
            );

            CircleDTOs.TransferResponse body = response.getBody();
            if (body == null || body.getData() == null) {
                throw new UpstreamException(ErrorCode.RAIL_EXECUTION_FAILED, SERVICE,
                    "Circle returned an empty transfer response");
            }
            return body.getData();

        } catch (HttpStatusCodeException e) {
            log.error("Circle rejected transfer: refId={}, status={}", request.getRefId(), e.getStatusCode());
            throw new UpstreamException(ErrorCode.RAIL_EXECUTION_FAILED, SERVICE,
                "Circle error " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.error("Circle unreachable or timed out: refId={}", request.getRefId(), e);
            throw new UpstreamException(ErrorCode.RAIL_TIMEOUT, SERVICE,
                "Circle unavailable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Error calling Circle: refId={}", request.getRefId(), e);
            throw new UpstreamException(ErrorCode.RAIL_EXECUTION_FAILED, SERVICE,
                "Circle call failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey == null ? "" : apiKey);
        return headers;
    }
}
