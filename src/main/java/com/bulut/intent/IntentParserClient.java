package com.bulut.intent;

import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.UpstreamException;
import com.bulut.config.BulutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the external text-to-intent service.
 *
 * The service receives {@code {text, user_id, timezone}} on {@code POST /parse}
 * and answers with a {@link PaymentIntent}. Bulut never interprets the text
 * itself. Connect and read timeouts are both bounded by
 * {@code bulut.parser.timeout}.
 */
@Component
@Slf4j
public class IntentParserClient {

    private static final String SERVICE = "intent-parser";

    private final RestTemplate restTemplate;
    private final String parserUrl;

    public IntentParserClient(RestTemplateBuilder restTemplateBuilder, BulutProperties properties) {
        BulutProperties.Parser config = properties.getParser();
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(config.getTimeout())
            .setReadTimeout(config.getTimeout())
            .build();
        this.parserUrl = config.getUrl();

        log.info("Intent parser client initialized: url={}, timeout={}", parserUrl, config.getTimeout());
    }

    public PaymentIntent parse(String text, String userId, String timezone) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("user_id", userId);
        body.put("timezone", timezone == null ? "UTC" : timezone);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<PaymentIntent> response = restTemplate.exchange(
                parserUrl + "/parse",
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                PaymentIntent.class
            );
            PaymentIntent intent = response.getBody();
            if (intent == null) {
                throw new UpstreamException(ErrorCode.PARSER_UNAVAILABLE, SERVICE, "Intent parser returned no body");
            }
            log.debug("Parsed intent: type={}, confidence={}", intent.paymentType(), intent.getConfidence());
            return intent;

        } catch (ResourceAccessException e) {
            log.error("Intent parser unreachable or timed out: url={}", parserUrl, e);
            throw new UpstreamException(ErrorCode.PARSER_UNAVAILABLE, SERVICE,
                "Intent parser unavailable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Intent parser call failed: url={}", parserUrl, e);
            throw new UpstreamException(ErrorCode.PARSER_UNAVAILABLE, SERVICE,
                "Intent parser error: " + e.getMessage(), e);
        }
    }
}
