package com.mediguard.ledger.anchor;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediguard.ledger.exception.AnchorServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Ethereum JSON-RPC 2.0 client over HTTP
 */
@Slf4j
public class EthereumRpcClient {

    private final RestTemplate restTemplate;
    private final String rpcUrl;
    private final AtomicLong requestIds = new AtomicLong();

    public EthereumRpcClient(RestTemplate restTemplate, String rpcUrl) {
        this.restTemplate = restTemplate;
        this.rpcUrl = rpcUrl;
    }

    /**
     * Invokes a method and returns its {@code result} node, which may be JSON null.
     */
    public JsonNode call(String method, Object... params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", List.of(params));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(rpcUrl, HttpMethod.POST, new HttpEntity<>(request, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new AnchorServiceException("RPC transport failure: " + e.getMessage(),
                    EthereumAnchorService.MODE, method, e);
        }

        JsonNode body = response.getBody();
        if (body == null) {
            throw new AnchorServiceException("Empty RPC response", EthereumAnchorService.MODE, method);
        }
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            throw new AnchorServiceException(
                    String.format("RPC error %s: %s", error.path("code").asText(), error.path("message").asText()),
                    EthereumAnchorService.MODE, method);
        }
        log.debug("RPC {} answered", method);
        return body.path("result");
    }

    public BigInteger callForQuantity(String method, Object... params) {
        JsonNode result = call(method, params);
        if (!result.isTextual()) {
            throw new AnchorServiceException("Expected hex quantity, got " + result,
                    EthereumAnchorService.MODE, method);
        }
        return fromQuantity(result.asText());
    }

    public static String toQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static BigInteger fromQuantity(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }
}
