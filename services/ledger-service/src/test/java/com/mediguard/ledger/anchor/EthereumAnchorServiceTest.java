package com.mediguard.ledger.anchor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.exception.AnchorServiceException;
import com.mediguard.ledger.integrity.CanonicalEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Ethereum Anchor Service Tests")
class EthereumAnchorServiceTest {

    private static final String RPC_URL = "http://localhost:8545";
    private static final String FROM = "0x1111111111111111111111111111111111111111";
    private static final String HEAD = "2c26b46b68ffc68ff99b453c1d30413413422d706483bfa0f98a5e886266e7ae";
    private static final String TX_HASH = "0x5d0f1c3a9e3b7c2b2f0e6f1a7d4c9b8a6e5d4c3b2a19080706050403020100ff";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Deque<String>> results = new HashMap<>();
    private final List<Map<String, Object>> requests = new ArrayList<>();

    @Mock
    private RestTemplate restTemplate;

    private LedgerProperties.EthereumProperties ethereum;
    private EthereumAnchorService service;

    @BeforeEach
    void setUp() {
        ethereum = new LedgerProperties.EthereumProperties();
        ethereum.setRpcUrl(RPC_URL);
        ethereum.setFromAddress(FROM);
        ethereum.setReceiptPollInterval(Duration.ofMillis(1));
        ethereum.setReceiptTimeout(Duration.ofSeconds(5));

        service = new EthereumAnchorService(new EthereumRpcClient(restTemplate, RPC_URL),
                new CanonicalEncoder(), ethereum, "MediGuardAI", 11155111L);
    }

    @Test
    @DisplayName("Should send a self-transfer carrying the tagged head and wait for its receipt")
    @SuppressWarnings("unchecked")
    void shouldCommitHeadHash() {
        // Given
        stubRpc();
        respond("eth_gasPrice", "\"0x3b9aca00\"");
        respond("eth_getTransactionCount", "\"0x5\"");
        respond("eth_sendTransaction", "\"" + TX_HASH + "\"");
        respond("eth_getTransactionReceipt", "null");
        respond("eth_getTransactionReceipt", "{\"status\":\"0x1\",\"blockNumber\":\"0x10\",\"gasUsed\":\"0x5208\"}");
        Map<String, Object> metadata = Map.of("total_entries", 2L);

        // When
        AnchorReceipt receipt = service.commit(HEAD, metadata);

        // Then
        assertThat(receipt.getReference()).isEqualTo(TX_HASH);
        assertThat(receipt.getPosition()).isEqualTo(16L);
        assertThat(receipt.getMode()).isEqualTo("ethereum");
        assertThat(receipt.getRaw()).containsEntry("gas_used", 21000L);

        Map<String, Object> send = requests.stream()
                .filter(request -> "eth_sendTransaction".equals(request.get("method")))
                .findFirst().orElseThrow();
        Map<String, Object> transaction = (Map<String, Object>) ((List<Object>) send.get("params")).get(0);
        String payload = "MediGuardAI:" + HEAD + ":{\"total_entries\":2}";
        assertThat(transaction)
                .containsEntry("from", FROM)
                .containsEntry("to", FROM)
                .containsEntry("value", "0x0")
                .containsEntry("gas", "0x186a0")
                .containsEntry("gasPrice", "0x47868c00")
                .containsEntry("nonce", "0x5")
                .containsEntry("chainId", "0xaa36a7")
                .containsEntry("data", "0x" + HexFormat.of().formatHex(payload.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should fail when the transaction reverts")
    void shouldFailOnRevertedTransaction() {
        stubRpc();
        respond("eth_gasPrice", "\"0x1\"");
        respond("eth_getTransactionCount", "\"0x0\"");
        respond("eth_sendTransaction", "\"" + TX_HASH + "\"");
        respond("eth_getTransactionReceipt", "{\"status\":\"0x0\",\"blockNumber\":\"0x10\"}");

        assertThatThrownBy(() -> service.commit(HEAD, Map.of()))
                .isInstanceOf(AnchorServiceException.class)
                .hasMessageContaining("status 0x0");
    }

    @Test
    @DisplayName("Should surface JSON-RPC errors as anchor failures")
    void shouldFailOnRpcError() throws Exception {
        when(restTemplate.exchange(eq(RPC_URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(objectMapper.readTree(
                        "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"insufficient funds\"}}")));

        assertThatThrownBy(() -> service.commit(HEAD, Map.of()))
                .isInstanceOf(AnchorServiceException.class)
                .hasMessageContaining("insufficient funds")
                .hasMessageContaining("eth_gasPrice");
    }

    @Test
    @DisplayName("Should give up when no receipt arrives within the timeout")
    void shouldTimeOutWaitingForReceipt() {
        ethereum.setReceiptTimeout(Duration.ZERO);
        stubRpc();
        respond("eth_gasPrice", "\"0x1\"");
        respond("eth_getTransactionCount", "\"0x0\"");
        respond("eth_sendTransaction", "\"" + TX_HASH + "\"");
        respond("eth_getTransactionReceipt", "null");

        assertThatThrownBy(() -> service.commit(HEAD, Map.of()))
                .isInstanceOf(AnchorServiceException.class)
                .hasMessageContaining("No receipt");
    }

    @Test
    @DisplayName("Should report unknown transactions as not found")
    void shouldVerifyMissingTransaction() {
        stubRpc();
        respond("eth_getTransactionReceipt", "null");

        AnchorVerification verification = service.verify(TX_HASH);

        assertThat(verification.isFound()).isFalse();
    }

    @Test
    @DisplayName("Should return block and input data for mined transactions")
    void shouldVerifyMinedTransaction() {
        stubRpc();
        respond("eth_getTransactionReceipt", "{\"status\":\"0x1\",\"blockNumber\":\"0x2a\"}");
        respond("eth_getTransactionByHash", "{\"input\":\"0x4d65\",\"from\":\"" + FROM + "\",\"to\":\"" + FROM + "\"}");

        AnchorVerification verification = service.verify(TX_HASH);

        assertThat(verification.isFound()).isTrue();
        assertThat(verification.getPosition()).isEqualTo(42L);
        assertThat(verification.getRawData()).containsEntry("data", "0x4d65").containsEntry("status", 1);
    }

    @Test
    @DisplayName("Should report the ledger unavailable when the node cannot be reached")
    void shouldReportUnavailableNode() {
        when(restTemplate.exchange(eq(RPC_URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        assertThat(service.isAvailable()).isFalse();
    }

    @SuppressWarnings("unchecked")
    private void stubRpc() {
        when(restTemplate.exchange(eq(RPC_URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenAnswer(invocation -> {
                    HttpEntity<Map<String, Object>> entity = invocation.getArgument(2);
                    Map<String, Object> body = entity.getBody();
                    requests.add(body);
                    String method = (String) body.get("method");
                    Deque<String> queue = results.get(method);
                    String result = queue.size() > 1 ? queue.poll() : queue.peek();
                    return ResponseEntity.ok(objectMapper.readTree(
                            "{\"jsonrpc\":\"2.0\",\"id\":" + body.get("id") + ",\"result\":" + result + "}"));
                });
    }

    private void respond(String method, String resultJson) {
        results.computeIfAbsent(method, key -> new ArrayDeque<>()).add(resultJson);
    }
}
