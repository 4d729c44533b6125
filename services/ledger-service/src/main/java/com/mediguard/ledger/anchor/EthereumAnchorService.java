package com.mediguard.ledger.anchor;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.exception.AnchorServiceException;
import com.mediguard.ledger.integrity.CanonicalEncoder;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anchors head hashes on an Ethereum-compatible network.
 *
 * <p>Each commit is a zero-value transaction from the configured account to itself
 * whose data field carries the tagged head hash and metadata. Signing is done by the
 * node or remote signer that manages the account; no key material lives here.
 */
@Slf4j
public class EthereumAnchorService implements AnchorService {

    public static final String MODE = "ethereum";

    private static final String SUCCESS_STATUS = "0x1";

    private final EthereumRpcClient rpcClient;
    private final CanonicalEncoder encoder;
    private final LedgerProperties.EthereumProperties ethereum;
    private final String applicationTag;
    private final long chainId;

    public EthereumAnchorService(EthereumRpcClient rpcClient,
                                 CanonicalEncoder encoder,
                                 LedgerProperties.EthereumProperties ethereum,
                                 String applicationTag,
                                 long chainId) {
        this.rpcClient = rpcClient;
        this.encoder = encoder;
        this.ethereum = ethereum;
        this.applicationTag = applicationTag;
        this.chainId = chainId;
    }

    @Override
    @CircuitBreaker(name = "anchorLedger", fallbackMethod = "commitFallback")
    public AnchorReceipt commit(String headHash, Map<String, Object> metadata) {
        String payload = applicationTag + ":" + headHash;
        if (metadata != null && !metadata.isEmpty()) {
            payload += ":" + encoder.encodeToString(metadata);
        }

        BigInteger gasPrice = new BigDecimal(rpcClient.callForQuantity("eth_gasPrice"))
                .multiply(BigDecimal.valueOf(ethereum.getGasPriceMultiplier()))
                .toBigInteger();
        BigInteger nonce = rpcClient.callForQuantity("eth_getTransactionCount", ethereum.getFromAddress(), "pending");

        Map<String, Object> transaction = new LinkedHashMap<>();
        transaction.put("from", ethereum.getFromAddress());
        transaction.put("to", ethereum.getFromAddress());
        transaction.put("value", "0x0");
        transaction.put("gas", EthereumRpcClient.toQuantity(ethereum.getGasLimit()));
        transaction.put("gasPrice", EthereumRpcClient.toQuantity(gasPrice));
        transaction.put("nonce", EthereumRpcClient.toQuantity(nonce));
        transaction.put("chainId", EthereumRpcClient.toQuantity(BigInteger.valueOf(chainId)));
        transaction.put("data", "0x" + HexFormat.of().formatHex(payload.getBytes(StandardCharsets.UTF_8)));

        JsonNode sent = rpcClient.call("eth_sendTransaction", transaction);
        if (!sent.isTextual()) {
            throw new AnchorServiceException("Node returned no transaction hash", MODE, "eth_sendTransaction");
        }
        String txHash = sent.asText();
        log.info("Submitted anchor transaction {} for head {} (nonce {}, gas price {})",
                txHash, headHash, nonce, gasPrice);

        JsonNode receipt = awaitReceipt(txHash);
        String status = receipt.path("status").asText();
        if (!SUCCESS_STATUS.equals(status)) {
            throw new AnchorServiceException("Anchor transaction " + txHash + " failed with status " + status,
                    MODE, "commit");
        }

        long blockNumber = EthereumRpcClient.fromQuantity(receipt.path("blockNumber").asText()).longValueExact();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("tx_hash", txHash);
        raw.put("block_number", blockNumber);
        raw.put("gas_used", EthereumRpcClient.fromQuantity(receipt.path("gasUsed").asText("0x0")).longValue());
        raw.put("status", 1);
        raw.put("chain_id", chainId);

        log.info("Anchor transaction {} mined in block {}", txHash, blockNumber);
        return AnchorReceipt.builder()
                .reference(txHash)
                .position(blockNumber)
                .mode(MODE)
                .raw(raw)
                .build();
    }

    @Override
    public AnchorVerification verify(String reference) {
        JsonNode receipt = rpcClient.call("eth_getTransactionReceipt", reference);
        if (receipt.isMissingNode() || receipt.isNull()) {
            return AnchorVerification.notFound(reference, MODE);
        }
        JsonNode transaction = rpcClient.call("eth_getTransactionByHash", reference);

        long blockNumber = EthereumRpcClient.fromQuantity(receipt.path("blockNumber").asText("0x0")).longValueExact();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("tx_hash", reference);
        raw.put("block_number", blockNumber);
        raw.put("status", SUCCESS_STATUS.equals(receipt.path("status").asText()) ? 1 : 0);
        raw.put("data", transaction.path("input").asText(null));
        raw.put("from", transaction.path("from").asText(null));
        raw.put("to", transaction.path("to").asText(null));

        return AnchorVerification.builder()
                .reference(reference)
                .found(true)
                .position(blockNumber)
                .mode(MODE)
                .rawData(raw)
                .build();
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public boolean isAvailable() {
        try {
            rpcClient.callForQuantity("eth_blockNumber");
            return true;
        } catch (AnchorServiceException e) {
            log.warn("Anchor ledger unreachable: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode awaitReceipt(String txHash) {
        Instant deadline = Instant.now().plus(ethereum.getReceiptTimeout());
        Duration pollInterval = ethereum.getReceiptPollInterval();
        while (true) {
            JsonNode receipt = rpcClient.call("eth_getTransactionReceipt", txHash);
            if (!receipt.isMissingNode() && !receipt.isNull()) {
                return receipt;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new AnchorServiceException("No receipt for " + txHash + " within "
                        + ethereum.getReceiptTimeout(), MODE, "awaitReceipt");
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnchorServiceException("Interrupted while waiting for receipt of " + txHash,
                        MODE, "awaitReceipt", e);
            }
        }
    }

    /**
     * Circuit breaker fallback: anchor failures always surface as {@link AnchorServiceException}
     */
    public AnchorReceipt commitFallback(String headHash, Map<String, Object> metadata, Exception e) {
        if (e instanceof AnchorServiceException) {
            throw (AnchorServiceException) e;
        }
        log.error("Anchor ledger call for head {} rejected: {}", headHash, e.getMessage());
        throw new AnchorServiceException("Anchor ledger unavailable: " + e.getMessage(), MODE, "commit", e);
    }
}
