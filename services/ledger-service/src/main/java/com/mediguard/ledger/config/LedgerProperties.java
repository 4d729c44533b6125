package com.mediguard.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private IntegrityProperties integrity = new IntegrityProperties();
    private AppendProperties append = new AppendProperties();
    private VerificationProperties verification = new VerificationProperties();
    private AnchorProperties anchor = new AnchorProperties();
    private RebuildProperties rebuild = new RebuildProperties();
    private KafkaProperties kafka = new KafkaProperties();

    @Data
    public static class IntegrityProperties {
        private String hashAlgorithm = "SHA-256";
    }

    @Data
    public static class AppendProperties {
        private Integer maxAttempts = 5;
        private Duration backoff = Duration.ofMillis(50);
    }

    @Data
    public static class VerificationProperties {
        private Integer pageSize = 500;
        private Boolean periodicVerification = false;
        private Duration verificationInterval = Duration.ofHours(24);
    }

    @Data
    public static class AnchorProperties {
        private Boolean enabled = true;
        private AnchorMode mode = AnchorMode.SIMULATED;
        private Duration interval = Duration.ofHours(24);
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private String applicationTag = "MediGuardAI";
        private EthereumProperties ethereum = new EthereumProperties();
    }

    @Data
    public static class EthereumProperties {
        private String rpcUrl;
        private String fromAddress;
        private String network = "sepolia";
        private Long chainId;
        private BigInteger gasLimit = BigInteger.valueOf(100_000);
        private Double gasPriceMultiplier = 1.2;
        private Duration receiptTimeout = Duration.ofSeconds(120);
        private Duration receiptPollInterval = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RebuildProperties {
        private Boolean run = false;
        private Boolean confirmed = false;
        private Integer pageSize = 200;
    }

    @Data
    public static class KafkaProperties {
        private Boolean enabled = false;
        private String predictionTopic = "prediction-recorded";
        private String groupId = "ledger-prediction-recorder";
    }

    public enum AnchorMode {
        SIMULATED,
        ETHEREUM
    }
}
