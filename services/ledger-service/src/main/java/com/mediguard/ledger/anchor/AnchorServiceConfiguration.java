package com.mediguard.ledger.anchor;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.exception.LedgerConfigurationException;
import com.mediguard.ledger.integrity.ChainHashCalculator;
import com.mediguard.ledger.repository.ChainEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Selects the anchor ledger implementation from {@code ledger.anchor.mode}
 */
@Configuration
@Slf4j
public class AnchorServiceConfiguration {

    static final Map<String, Long> KNOWN_CHAIN_IDS = Map.of(
            "mainnet", 1L,
            "sepolia", 11155111L,
            "polygon", 137L,
            "mumbai", 80001L);

    @Bean
    public AnchorService anchorService(LedgerProperties properties,
                                       ChainHashCalculator hashCalculator,
                                       ChainEntryRepository chainEntryRepository,
                                       Clock clock,
                                       @Qualifier("anchorRestTemplate") RestTemplate anchorRestTemplate) {
        LedgerProperties.AnchorProperties anchor = properties.getAnchor();
        switch (anchor.getMode()) {
            case SIMULATED:
                log.info("Anchoring in simulated mode; chain heads are not published externally");
                return new SimulatedAnchorService(hashCalculator, chainEntryRepository, clock, anchor.getApplicationTag());
            case ETHEREUM:
                LedgerProperties.EthereumProperties ethereum = anchor.getEthereum();
                long chainId = resolveChainId(ethereum);
                log.info("Anchoring on {} (chain id {}) via {} from {}",
                        ethereum.getNetwork(), chainId, ethereum.getRpcUrl(), ethereum.getFromAddress());
                return new EthereumAnchorService(
                        new EthereumRpcClient(anchorRestTemplate, ethereum.getRpcUrl()),
                        hashCalculator.getEncoder(),
                        ethereum,
                        anchor.getApplicationTag(),
                        chainId);
            default:
                throw new LedgerConfigurationException("Unsupported anchor mode: " + anchor.getMode());
        }
    }

    static long resolveChainId(LedgerProperties.EthereumProperties ethereum) {
        if (!StringUtils.hasText(ethereum.getRpcUrl())) {
            throw new LedgerConfigurationException("ledger.anchor.ethereum.rpc-url is required in ETHEREUM mode");
        }
        if (!StringUtils.hasText(ethereum.getFromAddress())) {
            throw new LedgerConfigurationException("ledger.anchor.ethereum.from-address is required in ETHEREUM mode");
        }
        if (ethereum.getGasLimit() == null || ethereum.getGasLimit().signum() <= 0) {
            throw new LedgerConfigurationException("ledger.anchor.ethereum.gas-limit must be positive");
        }
        if (ethereum.getGasPriceMultiplier() == null || ethereum.getGasPriceMultiplier() <= 0) {
            throw new LedgerConfigurationException("ledger.anchor.ethereum.gas-price-multiplier must be positive");
        }
        if (ethereum.getChainId() != null) {
            return ethereum.getChainId();
        }
        String network = ethereum.getNetwork() == null ? "" : ethereum.getNetwork().toLowerCase();
        Long known = KNOWN_CHAIN_IDS.get(network);
        if (known == null) {
            throw new LedgerConfigurationException("Unknown network '" + ethereum.getNetwork()
                    + "'; set ledger.anchor.ethereum.chain-id explicitly");
        }
        return known;
    }
}
