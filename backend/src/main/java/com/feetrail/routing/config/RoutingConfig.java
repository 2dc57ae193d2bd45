package com.feetrail.routing.config;

import com.feetrail.ingestion.adapter.evm.EvmContractReader;
import com.feetrail.ingestion.adapter.evm.EvmJsonRpc;
import com.feetrail.ingestion.adapter.evm.EvmTransactionSender;
import com.feetrail.routing.contract.FeeRoutingContracts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;

/**
 * Builds the contract facade; a transaction sender is attached only when an administrative key is configured.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RoutingProperties.class)
public class RoutingConfig {

    @Bean
    public FeeRoutingContracts feeRoutingContracts(EvmContractReader contractReader,
                                                   EvmJsonRpc evmJsonRpc,
                                                   RoutingProperties properties) {
        EvmTransactionSender sender = null;
        if (properties.hasSigningKey()) {
            Credentials credentials = Credentials.create(properties.getAdminPrivateKey().trim());
            sender = new EvmTransactionSender(evmJsonRpc, credentials,
                    properties.getConfirmationPollMs(), properties.getConfirmationTimeoutMs());
            log.info("Routing signer configured: {}", credentials.getAddress());
        } else {
            log.info("No routing admin key configured; dev routing reconciliation disabled");
        }
        return new FeeRoutingContracts(contractReader, sender);
    }
}
