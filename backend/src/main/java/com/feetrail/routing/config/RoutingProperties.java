package com.feetrail.routing.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Dev-fee routing: administrative signing key, startup sweep and confirmation wait.
 */
@ConfigurationProperties(prefix = "feetrail.routing")
@NoArgsConstructor
@Getter
@Setter
public class RoutingProperties {

    /** Hex private key of the administrative wallet. Routing is a no-op when unset. */
    private String adminPrivateKey;

    private boolean startupSweepEnabled = true;

    /** Delay between projects during the startup sweep. */
    private long sweepDelayMs = 2_000;

    private long confirmationPollMs = 2_000;

    private long confirmationTimeoutMs = 120_000;

    public boolean hasSigningKey() {
        return adminPrivateKey != null && !adminPrivateKey.isBlank();
    }
}
