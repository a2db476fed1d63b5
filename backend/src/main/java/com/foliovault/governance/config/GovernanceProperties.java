package com.foliovault.governance.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Governance configuration. Documented in application.yml under foliovault.governance.
 */
@ConfigurationProperties(prefix = "foliovault.governance")
@Getter
@Setter
public class GovernanceProperties {

    /**
     * Only account allowed to issue governance tokens from custody. Compared case-insensitively.
     */
    private String adminAddress = "0x00000000000000000000000000000000000ad017";
}
