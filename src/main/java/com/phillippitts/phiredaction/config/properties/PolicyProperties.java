package com.phillippitts.phiredaction.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Environment switches owned by the orchestration layer and enforced by the policy gate.
 */
@ConfigurationProperties(prefix = "phi.policy")
public class PolicyProperties {

    /** When true, every outbound release is refused regardless of redaction state. */
    private final boolean offline;

    /**
     * When false, the gate passes the snapshot's original text through unredacted. This is a
     * deliberate configuration surface of the surrounding system.
     */
    private final boolean redactBeforeSend;

    @ConstructorBinding
    public PolicyProperties(Boolean offline, Boolean redactBeforeSend) {
        this.offline = offline == null ? true : offline;
        this.redactBeforeSend = redactBeforeSend == null ? true : redactBeforeSend;
    }

    public boolean isOffline() {
        return offline;
    }

    public boolean isRedactBeforeSend() {
        return redactBeforeSend;
    }
}
