package com.resource.naming.health;

import com.resource.naming.ledger.ClaimLedger;

/**
 * Reachability of the claim ledger's backing store.
 */
public class LedgerHealthCheck implements HealthCheck {

    private final ClaimLedger ledger;

    public LedgerHealthCheck(ClaimLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public String getName() {
        return "ledger";
    }

    @Override
    public HealthStatus check() {
        return ledger.isAvailable()
                ? HealthStatus.up().withDetail("type", ledger.getClass().getSimpleName())
                : HealthStatus.down("Claim ledger unavailable");
    }
}
