package com.libragraph.attest.core.health;

import com.libragraph.attest.core.ledger.LedgerAnchorService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class LedgerHealthCheck implements HealthCheck {

    @Inject
    LedgerAnchorService ledger;

    @ConfigProperty(name = "attest.ledger.type")
    String ledgerType;

    @Override
    public HealthCheckResponse call() {
        try {
            boolean reachable = ledger.isReachable().await().indefinitely();
            return HealthCheckResponse.named("ledger")
                    .status(reachable)
                    .withData("type", ledgerType)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("ledger")
                    .down()
                    .withData("type", ledgerType)
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
