package com.libragraph.attest.core.health;

import com.libragraph.attest.core.baseline.BaselineStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class BaselineStoreHealthCheck implements HealthCheck {

    @Inject
    BaselineStore baselines;

    @Override
    public HealthCheckResponse call() {
        try {
            if (!baselines.isAvailable()) {
                return HealthCheckResponse.named("baseline-store")
                        .down()
                        .build();
            }
            return HealthCheckResponse.named("baseline-store")
                    .up()
                    .withData("baselines", baselines.list().size())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("baseline-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
