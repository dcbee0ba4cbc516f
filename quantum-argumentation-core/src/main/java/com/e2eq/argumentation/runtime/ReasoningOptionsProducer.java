package com.e2eq.argumentation.runtime;

import com.e2eq.argumentation.config.ReasoningConfig;
import com.e2eq.argumentation.config.ReasoningOptions;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * Validates the mapped {@code argumentation.reasoning} configuration once at startup and exposes
 * the resulting {@link ReasoningOptions} for injection. An invalid option fails deployment.
 */
@ApplicationScoped
public class ReasoningOptionsProducer {

    private final ReasoningConfig config;

    private ReasoningOptions options;

    @Inject
    public ReasoningOptionsProducer(ReasoningConfig config) {
        this.config = config;
    }

    @PostConstruct
    void init() {
        this.options = ReasoningOptions.fromConfig(config);
    }

    @Produces
    public ReasoningOptions options() {
        return options;
    }
}
