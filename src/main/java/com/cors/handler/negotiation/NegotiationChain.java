package com.cors.handler.negotiation;

import org.slf4j.Logger;

import java.util.List;

/**
 * Ordered list of {@link NegotiationStep}s run until the first abort.
 * Immutable and safe to share between requests.
 */
public final class NegotiationChain {

    private final String name;
    private final List<NegotiationStep> steps;

    public NegotiationChain(String name, List<NegotiationStep> steps) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Chain name must not be null or blank");
        }
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    /**
     * Runs the steps in order, stopping at the first abort.
     *
     * @return the aborting outcome, or {@link StepOutcome#proceed()} if every step continued
     */
    public StepOutcome run(Negotiation negotiation, Logger log) {
        for (NegotiationStep step : steps) {
            StepOutcome outcome = step.apply(negotiation);
            if (outcome.isAbort()) {
                if (log.isInfoEnabled()) {
                    log.info("cors.{}.aborted reason={}", name, outcome.getReason());
                }
                return outcome;
            }
        }
        return StepOutcome.proceed();
    }

    public String getName() {
        return name;
    }

    public int size() {
        return steps.size();
    }
}
