package com.cors.handler.negotiation;

/**
 * One check or action in a {@link NegotiationChain}. Steps may write response headers
 * through the negotiation before returning.
 */
@FunctionalInterface
public interface NegotiationStep {

    StepOutcome apply(Negotiation negotiation);
}
