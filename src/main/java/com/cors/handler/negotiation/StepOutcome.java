package com.cors.handler.negotiation;

import org.slf4j.helpers.MessageFormatter;

/**
 * Result of a single {@link NegotiationStep}: either continue with the next step, or
 * stop the chain silently with a reason used only for diagnostics.
 */
public final class StepOutcome {

    private static final Object[] NO_ARGS = new Object[0];
    private static final StepOutcome CONTINUE = new StepOutcome(false, null, NO_ARGS);

    private final boolean abort;
    private final String reasonPattern;
    private final Object[] reasonArgs;

    private StepOutcome(boolean abort, String reasonPattern, Object[] reasonArgs) {
        this.abort = abort;
        this.reasonPattern = reasonPattern;
        this.reasonArgs = reasonArgs;
    }

    public static StepOutcome proceed() {
        return CONTINUE;
    }

    /**
     * Stops the chain. The reason uses SLF4J {@code {}} placeholders and is only formatted
     * when {@link #getReason()} is called.
     */
    public static StepOutcome abort(String reasonPattern, Object... args) {
        return new StepOutcome(true, reasonPattern, args == null ? NO_ARGS : args);
    }

    public boolean isAbort() {
        return abort;
    }

    /**
     * Why the chain stopped, or null when the outcome is a continue.
     */
    public String getReason() {
        if (reasonPattern == null || reasonArgs.length == 0) {
            return reasonPattern;
        }
        return MessageFormatter.arrayFormat(reasonPattern, reasonArgs).getMessage();
    }

    @Override
    public String toString() {
        return abort ? "ABORT(" + getReason() + ")" : "CONTINUE";
    }
}
