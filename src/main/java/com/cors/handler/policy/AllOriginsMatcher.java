package com.cors.handler.policy;

/**
 * Admits every origin.
 */
public final class AllOriginsMatcher implements OriginMatcher {

    private static final AllOriginsMatcher INSTANCE = new AllOriginsMatcher();

    private AllOriginsMatcher() {
    }

    public static AllOriginsMatcher instance() {
        return INSTANCE;
    }

    @Override
    public boolean admits(String origin) {
        return true;
    }

    @Override
    public boolean admitsAll() {
        return true;
    }

    @Override
    public String toString() {
        return "AllOriginsMatcher";
    }
}
