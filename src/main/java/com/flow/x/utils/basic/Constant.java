package com.flow.x.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String ALGORITHM = "algorithm";
    public static final String REASON = "reason";
}
