package com.riansoft.delivery_dispatch.exception;

public class EmptyInstanceException extends DispatchException {
    private final int excludedCount;

    public EmptyInstanceException(int excludedCount) {
        super("No valid customers remain after filtering (" + excludedCount + " record(s) excluded)");
        this.excludedCount = excludedCount;
    }

    public int getExcludedCount() {
        return excludedCount;
    }
}
