package com.riichimahjong.engine;

/**
 * 计分过程中的失败，由 {@link ScoringEngine} 转换为 {@link ScoringResult}
 */
public class ScoringException extends RuntimeException {

    private final ScoringError error;

    public ScoringException(ScoringError error) {
        this(error, error.getDefaultMessage());
    }

    public ScoringException(ScoringError error, String message) {
        super(message);
        this.error = error;
    }

    public ScoringError getError() {
        return error;
    }
}
