package com.riichimahjong.engine;

/**
 * 计分结果：成功时带 {@link ScoreBreakdown}，失败时带 {@link ScoringError}
 */
public final class ScoringResult {
    private final ScoreBreakdown breakdown;
    private final ScoringError error;
    private final String message;

    private ScoringResult(ScoreBreakdown breakdown, ScoringError error, String message) {
        this.breakdown = breakdown;
        this.error = error;
        this.message = message;
    }

    public static ScoringResult success(ScoreBreakdown breakdown) {
        return new ScoringResult(breakdown, null, null);
    }

    public static ScoringResult failure(ScoringError error, String message) {
        return new ScoringResult(null, error, message);
    }

    public boolean isSuccess() {
        return breakdown != null;
    }

    public ScoreBreakdown getBreakdown() {
        return breakdown;
    }

    public ScoringError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 是否为“无役”，界面要单独提示
     */
    public boolean isNoYaku() {
        return error == ScoringError.NO_YAKU_FOUND;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ScoringResult{" + breakdown + "}" : "ScoringResult{" + error + ": " + message + "}";
    }
}
