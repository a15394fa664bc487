package com.brianxiadong.insertbenchmark.exception;

import com.brianxiadong.insertbenchmark.model.TrialResult;

/**
 * 重复试验中某一次失败，整组统计作废
 */
public class TrialFailedException extends BenchmarkException {

    private final transient TrialResult failedTrial;

    private final int trialIndex;

    public TrialFailedException(int trialIndex, TrialResult failedTrial) {
        super(failedTrial.getErrorMessage());
        this.trialIndex = trialIndex;
        this.failedTrial = failedTrial;
    }

    public TrialResult getFailedTrial() {
        return failedTrial;
    }

    /**
     * 失败试验的序号（从0开始）
     */
    public int getTrialIndex() {
        return trialIndex;
    }
}
