package com.company.incidentrisk.exception;

import com.company.incidentrisk.domain.BacktestMetrics;

public class BacktestInterruptedException extends OperationInterruptedException {

    private final BacktestMetrics partialResult;
    private final int scoredRows;
    private final int totalRows;

    public BacktestInterruptedException(String reason, BacktestMetrics partialResult, int scoredRows, int totalRows) {
        super("Backtest stopped after scoring " + scoredRows + " of " + totalRows + " rows: " + reason);
        this.partialResult = partialResult;
        this.scoredRows = scoredRows;
        this.totalRows = totalRows;
    }

    /**
     * Metrics over the rows scored so far, or null when those rows hold no positives.
     */
    @Override
    public BacktestMetrics getPartialResult() {
        return partialResult;
    }

    public int getScoredRows() {
        return scoredRows;
    }

    public int getTotalRows() {
        return totalRows;
    }
}
