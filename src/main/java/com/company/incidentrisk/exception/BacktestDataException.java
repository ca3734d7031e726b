package com.company.incidentrisk.exception;

/**
 * Backtest metrics are undefined for the evaluated set because it holds no positive row.
 */
public class BacktestDataException extends RuntimeException {

    private final int rowCount;
    private final int positiveCount;

    public BacktestDataException(int rowCount, int positiveCount) {
        super(String.format(
                "Backtest metrics undefined: %d rows evaluated, %d positive", rowCount, positiveCount));
        this.rowCount = rowCount;
        this.positiveCount = positiveCount;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getPositiveCount() {
        return positiveCount;
    }
}
