package com.company.incidentrisk.exception;

public class InsufficientTrainingDataException extends RuntimeException {

    private final int rowCount;
    private final int positiveCount;
    private final int minRows;

    public InsufficientTrainingDataException(int rowCount, int positiveCount, int minRows) {
        super(String.format(
                "Insufficient training data: %d rows (%d positive, %d negative), need at least %d rows with both labels",
                rowCount, positiveCount, rowCount - positiveCount, minRows));
        this.rowCount = rowCount;
        this.positiveCount = positiveCount;
        this.minRows = minRows;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getPositiveCount() {
        return positiveCount;
    }

    public int getMinRows() {
        return minRows;
    }
}
