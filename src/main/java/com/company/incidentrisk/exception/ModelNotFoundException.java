package com.company.incidentrisk.exception;

public class ModelNotFoundException extends RuntimeException {

    public ModelNotFoundException(long version) {
        super("Model version not found: " + version);
    }

    public ModelNotFoundException(String message) {
        super(message);
    }

    public static ModelNotFoundException noActiveModel(String modelFamily) {
        return new ModelNotFoundException("No model has been activated for family " + modelFamily);
    }
}
