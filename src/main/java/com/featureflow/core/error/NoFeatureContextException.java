package com.featureflow.core.error;

/**
 * Thrown when neither an override, a numbered branch nor a feature directory identifies the active feature.
 */
public class NoFeatureContextException extends WorkflowException {
    public NoFeatureContextException(String message) {
        super(ErrorKind.NO_FEATURE_CONTEXT, message);
    }
}
