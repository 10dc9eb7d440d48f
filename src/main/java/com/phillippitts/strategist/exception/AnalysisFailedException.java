package com.phillippitts.strategist.exception;

/**
 * Thrown by {@code startAnalysis} when the primary retrieval call throws or overruns its deadline.
 * The message is generic; the cause carries the detail for logs.
 */
public class AnalysisFailedException extends StrategistException {

    private final String sessionId;

    public AnalysisFailedException(String sessionId, Throwable cause) {
        super("Analysis could not be completed", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
