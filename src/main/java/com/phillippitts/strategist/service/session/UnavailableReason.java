package com.phillippitts.strategist.service.session;

/**
 * Why a slot holds the unavailable sentinel instead of a result.
 */
public enum UnavailableReason {
    /** The background call did not finish within its timeout plus grace. */
    TIMED_OUT,
    /** The call finished with an error. */
    FAILED
}
