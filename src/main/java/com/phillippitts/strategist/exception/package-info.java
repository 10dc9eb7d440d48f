/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.strategist.exception.StrategistException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.strategist.exception.GatewayException} - An agent call failed
 *       (network, auth, provider). Isolated to that agent's result slot</li>
 *   <li>{@link com.phillippitts.strategist.exception.GatewayConfigurationException} - A gateway
 *       could not be constructed, typically a missing credential. Raised once, never retried</li>
 *   <li>{@link com.phillippitts.strategist.exception.AnalysisFailedException} - The primary call
 *       of an analysis failed or overran its deadline</li>
 *   <li>{@link com.phillippitts.strategist.exception.SessionNotFoundException} - Unknown session id</li>
 * </ul>
 *
 * <p>Timeouts of background agents are not exceptions: they are a terminal task state recorded
 * by the reconciliation loop. Malformed model output is never an exception either; the parser
 * degrades to an empty report.
 *
 * @see com.phillippitts.strategist.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.strategist.exception;
