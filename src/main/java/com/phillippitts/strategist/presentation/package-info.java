/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package is the HTTP boundary of the application. It replaces an interactive
 * re-rendering UI with a polling API: clients start an analysis, then poll the session view
 * until no agent is pending.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they delegate to
 * {@link com.phillippitts.strategist.service.analysis.AnalysisService} and never throw
 * HTTP-specific exceptions.
 *
 * @see com.phillippitts.strategist.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.strategist.presentation;
