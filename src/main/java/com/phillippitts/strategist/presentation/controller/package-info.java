/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.strategist.presentation.controller.AnalysisController}
 *       - session creation, analysis start, polling and SWOT toggling under {@code /api/sessions}</li>
 *   <li>{@link com.phillippitts.strategist.presentation.controller.PingController}
 *       - liveness check ({@code GET /ping}) that also exercises the MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.strategist.presentation.controller;
