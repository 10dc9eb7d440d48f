/**
 * Domain models for the strategy analysis pipeline.
 *
 * <p>All results produced by agents and by the response parser are immutable records that
 * validate themselves in their compact constructors. Mutable, per-session state lives in
 * {@link com.phillippitts.strategist.service.session.SessionState}, never here.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.strategist.domain.AgentResult} - terminal output of one agent call,
 *       tagged by {@link com.phillippitts.strategist.domain.AgentKind}</li>
 *   <li>{@link com.phillippitts.strategist.domain.Strategy} and
 *       {@link com.phillippitts.strategist.domain.SwotEntry} - structured records recovered from the
 *       final strategy text, both keyed by emission index</li>
 *   <li>{@link com.phillippitts.strategist.domain.RankedStrategy} - display ordering assigned by the ranker</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.strategist.domain;
