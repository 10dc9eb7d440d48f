/**
 * Call contracts of the external text-generation agents.
 *
 * <p>The analysis core depends only on the four interfaces in this package. Implementations in
 * {@link com.phillippitts.strategist.gateway.chat} talk to an OpenAI-compatible chat completions
 * endpoint; {@link com.phillippitts.strategist.gateway.retrieval} holds the internal document
 * search. All implementations are blocking: callers decide where and how long to wait.
 *
 * <p>Failures surface as {@link com.phillippitts.strategist.exception.GatewayException}; a gateway
 * that cannot be constructed throws
 * {@link com.phillippitts.strategist.exception.GatewayConfigurationException} once, at startup.
 *
 * @since 1.0
 */
package com.phillippitts.strategist.gateway;
