/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.agenthandoff.config.ThreadPoolConfig} - synthesis and handoff
 *       executors plus the shared scheduler</li>
 *   <li>{@link com.phillippitts.agenthandoff.config.SynthesisConfig} - category table and
 *       default synthesizer</li>
 *   <li>{@link com.phillippitts.agenthandoff.config.ThreadPoolMetricsConfig} - pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code handoff.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.agenthandoff.config;
