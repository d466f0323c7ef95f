/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - set by {@link com.phillippitts.agenthandoff.config.logging.MdcFilter}
 *       for every HTTP request</li>
 *   <li>{@code contextId} - taken from the request path by the filter, and set again by the
 *       orchestrator for work it runs on pool threads</li>
 * </ul>
 *
 * @see com.phillippitts.agenthandoff.config.logging.MdcFilter
 */
package com.phillippitts.agenthandoff.config.logging;
