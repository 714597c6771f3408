/**
 * Logging infrastructure: MDC (Log4j2 ThreadContext) population for request correlation.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, set by {@link com.phillippitts.mindscribe.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - set by the session controller and carried into worker threads by the
 *       executor task decorator</li>
 * </ul>
 */
package com.phillippitts.mindscribe.config.logging;
