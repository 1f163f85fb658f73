/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.livefacts.config.ThreadPoolConfig} - session and content
 *       generation executors</li>
 *   <li>{@link com.phillippitts.livefacts.config.ThreadPoolMetricsConfig} - pool gauges</li>
 *   <li>{@link com.phillippitts.livefacts.config.CollaboratorConfig} - fallback generator
 *       and delivery channel</li>
 * </ul>
 *
 * <p>Externalized settings live in {@code application.properties} and are bound from the
 * {@code tracking.*} and {@code threadpool.*} prefixes.
 */
package com.phillippitts.livefacts.config;
