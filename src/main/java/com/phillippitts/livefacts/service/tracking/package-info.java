/**
 * Per-user live-location tracking sessions.
 *
 * <p>{@link com.phillippitts.livefacts.service.tracking.SessionRegistry} keeps at most one
 * session per user. Every session runs two tasks on the session pool:
 * <ul>
 *   <li>{@link com.phillippitts.livefacts.service.tracking.DeliveryLoop} - generates and
 *       delivers numbered content at the chosen interval until expiry</li>
 *   <li>{@link com.phillippitts.livefacts.service.tracking.HealthMonitor} - ends the session
 *       once position updates stop arriving</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.livefacts.service.tracking.SessionState} fields each have a
 * single writer: the registry writes the position, the delivery loop writes the counter and
 * the history. The phase is the only field both tasks change, through compare-and-set.
 */
package com.phillippitts.livefacts.service.tracking;
