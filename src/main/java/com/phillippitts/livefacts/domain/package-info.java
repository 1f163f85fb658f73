/**
 * Immutable domain models shared by the tracking scheduler and its collaborators.
 *
 * <ul>
 *   <li>{@link com.phillippitts.livefacts.domain.Coordinates} - validated coordinate pair</li>
 *   <li>{@link com.phillippitts.livefacts.domain.ContentResult} - raw generator output</li>
 *   <li>{@link com.phillippitts.livefacts.domain.ParsedContent} - place/summary after parsing</li>
 * </ul>
 */
package com.phillippitts.livefacts.domain;
