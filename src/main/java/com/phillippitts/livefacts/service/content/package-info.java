/**
 * Boundary to content generation.
 *
 * <p>{@link com.phillippitts.livefacts.service.content.ContentGenerator} is the external
 * collaborator; {@link com.phillippitts.livefacts.service.content.GenerationService} bounds
 * its latency and {@link com.phillippitts.livefacts.service.content.ContentParser} turns its
 * text into a place and a summary with a raw-text fallback.
 */
package com.phillippitts.livefacts.service.content;
