/**
 * Unchecked exception hierarchy rooted at
 * {@link com.phillippitts.livefacts.exception.LiveFactsException}.
 *
 * <p>Only {@link com.phillippitts.livefacts.exception.SessionStartException} ever reaches a
 * caller of the session registry. Generation and delivery failures are recovered inside the
 * delivery loop.
 */
package com.phillippitts.livefacts.exception;
