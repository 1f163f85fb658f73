/**
 * Application services.
 *
 * <p>{@link com.phillippitts.livefacts.service.LiveLocationService} maps decoded client
 * signals onto the session registry in {@code service.tracking}. Content generation lives
 * in {@code service.content}, outgoing messages in {@code service.delivery}.
 */
package com.phillippitts.livefacts.service;
