/**
 * Boundary to the messaging transport plus localized message rendering.
 */
package com.phillippitts.livefacts.service.delivery;
