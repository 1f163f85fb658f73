package com.phillippitts.livefacts.service.content;

import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.domain.ContentResult;
import com.phillippitts.livefacts.exception.ContentGenerationException;

import java.util.List;

/**
 * Boundary to the external service that describes something interesting near a position.
 *
 * <p>Calls may take seconds and may fail. Implementations do not need to enforce a
 * timeout; {@link GenerationService} bounds every call.
 */
public interface ContentGenerator {

    /**
     * Generates content for a position.
     *
     * @param position   where the user currently is
     * @param exclusions recent {@code "place: summary"} entries the result should not repeat,
     *                   oldest first
     * @return generated text and an optional coordinate of the described place
     * @throws ContentGenerationException if nothing could be generated
     */
    ContentResult generate(Coordinates position, List<String> exclusions);
}
