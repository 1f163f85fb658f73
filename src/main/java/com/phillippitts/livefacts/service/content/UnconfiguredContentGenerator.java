package com.phillippitts.livefacts.service.content;

import com.phillippitts.livefacts.domain.ContentResult;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.exception.ContentGenerationException;

import java.util.List;

/**
 * Generator used when no real generator bean is configured. Every call fails, so sessions
 * still run and deliver numbered placeholder messages.
 */
public class UnconfiguredContentGenerator implements ContentGenerator {

    @Override
    public ContentResult generate(Coordinates position, List<String> exclusions) {
        throw new ContentGenerationException("No content generator configured", "unconfigured");
    }
}
