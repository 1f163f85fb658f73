package com.phillippitts.livefacts.domain;

import java.util.Objects;

/**
 * Place and summary extracted from generated text.
 *
 * @param place          place name, or a localized "near you" label when none was found
 * @param summary        fact text; the full raw text when the structured parse failed
 * @param searchKeywords keywords suggested by the generator, empty when absent
 * @param structured     {@code true} if the text matched a known structured format
 */
public record ParsedContent(String place, String summary, String searchKeywords, boolean structured) {

    public ParsedContent {
        Objects.requireNonNull(place, "place");
        Objects.requireNonNull(summary, "summary");
        searchKeywords = searchKeywords == null ? "" : searchKeywords;
    }

    /**
     * History entry in the {@code "{place}: {summary}"} form used as an exclusion hint.
     */
    public String historyEntry() {
        return place + ": " + summary;
    }
}
