package com.phillippitts.livefacts.service.content;

import com.phillippitts.livefacts.domain.ParsedContent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of place and summary from generated text.
 *
 * <p>Recognized formats, tried in order:
 * <ol>
 *   <li>An {@code <answer>...</answer>} block containing {@code Location:}, optional
 *       {@code Search:} and {@code Interesting fact:} lines (the fact may span lines)</li>
 *   <li>Line-prefixed text with {@code Location:}/{@code Локация:} and
 *       {@code Interesting fact:}/{@code Интересный факт:} lines</li>
 * </ol>
 * Anything else is not an error: the whole text becomes the summary and the caller's
 * fallback place is used.
 */
@Component
public class ContentParser {

    private static final Pattern ANSWER = Pattern.compile("<answer>(.*?)</answer>", Pattern.DOTALL);
    private static final Pattern LOCATION = Pattern.compile("Location:\\s*(.+?)(?:\\n|$)");
    private static final Pattern SEARCH = Pattern.compile("Search:\\s*(.+?)(?:\\n|$)");
    private static final Pattern FACT = Pattern.compile("Interesting fact:\\s*(.*)", Pattern.DOTALL);

    private static final List<String> PLACE_PREFIXES = List.of("Location:", "Локация:");
    private static final List<String> FACT_PREFIXES = List.of("Interesting fact:", "Интересный факт:");
    private static final List<String> SEARCH_PREFIXES = List.of("Search:", "Поиск:");

    /**
     * Parses generated text.
     *
     * @param raw           generator output (must not be null)
     * @param fallbackPlace place label used when the text names none
     * @return parsed content; never null
     */
    public ParsedContent parse(String raw, String fallbackPlace) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(fallbackPlace, "fallbackPlace");

        Matcher answer = ANSWER.matcher(raw);
        if (answer.find()) {
            ParsedContent tagged = parseAnswerBlock(answer.group(1).trim(), fallbackPlace);
            if (tagged != null) {
                return tagged;
            }
        }
        ParsedContent prefixed = parsePrefixedLines(raw, fallbackPlace);
        if (prefixed != null) {
            return prefixed;
        }
        return new ParsedContent(fallbackPlace, raw.trim(), "", false);
    }

    private ParsedContent parseAnswerBlock(String content, String fallbackPlace) {
        String place = firstGroup(LOCATION, content);
        String search = firstGroup(SEARCH, content);
        String fact = firstGroup(FACT, content);
        if (place == null && fact == null) {
            return null;
        }
        return new ParsedContent(
                place == null ? fallbackPlace : place,
                fact == null ? content : fact,
                search,
                true);
    }

    private ParsedContent parsePrefixedLines(String raw, String fallbackPlace) {
        String[] lines = raw.split("\n");
        String place = null;
        String search = null;
        String fact = null;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            String value = stripPrefix(line, PLACE_PREFIXES);
            if (value != null) {
                place = value;
                continue;
            }
            value = stripPrefix(line, SEARCH_PREFIXES);
            if (value != null) {
                search = value;
                continue;
            }
            value = stripPrefix(line, FACT_PREFIXES);
            if (value != null) {
                // The fact runs to the end of the text
                List<String> parts = new ArrayList<>();
                if (!value.isEmpty()) {
                    parts.add(value);
                }
                for (int j = i + 1; j < lines.length; j++) {
                    String next = lines[j].trim();
                    if (!next.isEmpty()) {
                        parts.add(next);
                    }
                }
                fact = String.join(" ", parts);
                break;
            }
        }
        if (place == null && fact == null) {
            return null;
        }
        return new ParsedContent(
                place == null ? fallbackPlace : place,
                fact == null ? raw.trim() : fact,
                search,
                true);
    }

    private static String stripPrefix(String line, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (line.startsWith(prefix)) {
                return line.substring(prefix.length()).trim();
            }
        }
        return null;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        String value = m.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
