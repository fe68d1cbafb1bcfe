package org.dxworks.cobolframe.analyzer.cobol;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collects the targets of control-transfer statements in a block of procedure text.
 * Every occurrence is recorded, uppercased, in text order; nothing is de-duplicated.
 * <p>
 * The call list is narrower than a plain "keyword followed by a word" scan:
 * <ul>
 *   <li>the words of inline and looping forms ({@code PERFORM UNTIL}, {@code PERFORM VARYING},
 *       {@code PERFORM WITH TEST}, {@code PERFORM FOREVER}) are not recorded as targets;</li>
 *   <li>a keyword that ends a hyphenated word ({@code END-PERFORM}) does not start a call;</li>
 *   <li>only the first name of {@code PERFORM A THRU B} is recorded.</li>
 * </ul>
 */
public final class CallExtractor {

    // Words that follow PERFORM in inline and looping forms and never name a paragraph
    private static final Set<String> INLINE_PERFORM_WORDS = Set.of("UNTIL", "VARYING", "WITH", "TEST", "FOREVER");

    private final Pattern pattern;

    public CallExtractor(Set<TransferKeyword> keywords) {
        Objects.requireNonNull(keywords, "keywords");
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one transfer keyword is required");
        }
        this.pattern = compile(EnumSet.copyOf(keywords));
    }

    public static CallExtractor performOnly() {
        return new CallExtractor(EnumSet.of(TransferKeyword.PERFORM));
    }

    public List<String> extract(String code) {
        List<String> calls = new ArrayList<>();
        if (code == null || code.isEmpty()) return calls;

        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            String target = matcher.group(1).toUpperCase(Locale.ROOT);
            if (INLINE_PERFORM_WORDS.contains(target)) continue;
            calls.add(target);
        }
        return calls;
    }

    private static Pattern compile(Set<TransferKeyword> keywords) {
        String alternatives = keywords.stream()
                .map(TransferKeyword::regex)
                .collect(Collectors.joining("|"));
        return Pattern.compile(
            "(?<![A-Z0-9-])(?:" + alternatives + ")(" + CobolPatterns.IDENTIFIER + ")",
            Pattern.CASE_INSENSITIVE
        );
    }
}
