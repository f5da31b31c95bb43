package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-text check wording onto a {@link CheckCategory}.
 *
 * Rules are tried in order and the first match wins; several rules can match
 * the same text, so the order below is part of the contract:
 *   1. "mit" + "license"                                → MIT_LICENSE
 *   2. "readme" + professional|complete|quality         → README_QUALITY
 *   3. an identifier after id= or id '                  → HTML_ELEMENT_BY_ID
 *   4. "bootstrap" + cdn|load                           → CDN_SCRIPT_PRESENCE
 *   5. arithmetic|calculat|operation                    → ARITHMETIC_OPERATIONS
 *   6. anything else                                    → GENERIC
 */
@Singleton
public class CheckClassifier {

    private static final Pattern ID_ASSIGNMENT =
        Pattern.compile("(?i)\\bid\\s*=\\s*[\"']?([A-Za-z_]\\w*(?:[.:-]\\w+)*)");
    private static final Pattern ID_QUOTED =
        Pattern.compile("(?i)\\bid\\s+[\"']([^\"']+)[\"']");
    private static final Pattern LIBRARY_VERSION =
        Pattern.compile("(?i)\\bbootstrap\\s*v?(\\d+(?:\\.\\d+)*)");
    private static final Pattern VERSION_WORD =
        Pattern.compile("(?i)\\bversion\\s*v?(\\d+(?:\\.\\d+)*)");

    record Rule(String name, Predicate<String> matches, CheckCategory category) {}

    private static final List<Rule> RULES = List.of(
        new Rule("mit-license",
            t -> t.contains("mit") && t.contains("license"),
            CheckCategory.MIT_LICENSE),
        new Rule("readme-quality",
            t -> t.contains("readme")
                && (t.contains("professional") || t.contains("complete") || t.contains("quality")),
            CheckCategory.README_QUALITY),
        new Rule("element-id",
            t -> extractElementId(t).isPresent(),
            CheckCategory.HTML_ELEMENT_BY_ID),
        new Rule("bootstrap-cdn",
            t -> t.contains("bootstrap") && (t.contains("cdn") || t.contains("load")),
            CheckCategory.CDN_SCRIPT_PRESENCE),
        new Rule("arithmetic",
            t -> t.contains("arithmetic") || t.contains("calculat") || t.contains("operation"),
            CheckCategory.ARITHMETIC_OPERATIONS)
    );

    public CheckCategory classify(String checkText) {
        if (checkText == null) return CheckCategory.GENERIC;
        String lower = checkText.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches().test(lower)) {
                return rule.category();
            }
        }
        return CheckCategory.GENERIC;
    }

    /** Element id named by the check ("id='result'", "id=result", "id 'result'"). */
    public static Optional<String> extractElementId(String checkText) {
        if (checkText == null) return Optional.empty();
        Matcher m = ID_ASSIGNMENT.matcher(checkText);
        if (m.find()) return Optional.of(m.group(1));
        m = ID_QUOTED.matcher(checkText);
        if (m.find() && !m.group(1).isBlank()) return Optional.of(m.group(1).trim());
        return Optional.empty();
    }

    /** Requested library version, e.g. "5" from "Page loads Bootstrap 5 from CDN". */
    public static Optional<String> extractVersion(String checkText) {
        if (checkText == null) return Optional.empty();
        Matcher m = LIBRARY_VERSION.matcher(checkText);
        if (m.find()) return Optional.of(m.group(1));
        m = VERSION_WORD.matcher(checkText);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
