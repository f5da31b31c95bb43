package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Singleton;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback for checks no other rule understands: passes when any
 * non-trivial keyword of the check occurs in the generated content.
 * Always reported as low confidence.
 */
@Singleton
public class GenericKeywordEvaluator implements CheckEvaluator {

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    static final Set<String> STOPWORDS = Set.of(
        "page", "element", "have", "must", "should", "repo", "file", "files",
        "with", "that", "this", "from", "into", "when", "then", "there", "their",
        "will", "shall", "does", "each", "some", "also", "able", "uses", "using",
        "contains", "contain", "include", "includes", "show", "shows", "display",
        "displays", "exist", "exists", "present", "make", "sure", "properly",
        "correctly", "work", "works", "site", "website", "application", "app"
    );

    @Override
    public CheckCategory category() {
        return CheckCategory.GENERIC;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        List<String> keywords = keywords(spec.rawText());
        if (keywords.isEmpty()) {
            return CheckResult.fail(spec, category(),
                "Low-confidence check: no usable keywords in check text");
        }

        String haystack = evidence.files().concatenated().toLowerCase(Locale.ROOT);

        List<String> found = keywords.stream().filter(haystack::contains).toList();
        if (!found.isEmpty()) {
            return CheckResult.pass(spec, category(),
                "Low-confidence keyword match: found " + found + " of " + keywords);
        }
        return CheckResult.fail(spec, category(),
            "Low-confidence keyword match: none of " + keywords + " found in generated content");
    }

    /** Distinct lower-case words of four or more letters, stopwords removed. */
    List<String> keywords(String text) {
        Set<String> words = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String w = m.group();
            if (!STOPWORDS.contains(w)) words.add(w);
        }
        return List.copyOf(words);
    }
}
