package com.shipcheck.service.validator;

import com.shipcheck.domain.FileSet;
import com.shipcheck.dto.StaticResult;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed structural battery over generated files, independent of the caller's checks:
 *   1. index.html, LICENSE and README.md present and non-empty
 *   2. LICENSE is MIT
 *   3. README.md meets the quality floor
 *   4. index.html has a DOCTYPE, an html tag and a body tag
 *
 * Every failed assertion adds one error; nothing short-circuits.
 * Missing head/title tags and a single-section README are warnings only.
 */
@Singleton
public class StaticValidator {

    private static final Logger log = LoggerFactory.getLogger(StaticValidator.class);

    static final List<String> REQUIRED_FILES = List.of("index.html", "LICENSE", "README.md");

    @Inject EvidenceExtractor extractor;

    public StaticResult validate(FileSet files) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String name : REQUIRED_FILES) {
            Optional<String> content = extractor.findRequiredFile(files, name);
            if (content.isEmpty()) {
                errors.add("Missing required file: " + name);
            } else if (extractor.isEmpty(content.get())) {
                errors.add(name + " is empty or whitespace only");
            }
        }

        extractor.findRequiredFile(files, "LICENSE")
            .filter(license -> !extractor.isEmpty(license))
            .ifPresent(license -> {
                if (!extractor.licenseIsMit(license)) {
                    errors.add("LICENSE file does not appear to be MIT license");
                }
            });

        extractor.findRequiredFile(files, "README.md")
            .ifPresent(readme -> checkReadme(readme, errors, warnings));

        extractor.findRequiredFile(files, "index.html")
            .ifPresent(html -> checkHtmlSkeleton(html, errors, warnings));

        StaticResult result = StaticResult.of(errors, warnings);
        log.info("Static validation: {} errors, {} warnings", errors.size(), warnings.size());
        return result;
    }

    /** Hard fail used when the generator produced nothing to validate. */
    public StaticResult noFiles(String reason) {
        return StaticResult.failed("No generated files to validate: " + reason);
    }

    private void checkReadme(String readme, List<String> errors, List<String> warnings) {
        ReadmeMetrics metrics = extractor.readmeQuality(readme);
        if (metrics.tooShort()) {
            errors.add("README.md is too short (" + metrics.length() + " chars, need more than "
                + ReadmeMetrics.MIN_LENGTH + ")");
        }
        if (!metrics.hasHeadings()) {
            errors.add("README.md lacks markdown headings");
        } else if (!metrics.hasSections()) {
            warnings.add("README.md has a single heading and no further sections");
        }
    }

    private void checkHtmlSkeleton(String html, List<String> errors, List<String> warnings) {
        String lower = html.toLowerCase(Locale.ROOT);
        if (!lower.contains("<!doctype")) {
            errors.add("index.html missing DOCTYPE declaration");
        }
        if (!lower.contains("<html")) {
            errors.add("index.html missing <html> tag");
        }
        if (!lower.contains("<body")) {
            errors.add("index.html missing <body> tag");
        }
        if (!lower.contains("<head")) {
            warnings.add("index.html missing <head> tag");
        }
        if (!lower.contains("<title")) {
            warnings.add("index.html missing <title> tag");
        }
    }
}
