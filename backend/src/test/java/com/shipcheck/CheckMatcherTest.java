package com.shipcheck;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import com.shipcheck.domain.FileSet;
import com.shipcheck.service.validator.CheckClassifier;
import com.shipcheck.service.validator.CheckMatcher;
import com.shipcheck.service.validator.Evidence;
import com.shipcheck.service.validator.EvidenceExtractor;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class CheckMatcherTest {

    @Inject CheckMatcher matcher;
    @Inject CheckClassifier classifier;
    @Inject EvidenceExtractor extractor;

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static final String INDEX_HTML = "<!DOCTYPE html><html><body><div id='result'></div>"
        + "<script src='https://cdn.jsdelivr.net/npm/bootstrap@5.3.0/dist/js/bootstrap.bundle.min.js'></script>"
        + "</body></html>";

    private Map<String, String> sampleFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("index.html", INDEX_HTML);
        files.put("LICENSE", "MIT License\n\nCopyright (c) 2025");
        files.put("README.md", "# Title\n\n## Usage\n" + "Open index.html in a browser. ".repeat(10));
        return files;
    }

    private Evidence evidence(Map<String, String> files) {
        return Evidence.ofFiles(FileSet.of(files), extractor);
    }

    private CheckResult match(String check, Map<String, String> files) {
        return matcher.match(new CheckSpec(check), evidence(files));
    }

    // ── Classification ──────────────────────────────────────────────────────

    @Test
    void classify_orderedRules() {
        assertThat(classifier.classify("Repo has MIT license")).isEqualTo(CheckCategory.MIT_LICENSE);
        assertThat(classifier.classify("README.md is professional")).isEqualTo(CheckCategory.README_QUALITY);
        assertThat(classifier.classify("Page has element with id='result'")).isEqualTo(CheckCategory.HTML_ELEMENT_BY_ID);
        assertThat(classifier.classify("Page loads Bootstrap 5 from CDN")).isEqualTo(CheckCategory.CDN_SCRIPT_PRESENCE);
        assertThat(classifier.classify("Calculator performs arithmetic")).isEqualTo(CheckCategory.ARITHMETIC_OPERATIONS);
        assertThat(classifier.classify("Shows a friendly greeting")).isEqualTo(CheckCategory.GENERIC);
    }

    @Test
    void classify_mitLicenseWording_neverGeneric() {
        List<String> texts = List.of(
            "Repo has MIT license",
            "LICENSE file is MIT",
            "mit LICENSE present with element id='x'",
            "The project ships under the MIT License and loads bootstrap from cdn");

        for (String text : texts) {
            assertThat(classifier.classify(text)).as(text).isEqualTo(CheckCategory.MIT_LICENSE);
        }
    }

    @Test
    void extractElementId_quotedAndBareForms() {
        assertThat(CheckClassifier.extractElementId("element with id='total-sum'")).contains("total-sum");
        assertThat(CheckClassifier.extractElementId("has id=output")).contains("output");
        assertThat(CheckClassifier.extractElementId("an element with id 'status'")).contains("status");
        assertThat(CheckClassifier.extractElementId("no identifier here")).isEmpty();
    }

    @Test
    void extractElementId_sentencePunctuationNotPartOfId() {
        assertThat(CheckClassifier.extractElementId("Page has an element with id=result.")).contains("result");
        assertThat(CheckClassifier.extractElementId("Requires id=result: shows the sum")).contains("result");
        assertThat(CheckClassifier.extractElementId("Needs id=total-sum, styled")).contains("total-sum");
        assertThat(CheckClassifier.extractElementId("Uses id=form.input.")).contains("form.input");
    }

    @Test
    void classify_turkishDefaultLocale_sameCategories() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertThat(classifier.classify("Repo has MIT LICENSE")).isEqualTo(CheckCategory.MIT_LICENSE);
            assertThat(classifier.classify("README IS COMPLETE")).isEqualTo(CheckCategory.README_QUALITY);
            assertThat(classifier.classify("PAGE HAS ELEMENT WITH ID='result'")).isEqualTo(CheckCategory.HTML_ELEMENT_BY_ID);
        } finally {
            Locale.setDefault(previous);
        }
    }

    // ── Evaluation ──────────────────────────────────────────────────────────

    @Test
    void match_sampleArtifact_allThreeChecksPass() {
        Map<String, String> files = sampleFiles();

        assertThat(match("Repo has MIT license", files).passed()).isTrue();
        assertThat(match("Page has element with id='result'", files).passed()).isTrue();
        CheckResult cdn = match("Page loads Bootstrap 5 from CDN", files);
        assertThat(cdn.passed()).isTrue();
        assertThat(cdn.detail()).contains("5.3.0");
    }

    @Test
    void match_missingLicense_failsWithDetail() {
        Map<String, String> files = sampleFiles();
        files.remove("LICENSE");

        CheckResult result = match("Repo has MIT license", files);

        assertThat(result.passed()).isFalse();
        assertThat(result.detail()).contains("LICENSE file missing");
    }

    @Test
    void match_bareIdAtSentenceEnd_passes() {
        CheckResult result = match("Page has an element with id=result.", sampleFiles());

        assertThat(result.passed()).isTrue();
        assertThat(result.detail()).contains("id='result'");
    }

    @Test
    void match_elementMissing_namesTheId() {
        CheckResult result = match("Page has element with id='total'", sampleFiles());

        assertThat(result.passed()).isFalse();
        assertThat(result.detail()).contains("id='total'").contains("NOT found");
    }

    @Test
    void match_wrongBootstrapVersion_fails() {
        CheckResult result = match("Page loads Bootstrap 4 from CDN", sampleFiles());

        assertThat(result.passed()).isFalse();
        assertThat(result.detail()).contains("does not match");
    }

    @Test
    void match_readmeShort_failsReadmeQuality() {
        Map<String, String> files = sampleFiles();
        files.put("README.md", "# Tiny\nshort");

        CheckResult result = match("README is complete and professional", files);

        assertThat(result.category()).isEqualTo(CheckCategory.README_QUALITY);
        assertThat(result.passed()).isFalse();
        assertThat(result.detail()).contains("too short");
    }

    @Test
    void match_arithmeticInInlineScript_passes() {
        Map<String, String> files = sampleFiles();
        files.put("index.html", "<html><body><script>function sum(a, b) { return a + b; }</script></body></html>");

        CheckResult result = match("Calculator supports basic arithmetic operations", files);

        assertThat(result.passed()).isTrue();
        assertThat(result.detail()).contains("heuristic");
    }

    @Test
    void match_generic_isLowConfidence() {
        Map<String, String> files = sampleFiles();
        files.put("app.js", "document.title = 'Greeting';");

        CheckResult hit = match("Shows a greeting", files);
        CheckResult miss = match("Supports dark theme toggle", files);

        assertThat(hit.passed()).isTrue();
        assertThat(miss.passed()).isFalse();
        assertThat(hit.detail()).startsWith("Low-confidence");
        assertThat(miss.detail()).startsWith("Low-confidence");
    }

    @Test
    void match_twice_identicalResult() {
        Evidence evidence = evidence(sampleFiles());
        CheckSpec spec = new CheckSpec("Page loads Bootstrap 5 from CDN");

        assertThat(matcher.match(spec, evidence)).isEqualTo(matcher.match(spec, evidence));
    }

    @Test
    void matchAll_keepsOrderAndDuplicates() {
        List<CheckSpec> specs = List.of(
            new CheckSpec("Repo has MIT license"),
            new CheckSpec("Shows a greeting"),
            new CheckSpec("Repo has MIT license"));

        List<CheckResult> results = matcher.matchAll(specs, evidence(sampleFiles()));

        assertThat(results).hasSize(3);
        assertThat(results).extracting(r -> r.spec().rawText()).containsExactly(
            "Repo has MIT license", "Shows a greeting", "Repo has MIT license");
    }

    @Test
    void matchLive_onlyObservableCategories() {
        Evidence live = Evidence.ofLivePage(extractor.parseHtml(INDEX_HTML));

        assertThat(matcher.matchLive(new CheckSpec("Repo has MIT license"), live)).isEmpty();
        assertThat(matcher.matchLive(new CheckSpec("Page has element with id='result'"), live))
            .hasValueSatisfying(r -> assertThat(r.passed()).isTrue());
    }

    @Test
    void match_emptyFileSet_everyCheckFailsWithoutThrowing() {
        Evidence empty = Evidence.ofFiles(FileSet.empty(), extractor);

        for (String text : List.of("Repo has MIT license", "README is complete", "has id='x'",
                                   "Bootstrap from CDN", "does arithmetic", "anything at all")) {
            CheckResult result = matcher.match(new CheckSpec(text), empty);
            assertThat(result.passed()).as(text).isFalse();
            assertThat(result.detail()).as(text).isNotBlank();
        }
    }
}
