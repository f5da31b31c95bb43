package com.shipcheck.service.validator;

import com.shipcheck.domain.FileSet;
import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * What a check evaluator can look at: the generated files and, when there is
 * one, the parsed page (generated {@code index.html} or the fetched live page).
 *
 * @param pageSource human-readable origin of {@code page}, used in detail lines
 */
public record Evidence(FileSet files, Optional<Document> page, String pageSource) {

    static final String INDEX_HTML = "index.html";

    /** Evidence over generated files; {@code index.html} is parsed once up front. */
    public static Evidence ofFiles(FileSet files, EvidenceExtractor extractor) {
        Optional<Document> page = files.find(INDEX_HTML).map(extractor::parseHtml);
        return new Evidence(files, page, INDEX_HTML);
    }

    public static Evidence ofLivePage(Document page) {
        return new Evidence(FileSet.empty(), Optional.of(page), "live page");
    }
}
