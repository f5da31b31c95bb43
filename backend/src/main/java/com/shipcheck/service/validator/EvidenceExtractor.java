package com.shipcheck.service.validator;

import com.shipcheck.domain.FileSet;
import jakarta.inject.Singleton;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure fact extraction over generated files and fetched pages.
 *
 * Nothing here touches the network or keeps state; every method is safe to
 * call from concurrent tasks. The HTML and script heuristics are best-effort
 * signals, not parsers.
 */
@Singleton
public class EvidenceExtractor {

    private static final Pattern HEADING = Pattern.compile("(?m)^#{1,6}\\s");

    /** Hosts treated as public CDNs when scanning script/link URLs. */
    static final List<String> CDN_HOSTS = List.of(
        "cdn.jsdelivr.net",
        "cdnjs.cloudflare.com",
        "unpkg.com",
        "stackpath.bootstrapcdn.com",
        "maxcdn.bootstrapcdn.com",
        "ajax.googleapis.com",
        "code.jquery.com"
    );

    /** function foo(, const foo = (, const foo = function, arrow functions. */
    private static final Pattern FUNCTION_DEF = Pattern.compile(
        "\\bfunction\\b\\s*\\w*\\s*\\(|=>|\\b(?:const|let|var)\\s+\\w+\\s*=\\s*(?:async\\s*)?(?:function\\b|\\()");

    /** Binary arithmetic between two operands, compound assignments included. */
    private static final Pattern ARITHMETIC = Pattern.compile(
        "[\\w)\\]]\\s*[-+*/]=?\\s*[\\w(\\[.]");

    // ── Files ───────────────────────────────────────────────────────────────

    public Optional<String> findRequiredFile(FileSet files, String name) {
        return files.find(name);
    }

    public boolean isEmpty(String content) {
        return content == null || content.trim().isEmpty();
    }

    public boolean licenseIsMit(String content) {
        return content != null && content.toLowerCase(Locale.ROOT).contains("mit");
    }

    public ReadmeMetrics readmeQuality(String content) {
        if (content == null) return new ReadmeMetrics(0, 0);
        Matcher m = HEADING.matcher(content);
        int headings = 0;
        while (m.find()) headings++;
        return new ReadmeMetrics(content.length(), headings);
    }

    // ── HTML ────────────────────────────────────────────────────────────────

    /**
     * Parse HTML leniently. jsoup repairs malformed markup instead of failing,
     * so the worst case is an empty document.
     */
    public Document parseHtml(String content) {
        try {
            return Jsoup.parse(content != null ? content : "");
        } catch (RuntimeException e) {
            return Document.createShell("");
        }
    }

    public ElementMatch findElementById(Document doc, String id) {
        if (doc == null || id == null || id.isBlank()) return ElementMatch.none();
        Element el = doc.getElementById(id);
        return el != null ? ElementMatch.of(el.tagName()) : ElementMatch.none();
    }

    /**
     * Scan {@code <script src>} and {@code <link href>} for a CDN URL that names
     * the library. With a requested version, the version parsed from the URL
     * must equal it or refine it ("5" accepts "5.3.0" but not "4.6.5").
     */
    public CdnMatch findCdnLink(Document doc, String library, String version) {
        if (doc == null || library == null) return CdnMatch.none();
        String lib = library.toLowerCase(Locale.ROOT);
        CdnMatch closest = CdnMatch.none();

        for (Element el : doc.select("script[src], link[href]")) {
            String url = el.hasAttr("src") ? el.attr("src") : el.attr("href");
            String lower = url.toLowerCase(Locale.ROOT);
            if (!lower.contains(lib) || !isCdnUrl(lower)) continue;

            Optional<String> urlVersion = versionInUrl(lower, lib);
            if (version == null || version.isBlank()) {
                return new CdnMatch(true, Optional.of(url), urlVersion);
            }
            if (urlVersion.isPresent()
                && (urlVersion.get().equals(version) || urlVersion.get().startsWith(version + "."))) {
                return new CdnMatch(true, Optional.of(url), urlVersion);
            }
            if (closest.url().isEmpty()) {
                closest = new CdnMatch(false, Optional.of(url), urlVersion);
            }
        }
        return closest;
    }

    boolean isCdnUrl(String lowerUrl) {
        if (CDN_HOSTS.stream().anyMatch(lowerUrl::contains)) return true;
        String host = hostOf(lowerUrl);
        return host != null && host.contains("cdn");
    }

    private String hostOf(String url) {
        int scheme = url.indexOf("//");
        if (scheme < 0) return null;
        int start = scheme + 2;
        int end = url.indexOf('/', start);
        return end < 0 ? url.substring(start) : url.substring(start, end);
    }

    /** bootstrap@5.3.0, bootstrap/4.3.1/, bootstrap-5.2, .../npm/bootstrap@5/ */
    Optional<String> versionInUrl(String lowerUrl, String lib) {
        Pattern p = Pattern.compile(Pattern.quote(lib) + "(?:@|/|-)v?(\\d+(?:\\.\\d+)*)");
        Matcher m = p.matcher(lowerUrl);
        if (m.find()) return Optional.of(m.group(1));
        Matcher path = Pattern.compile("/v?(\\d+\\.\\d+(?:\\.\\d+)?)/").matcher(lowerUrl);
        return path.find() ? Optional.of(path.group(1)) : Optional.empty();
    }

    // ── Scripts ─────────────────────────────────────────────────────────────

    /**
     * Every script the artifact ships: standalone .js/.mjs files plus inline
     * {@code <script>} blocks of HTML files.
     */
    public String scriptSources(FileSet files) {
        StringBuilder sb = new StringBuilder();
        files.asMap().forEach((name, content) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".js") || lower.endsWith(".mjs")) {
                sb.append(content).append('\n');
            } else if (lower.endsWith(".html") || lower.endsWith(".htm")) {
                for (Element script : parseHtml(content).select("script:not([src])")) {
                    sb.append(script.data()).append('\n');
                }
            }
        });
        return sb.toString();
    }

    public boolean detectArithmeticCode(String content) {
        if (content == null || content.isBlank()) return false;
        String code = stripCommentsAndStrings(content);
        return hasFunctionDefinition(code) && hasArithmeticOperator(code);
    }

    boolean hasFunctionDefinition(String strippedCode) {
        return FUNCTION_DEF.matcher(strippedCode).find();
    }

    boolean hasArithmeticOperator(String strippedCode) {
        return ARITHMETIC.matcher(strippedCode).find();
    }

    /**
     * Blank out JS comments and string literals so operators inside them are
     * not counted. Template literals are dropped whole, interpolations included.
     */
    String stripCommentsAndStrings(String code) {
        StringBuilder out = new StringBuilder(code.length());
        int i = 0;
        int n = code.length();
        while (i < n) {
            char c = code.charAt(i);
            char next = i + 1 < n ? code.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < n && code.charAt(i) != '\n') i++;
            } else if (c == '/' && next == '*') {
                int end = code.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(' ');
            } else if (c == '"' || c == '\'' || c == '`') {
                i++;
                while (i < n && code.charAt(i) != c) {
                    if (code.charAt(i) == '\\') i++;
                    if (c != '`' && i < n && code.charAt(i) == '\n') break;
                    i++;
                }
                i++;
                out.append("\"\"");
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Visible text of a page, lower-cased. */
    public String renderedText(Document doc) {
        return doc.text().toLowerCase(Locale.ROOT);
    }
}
