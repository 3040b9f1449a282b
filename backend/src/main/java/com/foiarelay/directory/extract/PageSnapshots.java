package com.foiarelay.directory.extract;

import com.foiarelay.directory.model.PageSnapshot;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link PageSnapshot}s from raw markup so extraction can run on static fetches
 * and fixtures exactly as it does on a live browser page.
 */
public final class PageSnapshots {
    private static final String BLOCK_ELEMENTS = "br, p, div, li, tr, dd, dt, address, section, "
        + "h1, h2, h3, h4, h5, h6";

    private PageSnapshots() {
    }

    public static PageSnapshot fromHtml(String url, String html) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        return new PageSnapshot(url, renderText(document), mailtoHrefs(document), firstHeading(document));
    }

    public static PageSnapshot fromRendered(String url, String html, String renderedText) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        String text = renderedText == null || renderedText.isBlank() ? renderText(document) : renderedText;
        return new PageSnapshot(url, text, mailtoHrefs(document), firstHeading(document));
    }

    static List<String> mailtoHrefs(Document document) {
        List<String> hrefs = new ArrayList<>();
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href").trim();
            if (href.regionMatches(true, 0, "mailto:", 0, 7)) {
                hrefs.add(href);
            }
        }
        return hrefs;
    }

    static String firstHeading(Document document) {
        Element heading = document.selectFirst("h1");
        return heading == null ? "" : heading.text().trim();
    }

    /**
     * Approximates a browser's innerText: one line per block element, scripts dropped,
     * runs of horizontal whitespace collapsed.
     */
    static String renderText(Document document) {
        Document copy = document.clone();
        copy.select("script, style, noscript, template").remove();
        Element body = copy.body();
        if (body == null) {
            return "";
        }
        for (Element block : body.select(BLOCK_ELEMENTS)) {
            block.appendText("\n");
        }
        String raw = body.wholeText();
        StringBuilder out = new StringBuilder(raw.length());
        for (String line : raw.split("\\R")) {
            String collapsed = line.replaceAll("[ \\t\\x0B\\f\\u00A0]+", " ").trim();
            if (!collapsed.isEmpty()) {
                out.append(collapsed).append('\n');
            }
        }
        return out.toString().trim();
    }
}
