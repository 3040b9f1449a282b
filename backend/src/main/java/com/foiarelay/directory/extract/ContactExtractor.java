package com.foiarelay.directory.extract;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.ExtractedContact;
import com.foiarelay.directory.model.PageSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text heuristics that pick a unit's contact email and display name out of a captured page.
 *
 * <p>Email selection order:
 * <ol>
 *   <li>the first {@code mailto:} target that is not the shared intake address;</li>
 *   <li>otherwise a {@code .gov/.mil/.us} address from the page text, preferring one that
 *       mentions "foia" or "request", else the first in document order;</li>
 *   <li>otherwise the empty string.</li>
 * </ol>
 * Secondary fields are regex best effort and come back empty on a miss.
 */
@Component
public class ContactExtractor {
    private static final Pattern TEXT_EMAIL = Pattern.compile(
        "[\\w.-]+@[\\w.-]+\\.(?:gov|mil|us)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern LABELED_PHONE = Pattern.compile(
        "(?i:phone|tel(?:ephone)?)[^\\d(\\n]{0,20}(\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4})"
    );
    private static final Pattern ANY_PHONE = Pattern.compile("\\(?\\b\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b");
    private static final Pattern OFFICER = Pattern.compile(
        "(?i:FOIA\\s+(?:Officer|Public\\s+Liaison|Contact))[\\s:]*"
            + "([A-Z][A-Za-z.'-]*(?:[ \\t]+[A-Z][A-Za-z.'-]*){1,3})"
    );
    private static final Pattern ZIP_LINE = Pattern.compile(
        "(?m)^[^\\n]*\\b[A-Z]{2}[ \\t]+\\d{5}(?:-\\d{4})?\\b[^\\n]*$"
    );
    private static final Pattern STREET_LINE = Pattern.compile("^(?:\\d+\\s|(?i:room|suite|p\\.?o\\.?\\s*box)\\b).*");

    private final String sharedIntakeAddress;

    public ContactExtractor(DirectoryProperties properties) {
        this.sharedIntakeAddress = normalizeAddress(properties.getScrape().getSharedIntakeAddress());
    }

    public ExtractedContact extract(PageSnapshot snapshot) {
        if (snapshot == null) {
            return ExtractedContact.empty();
        }
        return extract(snapshot.renderedText(), snapshot.mailtoHrefs(), snapshot.firstHeading());
    }

    public ExtractedContact extract(String renderedText, List<String> mailtoHrefs, String firstHeading) {
        String text = renderedText == null ? "" : renderedText;
        return new ExtractedContact(
            selectEmail(text, mailtoHrefs),
            firstHeading == null ? "" : firstHeading.trim(),
            firstGroup(OFFICER, text),
            extractPhone(text),
            extractAddress(text)
        );
    }

    public boolean isSharedIntakeAddress(String email) {
        return !sharedIntakeAddress.isEmpty() && sharedIntakeAddress.equals(normalizeAddress(email));
    }

    String selectEmail(String text, List<String> mailtoHrefs) {
        if (mailtoHrefs != null) {
            for (String href : mailtoHrefs) {
                String address = mailtoAddress(href);
                if (address.contains("@") && !isSharedIntakeAddress(address)) {
                    return address;
                }
            }
        }

        List<String> candidates = new ArrayList<>();
        Matcher matcher = TEXT_EMAIL.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (!isSharedIntakeAddress(candidate)) {
                candidates.add(candidate);
            }
        }
        if (candidates.isEmpty()) {
            return "";
        }
        for (String candidate : candidates) {
            String lower = candidate.toLowerCase(Locale.ROOT);
            if (lower.contains("foia") || lower.contains("request")) {
                return candidate;
            }
        }
        return candidates.get(0);
    }

    private String mailtoAddress(String href) {
        if (href == null) {
            return "";
        }
        String value = href.trim();
        if (value.regionMatches(true, 0, "mailto:", 0, 7)) {
            value = value.substring(7);
        }
        int query = value.indexOf('?');
        if (query >= 0) {
            value = value.substring(0, query);
        }
        return value.trim();
    }

    private String extractPhone(String text) {
        String labeled = firstGroup(LABELED_PHONE, text);
        if (!labeled.isEmpty()) {
            return labeled;
        }
        Matcher matcher = ANY_PHONE.matcher(text);
        return matcher.find() ? matcher.group().trim() : "";
    }

    private String extractAddress(String text) {
        Matcher matcher = ZIP_LINE.matcher(text);
        if (!matcher.find()) {
            return "";
        }
        String zipLine = matcher.group().trim();
        String before = text.substring(0, matcher.start());
        String[] previousLines = before.split("\\R");
        for (int i = previousLines.length - 1; i >= 0; i--) {
            String line = previousLines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (STREET_LINE.matcher(line).matches()) {
                return line + ", " + zipLine;
            }
            break;
        }
        return zipLine;
    }

    private String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    private static String normalizeAddress(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
