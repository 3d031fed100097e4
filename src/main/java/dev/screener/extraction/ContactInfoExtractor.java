package dev.screener.extraction;

import dev.screener.model.ContactInfo;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first e-mail address, phone number, LinkedIn and GitHub profile out of raw text.
 * Works on the text before cleaning, which strips e-mail addresses and URLs.
 */
@Component
public class ContactInfoExtractor {

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile("[+(]?[1-9][0-9 .\\-()]{8,}[0-9]");
    private static final Pattern LINKEDIN = Pattern.compile("linkedin\\.com/in/[\\w-]+");
    private static final Pattern GITHUB = Pattern.compile("github\\.com/[\\w-]+");

    public ContactInfo extract(String text) {
        if (text == null || text.isBlank()) {
            return ContactInfo.none();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return new ContactInfo(
                firstMatch(EMAIL, text),
                firstMatch(PHONE, text),
                firstMatch(LINKEDIN, lower),
                firstMatch(GITHUB, lower));
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group().trim() : null;
    }
}
