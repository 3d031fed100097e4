package dev.screener.dictionary;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Prepares raw document text for skill extraction.
 * Markup is removed without collapsing line breaks, since section scanning splits on them.
 */
@Component
public class TextCleaner {

    private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_TAG = Pattern.compile("<\\s*/?\\s*(br|p|li|div|ul|ol|tr|h[1-6])\\b[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL = Pattern.compile("\\S+@\\S+\\.\\S+");
    private static final Document.OutputSettings RAW_OUTPUT = new Document.OutputSettings().prettyPrint(false);

    public String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String plain = stripMarkup(text);
        plain = URL.matcher(plain).replaceAll(" ");
        return EMAIL.matcher(plain).replaceAll(" ");
    }

    /**
     * Strip HTML tags and decode entities. Plain text passes through untouched.
     */
    public String stripMarkup(String text) {
        if (text.indexOf('<') < 0) {
            return text;
        }
        String lineBroken = BLOCK_TAG.matcher(text).replaceAll("\n$0");
        String withoutTags = Jsoup.clean(lineBroken, "", Safelist.none(), RAW_OUTPUT);
        return Parser.unescapeEntities(withoutTags, false);
    }
}
