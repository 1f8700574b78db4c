package io.synphot.core.obsmode;

import io.synphot.core.error.ParserException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keywords of an observation mode string such as {@code acs,wfc1,f555w,mjd#54000}.
 *
 * <p>
 * The string is lower-cased, a {@code band(...)} wrapper is removed, blanks are dropped and the
 * rest is split on commas. A parameterized keyword {@code name#value} becomes the keyword
 * {@code name#} with {@code value} recorded separately.
 *
 * @param obsmode    normalized mode string
 * @param keywords   keyword set, sorted
 * @param parameters parameterized keyword (with {@code #}) → value
 */
public record ModeKeywords(String obsmode, SortedSet<String> keywords, Map<String, Double> parameters) {

    private static final Pattern BAND = Pattern.compile("band\\((.*?)\\)", Pattern.CASE_INSENSITIVE);

    public ModeKeywords {
        keywords = Collections.unmodifiableSortedSet(new TreeSet<>(keywords));
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ModeKeywords parse(String text) {
        Matcher band = BAND.matcher(text);
        String mode = (band.find() ? band.group(1) : text).toLowerCase(Locale.ROOT).replaceAll("\\s+", "");

        SortedSet<String> keywords = new TreeSet<>();
        Map<String, Double> parameters = new LinkedHashMap<>();
        for (String part : mode.split(",")) {
            if (part.isEmpty()) {
                continue;
            }
            int hash = part.indexOf('#');
            if (hash < 0) {
                keywords.add(part);
                continue;
            }
            String key = part.substring(0, hash + 1);
            try {
                parameters.put(key, Double.parseDouble(part.substring(hash + 1)));
            } catch (NumberFormatException e) {
                throw new ParserException("Invalid parameter value in keyword '" + part + "' of " + text, e, text);
            }
            keywords.add(key);
        }
        return new ModeKeywords(mode, keywords, parameters);
    }

    /** Value given for a parameterized keyword; the trailing {@code #} is optional. */
    public Double parameter(String key) {
        return parameters.get(key.endsWith("#") ? key : key + "#");
    }
}
