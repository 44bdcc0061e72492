package com.grantradar.catalog.classify;

import java.util.regex.Pattern;

/**
 * Adds {@code tag} to a record whose text matches {@code pattern}.
 */
public record TagRule(String tag, Pattern pattern) {

    public static TagRule of(String tag, String regex) {
        return new TagRule(tag, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
