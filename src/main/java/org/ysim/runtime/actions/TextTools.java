package org.ysim.runtime.actions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleanup and token extraction for generated text.
 */
public final class TextTools {

    private static final Pattern HASHTAG = Pattern.compile("#\\w+");
    private static final Pattern MENTION = Pattern.compile("@\\w+");
    private static final Pattern WORD_SPLIT = Pattern.compile("[\\s'\"*:\\[\\],.]+");

    private TextTools() {
    }

    /**
     * Strips the formatting artefacts language models tend to add around a post.
     * <p>
     * Keeps only the text after the last {@code ##} marker, removes dashes, brackets and dangling
     * mention signs, and drops self-mentions of {@code authorName}.
     *
     * @param text       raw model output
     * @param authorName name of the writing actor
     * @return the cleaned text, possibly empty
     */
    public static String cleanText(String text, String authorName) {
        if (text == null) {
            return "";
        }
        int marker = text.lastIndexOf("##");
        String t = marker >= 0 ? text.substring(marker + 2) : text;
        t = t.replace("-", "")
                .replace("@ ", "")
                .replace("  ", " ")
                .replace(" ,", ",")
                .replace("[", "")
                .replace("]", "")
                .replace("@,", "")
                .replace("\"", "");
        t = stripEnclosing(t.strip());
        if (authorName != null && !authorName.isEmpty()) {
            t = t.replace("@" + authorName, "").strip();
        }
        return t;
    }

    public static List<String> hashtags(String text) {
        return findAll(HASHTAG, text);
    }

    public static List<String> mentions(String text) {
        return findAll(MENTION, text);
    }

    /**
     * Extracts the emotions named in a model answer, keeping only words of the allowed vocabulary.
     *
     * @param answer  the model answer
     * @param allowed emotion vocabulary, lower case
     * @return distinct emotions in order of appearance
     */
    public static List<String> emotions(String answer, List<String> allowed) {
        if (answer == null || allowed.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        for (String word : WORD_SPLIT.split(answer.toLowerCase(Locale.ROOT))) {
            if (allowed.contains(word)) {
                found.add(word);
            }
        }
        return List.copyOf(found);
    }

    /**
     * Tests whether a model answer contains a keyword as a whole word, ignoring case and {@code !}.
     */
    public static boolean containsWord(String answer, String word) {
        if (answer == null) {
            return false;
        }
        for (String token : answer.replace("!", "").toUpperCase(Locale.ROOT).split("\\s+")) {
            if (token.replaceAll("[^A-Z]", "").equals(word)) {
                return true;
            }
        }
        return false;
    }

    private static String stripEnclosing(String t) {
        int start = 0;
        int end = t.length();
        while (start < end && "()[]{}'".indexOf(t.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && "()[]{}'".indexOf(t.charAt(end - 1)) >= 0) {
            end--;
        }
        return t.substring(start, end).strip();
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        return result;
    }
}
