package io.pockethive.phased.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace splitting of tag contents that keeps quoted words (quotes included) together.
 */
final class TagArguments {

    private TagArguments() {
    }

    static List<String> split(String contents) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < contents.length(); i++) {
            char c = contents.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    words.add(current.toString());
                    current.setLength(0);
                }
            } else {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                current.append(c);
            }
        }
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return words;
    }
}
