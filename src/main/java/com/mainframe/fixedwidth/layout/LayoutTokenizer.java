package com.mainframe.fixedwidth.layout;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.fixedwidth.exception.LayoutParseException;

/**
 * Splits one layout line into words. Words are separated by whitespace; single quotes group
 * characters (including spaces) into a word and are removed; {@code #} outside quotes starts a
 * comment.
 */
public class LayoutTokenizer {

    public List<String> tokenize(String line, int lineNumber) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean inWord = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '\'') {
                    inQuotes = false;
                } else {
                    current.append(c);
                }
            } else if (c == '\'') {
                inQuotes = true;
                inWord = true;
            } else if (c == '#') {
                break;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
            } else {
                current.append(c);
                inWord = true;
            }
        }

        if (inQuotes) {
            throw new LayoutParseException(lineNumber, "Unterminated quote");
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }
}
