package com.congruence.mining;

import com.congruence.core.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a configured command prefix into words the way a POSIX shell would,
 * honouring single quotes, double quotes and backslash escapes. No expansion
 * of variables or globs takes place.
 */
final class CommandLineSplitter {

    private CommandLineSplitter() {
    }

    static List<String> split(String line) {
        var words = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inWord = false;
        char quote = 0;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < line.length() && "\"\\$`".indexOf(line.charAt(i + 1)) >= 0) {
                    current.append(line.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 < line.length()) {
                    current.append(line.charAt(++i));
                }
                inWord = true;
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
        if (quote != 0) {
            throw new ValidationException("Unterminated quote in miner run script: " + line);
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }
}
