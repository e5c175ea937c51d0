package de.bsommerfeld.launchpad.core.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw argument string into tokens the way a shell would for the
 * simple cases: whitespace separates tokens, single or double quotes group
 * a token and are removed.
 */
public final class CommandLineTokenizer {

    private CommandLineTokenizer() {
    }

    public static List<String> tokenize(String raw) {
        List<String> tokens = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
