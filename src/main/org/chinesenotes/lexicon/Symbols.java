package org.chinesenotes.lexicon;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into input symbols. A symbol is a single Unicode code point, so characters outside the Basic
 * Multilingual Plane (CJK Extension B and later) are one symbol even though they take two Java chars.
 */
final class Symbols {

    private Symbols() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static List<String> of(String text) {
        List<String> symbols = new ArrayList<>(text.length());
        int i = 0;
        while (i < text.length()) {
            int next = text.offsetByCodePoints(i, 1);
            symbols.add(text.substring(i, next));
            i = next;
        }
        return symbols;
    }
}
