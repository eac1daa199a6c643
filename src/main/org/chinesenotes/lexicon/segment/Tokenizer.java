package org.chinesenotes.lexicon.segment;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Segments text into lexicon terms with a greedy longest-match strategy. Scanning left to right, the longest
 * candidate starting at the current position that is a term is taken as the next token; if there is none, the single
 * character at the position is. The tokens, concatenated in order, are always exactly the input text.
 *
 * Positions and lengths are counted in code points, so a supplementary character is never split.
 *
 * A tokenizer never changes its lexicon. It is safe to share between threads as long as the lexicon is no longer
 * being added to.
 */
@ThreadSafe
public class Tokenizer {

    private static final Logger log = Logger.getLogger(Tokenizer.class.getName());

    private final Lexicon lexicon;
    private final TokenizerConfiguration configuration;

    public Tokenizer(@Nonnull Lexicon lexicon) {
        this(lexicon, TokenizerConfiguration.DEFAULT);
    }

    public Tokenizer(@Nonnull Lexicon lexicon, @Nonnull TokenizerConfiguration configuration) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Segments the text into the longest lexicon terms.
     *
     * @param lexicon the known terms
     * @param text    the text to segment
     * @return the tokens, empty for empty text
     */
    public static List<String> tokenizeGreedy(@Nonnull Lexicon lexicon, @Nonnull String text) {
        return new Tokenizer(lexicon).tokenizeGreedy(text);
    }

    /**
     * Segments the text into the longest lexicon terms, never taking the whole text as a single term even if the
     * lexicon contains it.
     *
     * @param lexicon the known terms
     * @param text    the text to segment
     * @return the tokens, empty for empty text
     */
    public static List<String> tokenizeExcludeWhole(@Nonnull Lexicon lexicon, @Nonnull String text) {
        return new Tokenizer(lexicon).tokenizeExcludeWhole(text);
    }

    public List<String> tokenizeGreedy(@Nonnull String text) {
        return tokenize(text, false);
    }

    /**
     * Segments the text like {@link #tokenizeGreedy(String)}, except that a candidate spanning the whole text is not
     * matched against the lexicon. This decomposes a multi-character term into the shorter terms or characters it is
     * made of. A single-character text is still returned as its only token.
     *
     * @param text the text to segment
     * @return the tokens, empty for empty text
     */
    public List<String> tokenizeExcludeWhole(@Nonnull String text) {
        return tokenize(text, true);
    }

    private List<String> tokenize(String text, boolean excludeWhole) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        log.fine(() -> "Greedy dictionary-based text segmentation, chunk: " + text);

        int[] offsets = codePointOffsets(text);
        int length = offsets.length - 1;
        int maxTermLength = lexicon.getMaxTermLength();

        List<String> segments = new ArrayList<>();
        int i = 0;
        while (i < length) {
            int end = length;
            if (configuration.isTermLengthBound() && maxTermLength < length - i) {
                end = i + Math.max(1, maxTermLength);
            }
            int j = end;
            for (; j > i + 1; j--) {
                if (excludeWhole && i == 0 && j == length) {
                    continue;
                }
                if (lexicon.contains(text.substring(offsets[i], offsets[j]))) {
                    break;
                }
            }
            // Falls through to a single character when no longer candidate is a term.
            segments.add(text.substring(offsets[i], offsets[j]));
            i = j;
        }

        log.fine(() -> "Segments: " + segments);
        return segments;
    }

    /**
     * Gets the char offset of every code point boundary in the text, including the end of the text.
     */
    private static int[] codePointOffsets(String text) {
        int[] offsets = new int[text.codePointCount(0, text.length()) + 1];
        int offset = 0;
        for (int k = 1; k < offsets.length; k++) {
            offset = text.offsetByCodePoints(offset, 1);
            offsets[k] = offset;
        }
        return offsets;
    }

    public Lexicon getLexicon() {
        return lexicon;
    }

    public TokenizerConfiguration getConfiguration() {
        return configuration;
    }
}
