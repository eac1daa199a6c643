package org.chinesenotes.lexicon.segment;

/**
 * Configuration for a Tokenizer.
 */
public class TokenizerConfiguration {

    public static final TokenizerConfiguration DEFAULT = builder().build();

    /**
     * Normally, the tokenizer only tries candidates no longer than the lexicon's longest term, since longer ones
     * cannot be members. Setting this flag to false makes it try every candidate up to the end of the text, which is
     * O(n^2) in the length of the text. Tokens are the same either way.
     */
    private final boolean termLengthBound;

    private TokenizerConfiguration(boolean termLengthBound) {
        this.termLengthBound = termLengthBound;
    }

    public boolean isTermLengthBound() {
        return termLengthBound;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TokenizerConfiguration{termLengthBound=" + termLengthBound + '}';
    }

    public static class Builder {

        private boolean termLengthBound = true;

        Builder() {}

        public Builder withTermLengthBound(boolean termLengthBound) {
            this.termLengthBound = termLengthBound;
            return this;
        }

        public TokenizerConfiguration build() {
            return new TokenizerConfiguration(termLengthBound);
        }
    }
}
