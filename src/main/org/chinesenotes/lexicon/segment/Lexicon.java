package org.chinesenotes.lexicon.segment;

/**
 * A set of known terms that text can be segmented into.
 */
public interface Lexicon {

    /**
     * Tests whether the given text is a known term.
     *
     * @param term the text to test
     * @return true if the text is a term of this lexicon
     */
    boolean contains(String term);

    /**
     * Returns the length of the longest term, counted in code points. Segmentation never looks at candidates longer
     * than this when the bound is enabled.
     *
     * @return the longest term length, 0 for an empty lexicon
     */
    int getMaxTermLength();
}
