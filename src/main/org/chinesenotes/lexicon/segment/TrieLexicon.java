package org.chinesenotes.lexicon.segment;

import org.chinesenotes.lexicon.Trie;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * A lexicon that tests membership by walking a trie. The trie must not be built further once it is in use.
 */
@ThreadSafe
public class TrieLexicon implements Lexicon {

    private final Trie trie;

    public TrieLexicon(@Nonnull Trie trie) {
        this.trie = Objects.requireNonNull(trie, "trie");
    }

    /**
     * Builds a new trie over the given terms and wraps it.
     *
     * @param terms the terms
     * @return a lexicon of the terms
     */
    public static TrieLexicon of(@Nonnull Iterable<String> terms) {
        Trie trie = new Trie();
        trie.build(terms);
        return new TrieLexicon(trie);
    }

    @Override
    public boolean contains(String term) {
        return term != null && trie.recognizes(term);
    }

    @Override
    public int getMaxTermLength() {
        return trie.getMaxTermLength();
    }

    public Trie getTrie() {
        return trie;
    }

    @Override
    public String toString() {
        return "TrieLexicon{terms=" + trie.size() + ", maxTermLength=" + trie.getMaxTermLength() + '}';
    }
}
