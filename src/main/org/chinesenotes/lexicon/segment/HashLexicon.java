package org.chinesenotes.lexicon.segment;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * A lexicon that tests membership with a hash set. Segments the same way as a {@link TrieLexicon} over the same
 * terms.
 */
@ThreadSafe
@Immutable
public final class HashLexicon implements Lexicon {

    private final Set<String> terms;
    private final int maxTermLength;

    private HashLexicon(Set<String> terms) {
        this.terms = Collections.unmodifiableSet(terms);
        int max = 0;
        for (String term : terms) {
            max = Math.max(max, term.codePointCount(0, term.length()));
        }
        this.maxTermLength = max;
    }

    public static HashLexicon of(@Nonnull Collection<String> terms) {
        return new HashLexicon(new HashSet<>(terms));
    }

    public static HashLexicon of(String... terms) {
        Set<String> set = new HashSet<>();
        Collections.addAll(set, terms);
        return new HashLexicon(set);
    }

    @Override
    public boolean contains(String term) {
        return terms.contains(term);
    }

    @Override
    public int getMaxTermLength() {
        return maxTermLength;
    }

    public int size() {
        return terms.size();
    }

    @Override
    public String toString() {
        return "HashLexicon{terms=" + terms.size() + ", maxTermLength=" + maxTermLength + '}';
    }
}
