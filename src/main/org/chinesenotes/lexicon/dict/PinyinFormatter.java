package org.chinesenotes.lexicon.dict;

import org.chinesenotes.lexicon.segment.Tokenizer;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds the pinyin of a multi-character headword from the pinyin of the shorter terms it is made of. The headword
 * is segmented against the dictionary without matching itself, and the first-sense pinyin of each part is joined up.
 */
public class PinyinFormatter {

    private final Dictionary dictionary;
    private final Tokenizer tokenizer;

    public PinyinFormatter(@Nonnull Dictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.tokenizer = new Tokenizer(dictionary);
    }

    /**
     * Formats the pinyin of the entry's simplified form syllable by syllable. Phrases longer than three characters get
     * a space between the parts. Parts with no entry contribute themselves.
     *
     * @param entry the entry
     * @return the pinyin
     */
    public String format(@Nonnull DictionaryEntry entry) {
        String simplified = entry.getSenses().isEmpty() ? entry.getHeadword()
                : entry.getSenses().get(0).getSimplified();
        List<String> pinyin = new ArrayList<>();
        for (String token : tokenizer.tokenizeExcludeWhole(simplified)) {
            DictionaryEntry tokenEntry = dictionary.lookup(token);
            if (tokenEntry == null || tokenEntry.getSenses().isEmpty()) {
                pinyin.add(token);
            } else {
                pinyin.add(tokenEntry.getSenses().get(0).getPinyin());
            }
        }
        if (simplified.codePointCount(0, simplified.length()) > 3) {
            return String.join(" ", pinyin);
        }
        return String.join("", pinyin);
    }
}
