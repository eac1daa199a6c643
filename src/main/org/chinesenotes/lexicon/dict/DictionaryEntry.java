package org.chinesenotes.lexicon.dict;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * An entry in the Chinese-English dictionary: a headword with one or more word senses.
 */
public class DictionaryEntry {

    private final String headword;
    private final String headwordId;
    private final List<WordSense> senses;

    public DictionaryEntry(@Nonnull String headword, @Nonnull String headwordId, @Nonnull List<WordSense> senses) {
        this.headword = Objects.requireNonNull(headword, "headword");
        this.headwordId = Objects.requireNonNull(headwordId, "headwordId");
        this.senses = new ArrayList<>(senses);
    }

    public DictionaryEntry(@Nonnull String headword, @Nonnull String headwordId, @Nonnull WordSense... senses) {
        this(headword, headwordId, List.of(senses));
    }

    /**
     * Adds a sense. A {@link Dictionary} that already holds this entry does not see new written forms until the entry
     * is added to it again.
     *
     * @param sense the sense
     */
    public void addWordSense(@Nonnull WordSense sense) {
        senses.add(Objects.requireNonNull(sense, "sense"));
    }

    /**
     * @return the Chinese headword the entry describes
     */
    public String getHeadword() {
        return headword;
    }

    public String getHeadwordId() {
        return headwordId;
    }

    public List<WordSense> getSenses() {
        return Collections.unmodifiableList(senses);
    }

    /**
     * Enumerates the English of all the senses, as a numbered list if there is more than one.
     *
     * @return the English equivalents
     */
    public String getEnglish() {
        if (senses.size() == 1) {
            return senses.get(0).getEnglish();
        }
        List<String> english = new ArrayList<>(senses.size());
        for (int i = 0; i < senses.size(); i++) {
            english.add((i + 1) + ". " + senses.get(i).getEnglish());
        }
        return String.join("; ", english);
    }

    /**
     * Rolls up the distinct pinyin of all the senses, sorted and comma separated.
     *
     * @return the pinyin pronunciations
     */
    public String getPinyin() {
        Set<String> pinyin = new TreeSet<>();
        for (WordSense sense : senses) {
            pinyin.add(sense.getPinyin());
        }
        return String.join(", ", pinyin);
    }

    /**
     * Rolls up the distinct simplified forms of all the senses, delimited by the Chinese enumeration comma.
     *
     * @return the simplified forms
     */
    public String getSimplified() {
        Set<String> simplified = new LinkedHashSet<>();
        for (WordSense sense : senses) {
            simplified.add(sense.getSimplified());
        }
        return String.join("、", simplified);
    }

    /**
     * Rolls up the distinct traditional forms of all the senses, delimited by the Chinese enumeration comma.
     *
     * @return the traditional forms
     */
    public String getTraditional() {
        Set<String> traditional = new LinkedHashSet<>();
        for (WordSense sense : senses) {
            traditional.add(sense.getTraditional());
        }
        return String.join("、", traditional);
    }

    @Override
    public String toString() {
        return "DictionaryEntry{" + headwordId + ": " + headword + " " + senses + '}';
    }
}
