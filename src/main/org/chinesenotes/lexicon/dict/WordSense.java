package org.chinesenotes.lexicon.dict;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * One sense of a dictionary word: its written forms, pronunciation and English equivalents.
 */
@Immutable
public final class WordSense {

    /**
     * Written in place of the traditional form when it is the same as the simplified form.
     */
    public static final String SAME_AS_SIMPLIFIED = "\\N";

    private final String simplified;
    private final String traditional;
    private final String pinyin;
    private final String english;
    private final String grammar;
    private final String notes;

    public WordSense(@Nonnull String simplified, @Nonnull String traditional, @Nonnull String pinyin,
                     @Nonnull String english) {
        this(simplified, traditional, pinyin, english, null, null);
    }

    public WordSense(@Nonnull String simplified, @Nonnull String traditional, @Nonnull String pinyin,
                     @Nonnull String english, @Nullable String grammar, @Nullable String notes) {
        this.simplified = Objects.requireNonNull(simplified, "simplified");
        this.traditional = Objects.requireNonNull(traditional, "traditional");
        this.pinyin = Objects.requireNonNull(pinyin, "pinyin");
        this.english = Objects.requireNonNull(english, "english");
        this.grammar = grammar;
        this.notes = notes;
    }

    public String getSimplified() {
        return simplified;
    }

    /**
     * @return the traditional form, or {@link #SAME_AS_SIMPLIFIED}
     */
    public String getTraditional() {
        return traditional;
    }

    public boolean hasDistinctTraditional() {
        return !SAME_AS_SIMPLIFIED.equals(traditional);
    }

    public String getPinyin() {
        return pinyin;
    }

    public String getEnglish() {
        return english;
    }

    /**
     * @return the part of speech, or {@code null} if not known
     */
    @Nullable
    public String getGrammar() {
        return grammar;
    }

    @Nullable
    public String getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WordSense that = (WordSense) o;
        return simplified.equals(that.simplified) && traditional.equals(that.traditional)
                && pinyin.equals(that.pinyin) && english.equals(that.english)
                && Objects.equals(grammar, that.grammar) && Objects.equals(notes, that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(simplified, traditional, pinyin, english, grammar, notes);
    }

    @Override
    public String toString() {
        return "WordSense{" + simplified + "/" + traditional + " " + pinyin + ": " + english + '}';
    }
}
