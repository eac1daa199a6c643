package org.chinesenotes.lexicon.dict;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts Chinese text between traditional and simplified characters one character at a time, using the first sense
 * of each character's dictionary entry. Characters without an entry are kept as they are.
 */
public class CharacterConverter {

    private final Dictionary dictionary;

    public CharacterConverter(@Nonnull Dictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * Converts to simplified characters and collects the pinyin of each character.
     *
     * @param text traditional (or mixed) Chinese text
     * @return the simplified text, the traditional text or {@link WordSense#SAME_AS_SIMPLIFIED} if the text was
     * already simplified, and the lower-cased pinyin
     */
    public Conversion toSimplified(@Nonnull String text) {
        StringBuilder simplified = new StringBuilder(text.length());
        List<String> pinyin = new ArrayList<>();
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            DictionaryEntry entry = dictionary.lookup(character);
            if (entry == null || entry.getSenses().isEmpty()) {
                simplified.append(character);
                pinyin.add(" ");
            } else {
                WordSense sense = entry.getSenses().get(0);
                simplified.append(sense.getSimplified());
                pinyin.add(sense.getPinyin());
            }
        });

        String traditional = simplified.toString().equals(text) ? WordSense.SAME_AS_SIMPLIFIED : text;
        // Phrases get a space between syllables
        String delimiter = pinyin.size() > 3 ? " " : "";
        return new Conversion(simplified.toString(), traditional,
                String.join(delimiter, pinyin).toLowerCase(Locale.ROOT));
    }

    /**
     * Converts to traditional characters.
     *
     * @param text simplified (or mixed) Chinese text
     * @return the traditional text
     */
    public String toTraditional(@Nonnull String text) {
        StringBuilder traditional = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            DictionaryEntry entry = dictionary.lookup(character);
            if (entry == null || entry.getSenses().isEmpty()) {
                traditional.append(character);
            } else {
                WordSense sense = entry.getSenses().get(0);
                traditional.append(sense.hasDistinctTraditional() ? sense.getTraditional() : sense.getSimplified());
            }
        });
        return traditional.toString();
    }

    /**
     * The result of converting text to simplified characters.
     */
    @Immutable
    public static final class Conversion {

        private final String simplified;
        private final String traditional;
        private final String pinyin;

        Conversion(String simplified, String traditional, String pinyin) {
            this.simplified = simplified;
            this.traditional = traditional;
            this.pinyin = pinyin;
        }

        public String getSimplified() {
            return simplified;
        }

        public String getTraditional() {
            return traditional;
        }

        public String getPinyin() {
            return pinyin;
        }

        @Override
        public String toString() {
            return "Conversion{" + simplified + ", " + traditional + ", " + pinyin + '}';
        }
    }
}
