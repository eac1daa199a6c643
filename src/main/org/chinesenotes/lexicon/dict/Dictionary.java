package org.chinesenotes.lexicon.dict;

import org.chinesenotes.lexicon.Trie;
import org.chinesenotes.lexicon.segment.Lexicon;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Indexes dictionary entries by their simplified and traditional forms. An entry is reachable from every written form
 * of each of its senses; when several entries share a form, the first one added is the primary entry for it.
 *
 * Entries are added before the dictionary is used for lookups or segmentation, not concurrently with them.
 */
public class Dictionary implements Lexicon {

    private static final Logger log = Logger.getLogger(Dictionary.class.getName());

    private final Map<String, List<DictionaryEntry>> index = new LinkedHashMap<>();

    private int maxTermLength = 0;

    public Dictionary() {
    }

    public Dictionary(@Nonnull Iterable<DictionaryEntry> entries) {
        entries.forEach(this::add);
    }

    /**
     * Adds an entry under the simplified form, and the traditional form where it differs, of each of its senses.
     * Adding an entry that is already in the dictionary indexes only forms it was not yet indexed under, so an entry
     * given more senses with {@link DictionaryEntry#addWordSense(WordSense)} is added again to index the new forms.
     *
     * @param entry the entry
     */
    public void add(@Nonnull DictionaryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        Set<String> keys = new LinkedHashSet<>();
        keys.add(entry.getHeadword());
        for (WordSense sense : entry.getSenses()) {
            keys.add(sense.getSimplified());
            if (sense.hasDistinctTraditional()) {
                keys.add(sense.getTraditional());
            }
        }
        for (String key : keys) {
            if (key.isEmpty()) {
                continue;
            }
            List<DictionaryEntry> entries = index.computeIfAbsent(key, k -> new ArrayList<>(1));
            if (entries.contains(entry)) {
                continue;
            }
            entries.add(entry);
            maxTermLength = Math.max(maxTermLength, key.codePointCount(0, key.length()));
        }
    }

    /**
     * Looks up the primary entry for a written form.
     *
     * @param chinese simplified or traditional Chinese
     * @return the first entry added for the form, or {@code null} if there is none
     */
    @Nullable
    public DictionaryEntry lookup(String chinese) {
        List<DictionaryEntry> entries = index.get(chinese);
        if (entries == null) {
            log.fine(() -> "No entry for " + chinese);
            return null;
        }
        return entries.get(0);
    }

    /**
     * Looks up all entries for a written form.
     *
     * @param chinese simplified or traditional Chinese
     * @return the entries in the order added, empty if there are none
     */
    public List<DictionaryEntry> lookupAll(String chinese) {
        List<DictionaryEntry> entries = index.get(chinese);
        return entries == null ? Collections.emptyList() : Collections.unmodifiableList(entries);
    }

    @Override
    public boolean contains(String term) {
        return index.containsKey(term);
    }

    @Override
    public int getMaxTermLength() {
        return maxTermLength;
    }

    /**
     * Returns every written form the dictionary indexes, in the order first added.
     *
     * @return an unmodifiable view of the headwords
     */
    public Set<String> getHeadwords() {
        return Collections.unmodifiableSet(index.keySet());
    }

    /**
     * Builds a trie over all the headwords.
     *
     * @return a new trie
     */
    public Trie buildTrie() {
        Trie trie = new Trie();
        trie.build(index.keySet());
        return trie;
    }

    public int size() {
        return index.size();
    }

    @Override
    public String toString() {
        return "Dictionary{headwords=" + index.size() + '}';
    }
}
