package org.chinesenotes.lexicon.dict;

import org.junit.Before;
import org.junit.Test;

import static org.chinesenotes.lexicon.dict.DictionaryFixtures.SAME;
import static org.junit.Assert.assertEquals;

public class PinyinFormatterTest {

    private Dictionary dictionary;
    private PinyinFormatter formatter;

    @Before
    public void setUp() {
        dictionary = DictionaryFixtures.smallDictionary();
        formatter = new PinyinFormatter(dictionary);
    }

    @Test
    public void formatShouldJoinPinyinOfParts() {
        assertEquals("zhōngguó", formatter.format(dictionary.lookup("中国")));
        assertEquals("Zhōngguórén", formatter.format(dictionary.lookup("中国人")));
    }

    @Test
    public void formatShouldSpaceLongPhrases() {
        DictionaryEntry entry = new DictionaryEntry("中国人民", "9",
                new WordSense("中国人民", "中國人民", "Zhōngguó rénmín", "the Chinese people"));

        assertEquals("Zhōngguórén mín", formatter.format(entry));
    }

    @Test
    public void formatShouldKeepPartsWithoutEntries() {
        DictionaryEntry entry = new DictionaryEntry("中x", "10", new WordSense("中x", SAME, "zhōng ex", "test"));

        assertEquals("zhōngx", formatter.format(entry));
    }

    @Test
    public void formatShouldReturnOwnPinyinForSingleCharacter() {
        assertEquals("rén", formatter.format(dictionary.lookup("人")));
    }
}
