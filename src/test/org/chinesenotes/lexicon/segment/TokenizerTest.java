package org.chinesenotes.lexicon.segment;

import org.chinesenotes.lexicon.State;
import org.chinesenotes.lexicon.Trie;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TokenizerTest {

    private static final List<String> TERMS = Arrays.asList("中国", "中国人", "人民", "银行", "zha", "zhang", "ng");

    private static final TokenizerConfiguration UNBOUNDED =
            TokenizerConfiguration.builder().withTermLengthBound(false).build();

    @Test
    public void tokenizeGreedyShouldPreferLongestTerm() {
        Lexicon lexicon = TrieLexicon.of(TERMS);

        assertEquals(Arrays.asList("中国人", "民", "银行"), Tokenizer.tokenizeGreedy(lexicon, "中国人民银行"));
        assertEquals(Collections.singletonList("zhang"), Tokenizer.tokenizeGreedy(lexicon, "zhang"));
    }

    @Test
    public void tokenizeGreedyShouldFallBackToSingleCharacters() {
        Lexicon lexicon = TrieLexicon.of(TERMS);

        assertEquals(Arrays.asList("我", "爱", "中国"), Tokenizer.tokenizeGreedy(lexicon, "我爱中国"));
        assertEquals(Arrays.asList("x", "y"), Tokenizer.tokenizeGreedy(lexicon, "xy"));
    }

    @Test
    public void tokenizeGreedyShouldReturnEmptyListForEmptyText() {
        assertTrue(Tokenizer.tokenizeGreedy(HashLexicon.of(TERMS), "").isEmpty());
        assertTrue(Tokenizer.tokenizeExcludeWhole(HashLexicon.of(TERMS), "").isEmpty());
    }

    @Test
    public void tokenizeExcludeWholeShouldDecomposeTermMatchingWholeText() {
        Lexicon lexicon = TrieLexicon.of(TERMS);

        List<String> tokens = Tokenizer.tokenizeExcludeWhole(lexicon, "zhang");

        assertThat(tokens, not(equalTo(Collections.singletonList("zhang"))));
        assertEquals(Arrays.asList("zha", "ng"), tokens);
        assertEquals(Arrays.asList("中国", "人"), Tokenizer.tokenizeExcludeWhole(lexicon, "中国人"));
    }

    @Test
    public void tokenizeExcludeWholeShouldFallBackToCharactersWhenNoShorterTerms() {
        Lexicon lexicon = HashLexicon.of("zhang");

        assertEquals(Arrays.asList("z", "h", "a", "n", "g"), Tokenizer.tokenizeExcludeWhole(lexicon, "zhang"));
    }

    @Test
    public void tokenizeExcludeWholeShouldOnlyExcludeTheWholeInputText() {
        Lexicon lexicon = HashLexicon.of("ab", "abab");

        assertEquals(Arrays.asList("ab", "ab"), Tokenizer.tokenizeExcludeWhole(lexicon, "abab"));
        assertEquals(Collections.singletonList("abab"), Tokenizer.tokenizeGreedy(lexicon, "abab"));
    }

    @Test
    public void tokenizeExcludeWholeShouldKeepSingleCharacterText() {
        assertEquals(Collections.singletonList("人"), Tokenizer.tokenizeExcludeWhole(HashLexicon.of("人"), "人"));
    }

    @Test
    public void tokenizeShouldNotSplitSupplementaryCharacters() {
        String extB = new String(Character.toChars(0x20000));
        Lexicon lexicon = HashLexicon.of(extB + "人");

        assertEquals(Arrays.asList(extB, "a"), Tokenizer.tokenizeGreedy(HashLexicon.of(), extB + "a"));
        assertEquals(Arrays.asList("中", extB + "人"), Tokenizer.tokenizeGreedy(lexicon, "中" + extB + "人"));
        assertEquals(Arrays.asList(extB, "人"), Tokenizer.tokenizeExcludeWhole(lexicon, extB + "人"));
    }

    @Test
    public void tokensShouldAlwaysReconstructTheText() {
        Random random = new Random(7);
        String alphabet = "中国人民银行zhang";
        List<String> terms = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            terms.add(randomText(random, alphabet, 1 + random.nextInt(4)));
        }
        Lexicon trieLexicon = TrieLexicon.of(terms);
        Lexicon hashLexicon = HashLexicon.of(terms);

        for (int i = 0; i < 200; i++) {
            String text = randomText(random, alphabet, random.nextInt(30));
            List<String> greedy = new Tokenizer(trieLexicon).tokenizeGreedy(text);
            List<String> excludeWhole = new Tokenizer(trieLexicon).tokenizeExcludeWhole(text);

            assertEquals(text, String.join("", greedy));
            assertEquals(text, String.join("", excludeWhole));
            assertEquals(greedy, new Tokenizer(hashLexicon).tokenizeGreedy(text));
            assertEquals(greedy, new Tokenizer(trieLexicon, UNBOUNDED).tokenizeGreedy(text));
            assertEquals(excludeWhole, new Tokenizer(hashLexicon, UNBOUNDED).tokenizeExcludeWhole(text));
        }
    }

    @Test
    public void boundShouldNotChangeTokensOfTrieWiredByHand() {
        Trie trie = new Trie();
        State a = trie.newState();
        trie.addTransition(trie.getStart(), "a", a);
        trie.addTransition(a, "b", trie.newState(true));
        Lexicon lexicon = new TrieLexicon(trie);

        assertEquals(2, lexicon.getMaxTermLength());
        assertEquals(Arrays.asList("ab", "c"), new Tokenizer(lexicon).tokenizeGreedy("abc"));
        assertEquals(new Tokenizer(lexicon, UNBOUNDED).tokenizeGreedy("abc"),
                new Tokenizer(lexicon).tokenizeGreedy("abc"));
    }

    @Test
    public void boundShouldBeLiftedForTrieWithCycle() {
        Trie trie = new Trie();
        State a = trie.newState(true);
        trie.addTransition(trie.getStart(), "a", a);
        trie.addTransition(a, "a", a);
        Lexicon lexicon = new TrieLexicon(trie);

        assertEquals(Integer.MAX_VALUE, lexicon.getMaxTermLength());
        assertEquals(Collections.singletonList("aaa"), new Tokenizer(lexicon).tokenizeGreedy("aaa"));
        assertEquals(Arrays.asList("aa", "a"), new Tokenizer(lexicon).tokenizeExcludeWhole("aaa"));
    }

    @Test
    public void tokenizeShouldEmitSingleCharactersForEmptyLexicon() {
        Tokenizer tokenizer = new Tokenizer(TrieLexicon.of(Collections.emptyList()));

        assertEquals(Arrays.asList("中", "国"), tokenizer.tokenizeGreedy("中国"));
    }

    private static String randomText(Random random, String alphabet, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
