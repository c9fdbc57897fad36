package org.ckbtextify.modules.linguistics;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;

import java.util.List;

/**
 * Tags each unconverted WORD with its script family. Arabic-script words are told apart by
 * their letters: Sorani-only letters mark Kurdish, Arabic-only letters without any Sorani
 * letter mark Arabic, and unmarked words default to Kurdish.
 */
public class ScriptTagger implements INormalizationModule {

    private static final String KURDISH_LETTERS = "ەێۆڕڵڤپچژگھیکۊ";
    private static final String ARABIC_LETTERS = "ةكيىثذصضطظأإؤ";

    @Override
    public String name() {
        return "ScriptTagger";
    }

    @Override
    public int priority() {
        return 33;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.type() == TokenType.WORD && !token.isConverted() && !token.isTombstone()) {
                token.addTag(scriptOf(token.text()));
            }
        }
        return tokens;
    }

    static Tag scriptOf(String word) {
        Character.UnicodeScript script = null;
        for (int i = 0; i < word.length(); ) {
            int cp = word.codePointAt(i);
            if (Character.isLetter(cp)) {
                script = Character.UnicodeScript.of(cp);
                break;
            }
            i += Character.charCount(cp);
        }
        if (script == null) {
            return Tag.SCRIPT_OTHER;
        }
        switch (script) {
            case LATIN:
                return Tag.SCRIPT_LATIN;
            case CYRILLIC:
                return Tag.SCRIPT_CYRILLIC;
            case GREEK:
                return Tag.SCRIPT_GREEK;
            case ARABIC:
                return containsAny(word, ARABIC_LETTERS) && !containsAny(word, KURDISH_LETTERS)
                        ? Tag.SCRIPT_ARABIC : Tag.SCRIPT_KURDISH;
            default:
                return Tag.SCRIPT_OTHER;
        }
    }

    private static boolean containsAny(String word, String letters) {
        for (int i = 0; i < word.length(); i++) {
            if (letters.indexOf(word.charAt(i)) >= 0) return true;
        }
        return false;
    }
}
