package org.ckbtextify.modules.web;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;

import java.util.List;

/**
 * Reads URL and EMAIL tokens part by part ("www.rudaw.net" as
 * "دەبڵیو دەبڵیو دەبڵیو دۆت ڕووداو دۆت نێت").
 */
public class WebNormalizer implements INormalizationModule {

    private final WebSpeller speller;

    public WebNormalizer(WebSpeller speller) {
        this.speller = speller;
    }

    @Override
    public String name() {
        return "WebNormalizer";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (Token token : tokens) {
            if ((token.type() == TokenType.URL || token.type() == TokenType.EMAIL)
                    && !token.isConverted() && !token.isTombstone()) {
                token.rewrite(speller.speak(token.text()), TokenType.WORD);
                token.addTag(Tag.IS_SPELLED_OUT);
            }
        }
        return tokens;
    }
}
