package org.ckbtextify.pipeline;

import org.ckbtextify.api.ITextNormalizer;
import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The main normalizer implementation. It orchestrates the whole pass sequence from raw text to
 * TTS-ready Sorani: tokenize, run every enabled module in priority order, detokenize and
 * canonicalize whitespace.
 * <p>
 * A module that throws is rolled back: the token sequence is restored to its state before that
 * module ran, a warning is logged and the next module proceeds. The pipeline holds no per-call
 * state, so one instance may serve concurrent callers.
 */
public class NormalizationPipeline implements ITextNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizationPipeline.class);

    private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t]+");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    private final Tokenizer tokenizer;
    private final List<INormalizationModule> modules;

    /**
     * Creates a pipeline with the default configuration.
     */
    public NormalizationPipeline() {
        this(NormalizationConfig.defaults());
    }

    /**
     * Creates a pipeline with the modules enabled by the given configuration.
     * @param config The normalization configuration.
     */
    public NormalizationPipeline(NormalizationConfig config) {
        this(new Tokenizer(), ModuleRegistry.initializeFromConfig(Objects.requireNonNull(config, "config")).modules());
    }

    NormalizationPipeline(Tokenizer tokenizer, List<INormalizationModule> modules) {
        this.tokenizer = tokenizer;
        this.modules = List.copyOf(modules);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Pipeline initialized with {} modules: {}", this.modules.size(),
                    this.modules.stream().map(INormalizationModule::name).toList());
        }
    }

    /**
     * @return The active modules in execution order.
     */
    public List<INormalizationModule> modules() {
        return modules;
    }

    @Override
    public String normalize(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return "";
        }
        List<Token> tokens = tokenizer.tokenize(text);
        for (INormalizationModule module : modules) {
            List<Token> snapshot = snapshot(tokens);
            try {
                List<Token> result = module.process(tokens);
                tokens = TokenLists.compact(result == null ? tokens : result);
            } catch (RuntimeException e) {
                LOG.warn("Module {} failed and was skipped: {}", module.name(), e.getMessage(), e);
                tokens = snapshot;
            }
        }
        return canonicalize(tokenizer.detokenize(tokens));
    }

    private static List<Token> snapshot(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            copy.add(token.copy());
        }
        return copy;
    }

    /**
     * Collapses runs of spaces and tabs, folds line-break runs into a single newline, removes
     * spaces around newlines and trims the ends.
     * @param text The detokenized text.
     * @return The canonical text.
     */
    static String canonicalize(String text) {
        String s = HORIZONTAL_WS.matcher(text).replaceAll(" ");
        s = LINE_BREAKS.matcher(s).replaceAll("\n");
        s = s.replace(" \n", "\n").replace("\n ", "\n");
        return s.trim();
    }
}
