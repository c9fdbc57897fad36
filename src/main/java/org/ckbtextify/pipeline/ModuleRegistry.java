package org.ckbtextify.pipeline;

import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.modules.currency.CurrencyNormalizer;
import org.ckbtextify.modules.datetime.DateTimeNormalizer;
import org.ckbtextify.modules.diacritics.DiacriticsNormalizer;
import org.ckbtextify.modules.emoji.EmojiNormalizer;
import org.ckbtextify.modules.grammar.GrammarNormalizer;
import org.ckbtextify.modules.linguistics.LinguisticsNormalizer;
import org.ckbtextify.modules.linguistics.ScriptTagger;
import org.ckbtextify.modules.math.MathNormalizer;
import org.ckbtextify.modules.numbers.NumberNormalizer;
import org.ckbtextify.modules.phone.PhoneNormalizer;
import org.ckbtextify.modules.spacing.SpacingNormalizer;
import org.ckbtextify.modules.symbols.SymbolNormalizer;
import org.ckbtextify.modules.technical.TechnicalNormalizer;
import org.ckbtextify.modules.transliteration.TransliterationNormalizer;
import org.ckbtextify.modules.units.PowerNormalizer;
import org.ckbtextify.modules.units.UnitNormalizer;
import org.ckbtextify.modules.units.UnitTagger;
import org.ckbtextify.modules.web.WebNormalizer;
import org.ckbtextify.modules.web.WebSpeller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Registry for normalization modules, applied from the highest priority to the lowest.
 */
public final class ModuleRegistry {

    private final List<INormalizationModule> modules = new ArrayList<>();

    /**
     * Registers a new module.
     * @param module The module to register.
     */
    public void register(INormalizationModule module) { modules.add(module); }

    /**
     * @return The registered modules, sorted by descending priority. Modules of equal priority
     *         keep their registration order.
     */
    public List<INormalizationModule> modules() {
        List<INormalizationModule> sorted = new ArrayList<>(modules);
        sorted.sort(Comparator.comparingInt(INormalizationModule::priority).reversed());
        return Collections.unmodifiableList(sorted);
    }

    /**
     * Initializes a registry with the modules enabled by the given configuration. Emoji handling,
     * suffix joining and spacing are always registered.
     * @param config The normalization configuration.
     * @return A new registry.
     */
    public static ModuleRegistry initializeFromConfig(NormalizationConfig config) {
        ModuleRegistry reg = new ModuleRegistry();
        WebSpeller speller = config.web() || config.technical() ? new WebSpeller() : null;

        if (config.web()) reg.register(new WebNormalizer(speller));
        if (config.phone()) reg.register(new PhoneNormalizer());
        if (config.dateTime()) reg.register(new DateTimeNormalizer());
        if (config.technical()) reg.register(new TechnicalNormalizer(speller));
        if (config.units()) {
            reg.register(new UnitTagger());
            reg.register(new PowerNormalizer());
            reg.register(new UnitNormalizer());
        }
        if (config.math()) reg.register(new MathNormalizer());
        if (config.currency()) reg.register(new CurrencyNormalizer());
        if (config.numbers()) reg.register(new NumberNormalizer(config));
        reg.register(new EmojiNormalizer(config.emojiMode()));
        if (config.symbols()) reg.register(new SymbolNormalizer(config.pauseMarkers()));
        if (config.diacritics()) reg.register(new DiacriticsNormalizer(config.diacriticsMode(), config.shaddaMode()));
        if (config.linguistics()) {
            reg.register(new ScriptTagger());
            reg.register(new LinguisticsNormalizer());
        }
        if (config.transliteration()) reg.register(new TransliterationNormalizer());
        reg.register(new GrammarNormalizer());
        reg.register(new SpacingNormalizer());
        return reg;
    }
}
