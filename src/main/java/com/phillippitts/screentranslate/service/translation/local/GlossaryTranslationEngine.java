package com.phillippitts.screentranslate.service.translation.local;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Phrasebook-backed {@link OfflineTranslationEngine}.
 *
 * <p>Each classpath resource {@code offline/<from>-<to>.properties} installs one language pair
 * and its reverse. Lookup is case-insensitive on the whole phrase first; English phrases not
 * found whole are translated word by word when every word is known.
 */
public class GlossaryTranslationEngine implements OfflineTranslationEngine {

    private static final Logger LOG = LogManager.getLogger(GlossaryTranslationEngine.class);

    static final List<String> DEFAULT_PAIRS = List.of("en-zh", "en-ja");
    private static final Pattern CJK = Pattern.compile("[\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}]");
    private static final Pattern KANA = Pattern.compile("[\\p{IsHiragana}\\p{IsKatakana}]");
    private static final Pattern WORDS = Pattern.compile("\\s+");

    private final Map<String, Map<String, String>> dictionaries = new HashMap<>();

    public GlossaryTranslationEngine() {
        this(DEFAULT_PAIRS);
    }

    public GlossaryTranslationEngine(List<String> pairs) {
        for (String pair : pairs) {
            load(pair);
        }
        LOG.info("Offline glossary loaded: {} language directions", dictionaries.size());
    }

    @Override
    public boolean isReady() {
        return !dictionaries.isEmpty();
    }

    @Override
    public Optional<OfflineTranslation> translate(String text, String from, String to) {
        String target = normalize(to);
        String source = from == null ? detect(text) : normalize(from);
        if (source.equals(target)) {
            return Optional.of(new OfflineTranslation(text, source));
        }
        Map<String, String> dictionary = dictionaries.get(source + '>' + target);
        if (dictionary == null) {
            throw new IllegalArgumentException("Language pair not installed: " + source + " -> " + target);
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        String whole = dictionary.get(key);
        if (whole != null) {
            return Optional.of(new OfflineTranslation(whole, source));
        }
        if (!"en".equals(source)) {
            return Optional.empty();
        }
        StringBuilder joined = new StringBuilder();
        for (String word : WORDS.split(key)) {
            String translated = dictionary.get(word.replaceAll("\\p{Punct}+$", ""));
            if (translated == null) {
                return Optional.empty();
            }
            if (!joined.isEmpty() && !isCjkTarget(target)) {
                joined.append(' ');
            }
            joined.append(translated);
        }
        return Optional.of(new OfflineTranslation(joined.toString(), source));
    }

    /**
     * @return installed directions, e.g. {@code en>zh}
     */
    public Set<String> directions() {
        return Set.copyOf(dictionaries.keySet());
    }

    static String normalize(String language) {
        String lang = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        int dash = lang.indexOf('-');
        return dash > 0 ? lang.substring(0, dash) : lang;
    }

    static String detect(String text) {
        if (KANA.matcher(text).find()) {
            return "ja";
        }
        return CJK.matcher(text).find() ? "zh" : "en";
    }

    private static boolean isCjkTarget(String target) {
        return "zh".equals(target) || "ja".equals(target);
    }

    private void load(String pair) {
        String[] langs = pair.split("-", 2);
        String resource = "offline/" + pair + ".properties";
        try (InputStream in = GlossaryTranslationEngine.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOG.warn("Offline glossary {} not found on classpath; pair {} unavailable", resource, pair);
                return;
            }
            Properties props = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            Map<String, String> forward = new HashMap<>();
            Map<String, String> reverse = new HashMap<>();
            for (String name : props.stringPropertyNames()) {
                String phrase = name.replace('_', ' ').toLowerCase(Locale.ROOT);
                String translation = props.getProperty(name).trim();
                forward.put(phrase, translation);
                reverse.putIfAbsent(translation.toLowerCase(Locale.ROOT), phrase);
            }
            dictionaries.put(langs[0] + '>' + langs[1], Map.copyOf(forward));
            dictionaries.put(langs[1] + '>' + langs[0], Map.copyOf(reverse));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load offline glossary " + resource, e);
        }
    }
}
