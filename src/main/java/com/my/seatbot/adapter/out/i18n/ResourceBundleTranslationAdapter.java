package com.my.seatbot.adapter.out.i18n;

import com.my.seatbot.config.AppConfig;
import com.my.seatbot.domain.port.out.TranslationPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves user-facing text from {@code messages_<language>.properties}. Unknown languages fall back to English.
 */
@ApplicationScoped
public class ResourceBundleTranslationAdapter implements TranslationPort {

    private static final Logger log = Logger.getLogger(ResourceBundleTranslationAdapter.class);

    static final String BUNDLE = "messages";
    static final String DEFAULT_LANGUAGE = "en";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final ResourceBundle bundle;

    @Inject
    public ResourceBundleTranslationAdapter(AppConfig appConfig) {
        this(appConfig.telegram().language());
    }

    ResourceBundleTranslationAdapter(String language) {
        this.bundle = loadBundle(language);
    }

    @Override
    public String t(String key, Map<String, ?> params) {
        if (!bundle.containsKey(key)) {
            log.debugf("No text for key %s", key);
            return key;
        }
        String template = bundle.getString(key);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder text = new StringBuilder();
        while (matcher.find()) {
            Object value = params.get(matcher.group(1));
            if (value == null) {
                log.debugf("Key %s is missing parameter %s", key, matcher.group(1));
                return key;
            }
            matcher.appendReplacement(text, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(text);
        return text.toString();
    }

    private static ResourceBundle loadBundle(String language) {
        ResourceBundle.Control control = ResourceBundle.Control.getNoFallbackControl(
                ResourceBundle.Control.FORMAT_PROPERTIES);
        String requested = language == null || language.isBlank()
                ? DEFAULT_LANGUAGE
                : language.trim().toLowerCase(Locale.ROOT);
        try {
            return ResourceBundle.getBundle(BUNDLE, Locale.forLanguageTag(requested), control);
        } catch (MissingResourceException e) {
            log.warnf("No messages for language '%s', using %s", requested, DEFAULT_LANGUAGE);
            return ResourceBundle.getBundle(BUNDLE, Locale.forLanguageTag(DEFAULT_LANGUAGE), control);
        }
    }
}
