package com.demo.chatbot.service;

import com.google.common.base.Optional;
import com.optimaize.langdetect.LanguageDetector;
import com.optimaize.langdetect.LanguageDetectorBuilder;
import com.optimaize.langdetect.i18n.LdLocale;
import com.optimaize.langdetect.ngram.NgramExtractors;
import com.optimaize.langdetect.profiles.LanguageProfile;
import com.optimaize.langdetect.profiles.LanguageProfileReader;
import com.optimaize.langdetect.text.CommonTextObjectFactories;
import com.optimaize.langdetect.text.TextObjectFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects the language of a user message, restricted to the configured supported set.
 */
@Slf4j
@Service
public class LanguageDetectionService {

    private final boolean enabled;
    private final Set<String> supportedLanguages;
    private final String defaultLanguage;
    private final LanguageDetector detector;
    private final TextObjectFactory textObjectFactory;

    @Autowired
    public LanguageDetectionService(@Value("${chatbot.nlp.language-detection-enabled:true}") boolean enabled,
                                    @Value("${chatbot.nlp.supported-languages:en,es,fr,de}") List<String> supportedLanguages,
                                    @Value("${chatbot.nlp.default-language:en}") String defaultLanguage) {
        this(enabled, supportedLanguages, defaultLanguage, enabled ? loadDetector() : null);
    }

    LanguageDetectionService(boolean enabled,
                             List<String> supportedLanguages,
                             String defaultLanguage,
                             LanguageDetector detector) {
        this.enabled = enabled;
        this.supportedLanguages = supportedLanguages.stream()
                .map(lang -> lang.trim().toLowerCase(Locale.ROOT))
                .filter(lang -> !lang.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.defaultLanguage = defaultLanguage;
        this.detector = detector;
        this.textObjectFactory = CommonTextObjectFactories.forDetectingShortCleanText();
        log.info("Language detection: enabled={}, supported={}, default={}",
                enabled && detector != null, this.supportedLanguages, defaultLanguage);
    }

    /**
     * ISO 639-1 code of the message language. Returns the default language when detection is
     * disabled, inconclusive, fails, or yields an unsupported language.
     */
    public String detect(String text) {
        if (!enabled || detector == null || text == null || text.isBlank()) {
            return defaultLanguage;
        }
        try {
            Optional<LdLocale> locale = detector.detect(textObjectFactory.forText(text));
            if (locale.isPresent()) {
                String language = locale.get().getLanguage();
                if (supportedLanguages.contains(language)) {
                    return language;
                }
                log.debug("Detected unsupported language: {}", language);
            }
        } catch (Exception e) {
            log.warn("Language detection failed: {}", e.getMessage());
        }
        return defaultLanguage;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    private static LanguageDetector loadDetector() {
        try {
            List<LanguageProfile> profiles = new LanguageProfileReader().readAllBuiltIn();
            return LanguageDetectorBuilder.create(NgramExtractors.standard())
                    .withProfiles(profiles)
                    .build();
        } catch (IOException e) {
            log.error("Failed to load language profiles, detection disabled", e);
            return null;
        }
    }
}
