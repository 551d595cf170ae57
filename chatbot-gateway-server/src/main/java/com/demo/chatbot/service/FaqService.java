package com.demo.chatbot.service;

import com.demo.chatbot.domain.FaqEntity;
import com.demo.chatbot.repository.FaqRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword search over the FAQ table.
 *
 * Entries are held in a Caffeine cache and reloaded from the database once the TTL passes. A
 * question matches when more than half of its keywords occur in the user message; the highest
 * coverage wins and ties go to the lower priority value.
 */
@Service
@Slf4j
public class FaqService {

    private static final String ALL_ENTRIES = "faq:all";

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "is", "are", "am", "do", "does", "did", "you", "your",
            "i", "me", "my", "we", "our", "what", "how", "can", "in", "on", "of", "to", "for",
            "with", "there", "any", "about", "have", "has", "be", "it", "this", "that", "want");

    private final FaqRepository faqRepository;
    private final MetricsService metricsService;
    private final Cache<String, List<FaqEntity>> entryCache;

    public FaqService(FaqRepository faqRepository,
                      MetricsService metricsService,
                      @Value("${chatbot.faq.cache-ttl-seconds:1800}") long cacheTtlSeconds) {
        this.faqRepository = faqRepository;
        this.metricsService = metricsService;
        this.entryCache = Caffeine.newBuilder()
                .maximumSize(16)
                .expireAfterWrite(Duration.ofSeconds(cacheTtlSeconds))
                .build();
    }

    /**
     * Best FAQ entry for the message, if any entry matches well enough. Storage faults are logged
     * and reported as no match.
     */
    public Optional<FaqEntity> findBestMatch(String message) {
        Set<String> messageKeywords = keywords(message);
        if (messageKeywords.isEmpty()) {
            return Optional.empty();
        }

        List<FaqEntity> entries;
        try {
            entries = loadEntries();
        } catch (Exception e) {
            log.error("Failed to load FAQ entries", e);
            metricsService.recordError("FAQ_LOAD_FAILED", "FaqService");
            return Optional.empty();
        }

        FaqEntity best = null;
        double bestCoverage = 0.0;
        for (FaqEntity entry : entries) {
            Set<String> questionKeywords = keywords(entry.getQuestion());
            if (questionKeywords.isEmpty()) {
                continue;
            }
            long matched = questionKeywords.stream().filter(messageKeywords::contains).count();
            if (matched * 2 <= questionKeywords.size()) {
                continue;
            }
            double coverage = (double) matched / questionKeywords.size();
            if (coverage > bestCoverage) {
                best = entry;
                bestCoverage = coverage;
            }
        }

        if (best != null) {
            log.debug("FAQ match: faqId={}, coverage={}", best.getId(), bestCoverage);
        }
        return Optional.ofNullable(best);
    }

    public void invalidate() {
        entryCache.invalidateAll();
    }

    private List<FaqEntity> loadEntries() {
        List<FaqEntity> cached = entryCache.getIfPresent(ALL_ENTRIES);
        if (cached != null) {
            metricsService.incrementCounter("faq.cache.hits");
            return cached;
        }
        metricsService.incrementCounter("faq.cache.misses");
        List<FaqEntity> loaded = List.copyOf(
                faqRepository.findAll(Sort.by("priority").ascending().and(Sort.by("id"))));
        entryCache.put(ALL_ENTRIES, loaded);
        log.info("Loaded {} FAQ entries", loaded.size());
        return loaded;
    }

    /**
     * Lower-cased words of three or more letters, stop words removed, trailing plural "s" dropped.
     */
    static Set<String> keywords(String text) {
        Set<String> result = new LinkedHashSet<>();
        if (text == null) {
            return result;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() < 3 || STOP_WORDS.contains(token)) {
                continue;
            }
            if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
                token = token.substring(0, token.length() - 1);
            }
            result.add(token);
        }
        return result;
    }
}
