package com.campus.insight.sentiment;

import com.campus.insight.config.InsightProperties;
import com.campus.insight.sentiment.SentimentModels.BatchSentimentSummary;
import com.campus.insight.sentiment.SentimentModels.Polarity;
import com.campus.insight.sentiment.SentimentModels.Sentiment;
import com.campus.insight.sentiment.SentimentModels.SentimentAnalysis;
import com.campus.insight.sentiment.SentimentModels.SentimentResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lexicon polarity adjusted by fixed stress/positive keyword lists. Results are cached by the exact
 * input text for the lifetime of the analyzer.
 *
 * <p>Keywords match whole tokens only, not substrings: "hardly" does not count as "hard" and
 * "quite" does not count as "quit".
 */
@Component
public class SentimentAnalyzer {
    public static final List<String> STRESS_KEYWORDS = List.of(
            "stressed", "anxious", "worried", "overwhelmed", "struggling",
            "difficult", "hard", "failing", "depressed", "hopeless",
            "scared", "confused", "lost", "behind", "pressure",
            "tired", "exhausted", "burnout", "frustrated", "discouraged",
            "dropout", "quit", "hate", "terrible", "worst");

    public static final List<String> POSITIVE_KEYWORDS = List.of(
            "happy", "excited", "confident", "motivated", "accomplished",
            "great", "excellent", "love", "enjoy", "fantastic",
            "proud", "satisfied", "optimistic", "wonderful", "amazing",
            "successful", "achieved", "grateful", "positive", "engaged");

    private static final double KEYWORD_WEIGHT = 0.15;
    private static final double NEUTRAL_BAND = 0.1;

    private static final SentimentResult NEUTRAL_DEFAULT = new SentimentResult(
            Sentiment.NEUTRAL, 0.0, 0.0, 0.0, Set.of(), Set.of(), 0.5);

    private final PolarityLexicon lexicon;
    private final Cache<String, SentimentResult> cache;

    @Autowired
    public SentimentAnalyzer(PolarityLexicon lexicon, InsightProperties properties) {
        this(lexicon, properties.sentiment().cacheMaximumSize());
    }

    public SentimentAnalyzer(PolarityLexicon lexicon, long cacheMaximumSize) {
        this.lexicon = lexicon;
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (cacheMaximumSize > 0) builder.maximumSize(cacheMaximumSize);
        this.cache = builder.build();
    }

    public SentimentResult analyze(String text) {
        if (text == null || text.isBlank()) return NEUTRAL_DEFAULT;
        return cache.get(text, this::score);
    }

    public SentimentAnalysis analyzeWithScore(String text) {
        SentimentResult result = analyze(text);
        int score = mentalHealthScore(result);
        return new SentimentAnalysis(result, score, mentalHealthLabel(score));
    }

    public BatchSentimentSummary analyzeBatch(List<String> texts) {
        List<SentimentResult> results = texts.stream().map(this::analyze).toList();

        Map<Sentiment, Long> distribution = new EnumMap<>(Sentiment.class);
        Arrays.stream(Sentiment.values()).forEach(s -> distribution.put(s, 0L));
        results.forEach(r -> distribution.merge(r.sentiment(), 1L, Long::sum));

        double avgPolarity = results.stream().mapToDouble(SentimentResult::polarity).average().orElse(0.0);

        Set<String> stress = new LinkedHashSet<>();
        Set<String> positive = new LinkedHashSet<>();
        results.forEach(r -> {
            stress.addAll(r.stressIndicators());
            positive.addAll(r.positiveIndicators());
        });

        return new BatchSentimentSummary(results.size(), distribution, round3(avgPolarity), stress, positive, results);
    }

    public long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static int mentalHealthScore(SentimentResult result) {
        return mentalHealthScore(result.polarity(), result.stressIndicators().size(), result.positiveIndicators().size());
    }

    /**
     * 1 (very concerning) .. 10 (excellent). Halves round down.
     */
    public static int mentalHealthScore(double polarity, int stressCount, int positiveCount) {
        double raw = 5.5 + 2.5 * polarity - 0.5 * stressCount + 0.3 * positiveCount;
        double clamped = Math.max(1, Math.min(10, raw));
        return BigDecimal.valueOf(clamped).setScale(0, RoundingMode.HALF_DOWN).intValue();
    }

    public static String mentalHealthLabel(int score) {
        if (score <= 3) return "Concerning - Seek support";
        if (score <= 5) return "Fair - Monitor closely";
        if (score <= 7) return "Good - Maintain balance";
        return "Excellent - Keep it up";
    }

    static String normalize(String text) {
        String lower = text.toLowerCase();
        String kept = lower.replaceAll("[^a-z0-9\\s.,!?]", "");
        return kept.trim().replaceAll("\\s+", " ");
    }

    private SentimentResult score(String text) {
        String normalized = normalize(text);
        Polarity base = lexicon.score(normalized);

        Set<String> tokens = new HashSet<>(Arrays.asList(normalized.split("[^a-z0-9]+")));
        Set<String> stressFound = matches(tokens, STRESS_KEYWORDS);
        Set<String> positiveFound = matches(tokens, POSITIVE_KEYWORDS);

        double adjusted = base.polarity() - KEYWORD_WEIGHT * stressFound.size() + KEYWORD_WEIGHT * positiveFound.size();
        adjusted = Math.max(-1, Math.min(1, adjusted));

        Sentiment sentiment;
        double confidence;
        if (adjusted > NEUTRAL_BAND) {
            sentiment = Sentiment.POSITIVE;
            confidence = Math.min(0.9, 0.5 + 0.4 * Math.abs(adjusted));
        } else if (adjusted < -NEUTRAL_BAND) {
            sentiment = Sentiment.NEGATIVE;
            confidence = Math.min(0.9, 0.5 + 0.4 * Math.abs(adjusted));
        } else {
            sentiment = Sentiment.NEUTRAL;
            confidence = 0.5 + 2 * (NEUTRAL_BAND - Math.abs(adjusted));
        }
        if ((sentiment == Sentiment.NEGATIVE && stressFound.size() >= 2)
                || (sentiment == Sentiment.POSITIVE && positiveFound.size() >= 2)) {
            confidence = Math.min(0.95, confidence + 0.1);
        }

        return new SentimentResult(sentiment, round3(base.polarity()), round3(adjusted), round3(base.subjectivity()),
                stressFound, positiveFound, round3(confidence));
    }

    private static Set<String> matches(Set<String> tokens, List<String> keywords) {
        Set<String> found = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (tokens.contains(keyword)) found.add(keyword);
        }
        return found;
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
