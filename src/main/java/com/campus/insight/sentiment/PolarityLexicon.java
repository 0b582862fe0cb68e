package com.campus.insight.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level polarity/subjectivity scorer. Sentence polarity is the mean over the sentiment-bearing
 * words it contains; an intensifier scales the next scored word, a negation flips and halves it.
 * Negation and intensifiers do not carry across sentence punctuation.
 */
public class PolarityLexicon {
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+|[.!?]");
    private static final double NEGATION_FACTOR = -0.5;

    private static final Map<String, Double> INTENSIFIERS = Map.of(
            "very", 1.3,
            "really", 1.3,
            "so", 1.2,
            "extremely", 1.5,
            "incredibly", 1.5,
            "too", 1.2,
            "quite", 1.1,
            "totally", 1.4,
            "completely", 1.4);

    private static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "nothing", "nobody", "hardly", "barely",
            "dont", "doesnt", "didnt", "cant", "cannot", "wont", "isnt", "wasnt", "arent", "aint");

    private final Map<String, double[]> entries;

    PolarityLexicon(Map<String, double[]> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static PolarityLexicon fromClasspath(String resource) {
        InputStream in = PolarityLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Sentiment lexicon not found on classpath: " + resource);
        }
        Map<String, double[]> entries = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] parts = trimmed.split("\\s+");
                if (parts.length != 3) {
                    throw new IllegalStateException("Malformed lexicon line: " + line);
                }
                entries.put(parts[0], new double[]{Double.parseDouble(parts[1]), Double.parseDouble(parts[2])});
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read sentiment lexicon " + resource, e);
        }
        return new PolarityLexicon(entries);
    }

    /**
     * Scores already-normalized text (lowercase, alphanumerics, spaces and {@code .,!?}).
     */
    SentimentModels.Polarity score(String normalized) {
        List<double[]> scored = new ArrayList<>();
        double intensity = 1.0;
        boolean negated = false;

        Matcher m = TOKEN.matcher(normalized);
        while (m.find()) {
            String token = m.group();
            if (token.length() == 1 && ".!?".contains(token)) {
                intensity = 1.0;
                negated = false;
                continue;
            }
            if (NEGATIONS.contains(token)) {
                negated = true;
                continue;
            }
            double[] entry = entries.get(token);
            if (entry == null) {
                Double boost = INTENSIFIERS.get(token);
                if (boost != null) intensity *= boost;
                continue;
            }
            double polarity = entry[0] * intensity;
            double subjectivity = Math.min(1.0, entry[1] * intensity);
            if (negated) polarity *= NEGATION_FACTOR;
            scored.add(new double[]{polarity, subjectivity});
            intensity = 1.0;
            negated = false;
        }

        if (scored.isEmpty()) return new SentimentModels.Polarity(0.0, 0.0);
        double polarity = scored.stream().mapToDouble(s -> s[0]).average().orElse(0.0);
        double subjectivity = scored.stream().mapToDouble(s -> s[1]).average().orElse(0.0);
        return new SentimentModels.Polarity(clamp(polarity, -1, 1), clamp(subjectivity, 0, 1));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
