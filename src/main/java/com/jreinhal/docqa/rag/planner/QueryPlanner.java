package com.jreinhal.docqa.rag.planner;

import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.rag.answer.AnswerPatterns;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rule-based planning for typed questions: classification, query expansion and reranking of
 * retrieved chunks. No model calls; every method is a pure function of its arguments.
 *
 * <p>Percentage triggers are deliberately narrow. Only explicit percent, aggregate, CGPA or GPA
 * wording, or a standalone {@code %}, marks a percentage question; "marks" and "score" on their
 * own are count wording.</p>
 */
@Component
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private static final Pattern PERCENTAGE_QUESTION = Pattern.compile(
            "\\b(percent(?:age)?|cgpa|gpa|aggregate)\\b|(?<![\\w/])%(?![\\w/])", Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNT_QUESTION = Pattern.compile(
            "\\b(how\\s+many|how\\s+much|count|total\\s+number|number\\s+of|quantity|amount|"
            + "assignment|submission|complet|marks?|score|grade|result|obtained|got)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_QUESTION = Pattern.compile(
            "\\b(when|date|year|month|day|born|issued|expir(?:y|ed|ation)|valid(?:ity)?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_QUESTION = Pattern.compile(
            "\\b(who|name|author|issued\\s+to|student|candidate|person|organization|college|university|institute)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<AnswerType, Pattern> DETECTORS = new EnumMap<>(Map.of(
            AnswerType.PERCENTAGE, PERCENTAGE_QUESTION,
            AnswerType.COUNT, COUNT_QUESTION,
            AnswerType.DATE, DATE_QUESTION,
            AnswerType.NAME, NAME_QUESTION));

    // Appended in this order, which differs from classification precedence.
    private static final List<AnswerType> EXPANSION_ORDER = List.of(
            AnswerType.PERCENTAGE, AnswerType.DATE, AnswerType.NAME, AnswerType.COUNT);

    private static final Map<AnswerType, String> EXPANSIONS = new EnumMap<>(Map.of(
            AnswerType.PERCENTAGE, "percentage % score marks grade aggregate total",
            AnswerType.DATE, "date year month issued valid",
            AnswerType.NAME, "name person author candidate organization",
            AnswerType.COUNT, "total number count assignments submissions"));

    static final double BASE_SCORE = 1.0;
    static final double PERCENT_BONUS = 3.0;
    static final double BARE_FRACTION_PENALTY = -1.0;
    static final double DATE_BONUS = 2.0;
    static final double NAME_BONUS = 1.5;

    /**
     * Every detector family that fires on {@code question}. Families are independent.
     */
    public EnumSet<AnswerType> detect(String question) {
        EnumSet<AnswerType> detected = EnumSet.noneOf(AnswerType.class);
        if (question == null || question.isBlank()) {
            return detected;
        }
        for (Map.Entry<AnswerType, Pattern> entry : DETECTORS.entrySet()) {
            if (entry.getValue().matcher(question).find()) {
                detected.add(entry.getKey());
            }
        }
        return detected;
    }

    /**
     * Primary answer type: Percentage, then Count, Date, Name, else General.
     */
    public AnswerType classify(String question) {
        EnumSet<AnswerType> detected = this.detect(question);
        // EnumSet iterates in declaration order, which is the precedence order
        return detected.isEmpty() ? AnswerType.GENERAL : detected.iterator().next();
    }

    /**
     * Appends the keyword set of each detected type to widen nearest-neighbour recall.
     * Keyword sets already appended by an earlier call are stripped before detection, so
     * expanding twice yields the same string as expanding once.
     */
    public String expandQuery(String question) {
        if (question == null) {
            return "";
        }
        String base = stripExpansions(question);
        EnumSet<AnswerType> detected = this.detect(base);
        List<String> keywords = EXPANSION_ORDER.stream()
                .filter(detected::contains)
                .map(EXPANSIONS::get)
                .collect(Collectors.toList());
        if (keywords.isEmpty()) {
            return question;
        }
        return base.stripTrailing() + " " + String.join(" ", keywords);
    }

    /**
     * Rescores chunks for answer-type fit and keeps the best {@code topK}. Equal scores keep
     * their input order.
     */
    public List<Chunk> rerank(List<Chunk> chunks, String question, int topK) {
        if (chunks == null || chunks.isEmpty() || topK <= 0) {
            return List.of();
        }
        EnumSet<AnswerType> detected = this.detect(question);
        List<Chunk> ranked = new ArrayList<>(chunks);
        if (!detected.isEmpty()) {
            List<Scored> scored = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); ++i) {
                scored.add(new Scored(chunks.get(i), score(chunks.get(i).text(), detected)));
            }
            scored.sort(Comparator.comparingDouble(Scored::score).reversed());
            ranked = scored.stream().map(Scored::chunk).collect(Collectors.toList());
            if (log.isDebugEnabled()) {
                log.debug("Reranked {} chunks for {} (top score {})", chunks.size(), detected, scored.get(0).score());
            }
        }
        return List.copyOf(ranked.subList(0, Math.min(topK, ranked.size())));
    }

    static double score(String text, EnumSet<AnswerType> detected) {
        double score = BASE_SCORE;
        if (detected.contains(AnswerType.PERCENTAGE)) {
            boolean explicitPercent = AnswerPatterns.PERCENT_EXPLICIT.matcher(text).find();
            if (explicitPercent) {
                score += PERCENT_BONUS;
            } else if (AnswerPatterns.FRACTION.matcher(text).find()) {
                score += BARE_FRACTION_PENALTY;
            }
        }
        if (detected.contains(AnswerType.DATE) && AnswerPatterns.DATE.matcher(text).find()) {
            score += DATE_BONUS;
        }
        if (detected.contains(AnswerType.NAME) && AnswerPatterns.PROPER_NOUN.matcher(text).find()) {
            score += NAME_BONUS;
        }
        return score;
    }

    private static String stripExpansions(String question) {
        String current = question.stripTrailing();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String keywords : EXPANSIONS.values()) {
                String suffix = " " + keywords;
                if (current.endsWith(suffix)) {
                    current = current.substring(0, current.length() - suffix.length()).stripTrailing();
                    stripped = true;
                }
            }
        }
        return current.length() == question.stripTrailing().length() ? question : current;
    }

    private record Scored(Chunk chunk, double score) {
    }
}
