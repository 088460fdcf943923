package com.legalrag.agent.decision;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes questions that ask for a concrete figure (an amount, a rate, a
 * duration, the latest value of something). The statute text usually gives
 * only the framework for these, so they are candidates for a web search.
 */
@Component
public class SpecificFigureDetector {

    private static final Pattern FIGURE_WORDS = Pattern.compile(
            "\\b(how much|how many|amounts?|rates?|percent(age)?|salar(y|ies)|wages?|money"
                    + "|days?|months?|years?|currently|current|latest|newest|specific|exact|exactly)\\b");

    private static final Pattern YEAR_LITERAL = Pattern.compile("\\b(19|20)\\d{2}\\b");

    public boolean asksForSpecificFigure(String question) {
        if (question == null || question.isBlank()) {
            return false;
        }
        String q = question.toLowerCase(Locale.ROOT);
        return q.indexOf('%') >= 0
                || FIGURE_WORDS.matcher(q).find()
                || YEAR_LITERAL.matcher(q).find();
    }
}
