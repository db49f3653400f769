package com.jreinhal.docqa.rag.answer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AnswerCleanerTest {

    @Test
    void keepsTextAfterLastAnswerMarker() {
        assertEquals("58%", AnswerCleaner.clean("Context: x\nQuestion: y\nAnswer: 58%", "y"));
        assertEquals("second", AnswerCleaner.clean("Answer: first Answer: second", null));
    }

    @Test
    void removesQuestionEcho() {
        assertEquals("A grade of B", AnswerCleaner.clean("What is my grade? A grade of B", "what is my grade?"));
    }

    @Test
    void removesLeadingLabelAndQuotes() {
        assertEquals("42", AnswerCleaner.clean("a: 42", "q"));
        assertEquals("John Doe", AnswerCleaner.clean("Answer: \"John Doe\"", "Who?"));
        assertEquals("quoted", AnswerCleaner.clean("  'quoted'  ", ""));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", AnswerCleaner.clean(null, "q"));
        assertEquals("", AnswerCleaner.clean("Answer:   ", "q"));
    }
}
