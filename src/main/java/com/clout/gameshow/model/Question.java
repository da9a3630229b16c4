package com.clout.gameshow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One question record as loaded from a question file. Never mutated after loading;
 * a reload replaces the whole list.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Question {

    private QuestionType questionType;
    private String category;
    private String question;
    private List<String> answers;

    /**
     * 1-based option index for option-based types, the target value for estimation questions.
     */
    private int correctAnswer;
}
