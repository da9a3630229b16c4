package com.clout.gameshow.service;

import com.clout.gameshow.config.GameshowSettings;
import com.clout.gameshow.exception.GameshowException;
import com.clout.gameshow.model.Question;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads question files: a JSON array of question records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionLoader {

    private static final TypeReference<List<Question>> QUESTION_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final GameshowSettings settings;

    public List<Question> load(Path file) {
        List<Question> parsed;
        try (InputStream in = Files.newInputStream(file)) {
            parsed = objectMapper.readValue(in, QUESTION_LIST);
        } catch (IOException e) {
            log.warn("Question file {} could not be loaded: {}", file, e.getMessage());
            throw GameshowException.loadFailure("Question file could not be loaded: " + file, e);
        }
        if (parsed == null) {
            throw GameshowException.loadFailure("Question file is empty: " + file);
        }

        List<Question> questions = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            questions.add(validate(parsed.get(i), i + 1, file));
        }
        return List.copyOf(questions);
    }

    /**
     * Loads a file by bare name from the configured questions directory.
     */
    public List<Question> loadByName(String filename) {
        if (filename == null || filename.isBlank()) {
            throw GameshowException.invalidInput("Question file name must not be empty!");
        }
        Path dir = Path.of(settings.getQuestionsDir()).toAbsolutePath().normalize();
        Path file = dir.resolve(filename).normalize();
        if (!file.startsWith(dir) || file.equals(dir)) {
            throw GameshowException.invalidInput("Question file must be inside the questions directory!");
        }
        return load(file);
    }

    private Question validate(Question q, int position, Path file) {
        if (q == null) {
            throw GameshowException.loadFailure("Question " + position + " in " + file + " is null");
        }
        if (q.getQuestionType() == null) {
            throw GameshowException.loadFailure("Question " + position + " in " + file + " has no question_type");
        }
        if (q.getQuestion() == null || q.getQuestion().isBlank()) {
            throw GameshowException.loadFailure("Question " + position + " in " + file + " has no question text");
        }

        if (q.getAnswers() != null && q.getAnswers().contains(null)) {
            throw GameshowException.loadFailure("Question " + position + " in " + file + " has a null answer");
        }
        List<String> answers = q.getAnswers() == null ? List.of() : List.copyOf(q.getAnswers());
        if (q.getQuestionType().isOptionBased()
                && (q.getCorrectAnswer() < 1 || q.getCorrectAnswer() > answers.size())) {
            throw GameshowException.loadFailure("Question " + position + " in " + file
                    + " has correct_answer " + q.getCorrectAnswer() + " outside of its " + answers.size() + " answers");
        }
        if (!q.getQuestionType().isOptionBased() && q.getCorrectAnswer() < 0) {
            throw GameshowException.loadFailure("Question " + position + " in " + file + " has a negative estimate");
        }

        return q.toBuilder()
                .category(q.getCategory() == null ? "" : q.getCategory())
                .answers(answers)
                .build();
    }
}
