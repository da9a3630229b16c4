package com.clout.gameshow.service;

import com.clout.gameshow.exception.ErrorKind;
import com.clout.gameshow.exception.GameshowException;
import com.clout.gameshow.model.Question;
import com.clout.gameshow.model.QuestionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionLoaderTest {

    @TempDir
    Path tempDir;

    private QuestionLoader loader;

    @BeforeEach
    void setUp() {
        loader = new QuestionLoader(new ObjectMapper(), GameFixture.SETTINGS);
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("questions.json");
        Files.writeString(file, json);
        return file;
    }

    private void assertLoadFailure(String json) throws IOException {
        Path file = write(json);
        GameshowException e = assertThrows(GameshowException.class, () -> loader.load(file));
        assertEquals(ErrorKind.LOAD_FAILURE, e.getKind());
    }

    @Test
    void test_loads_all_question_types_in_order() {
        List<Question> questions = loader.load(Path.of(GameFixture.SETTINGS.getQuestionsFile()));

        assertEquals(4, questions.size());
        assertEquals(QuestionType.NORMAL, questions.get(0).getQuestionType());
        assertEquals(QuestionType.BETTING, questions.get(1).getQuestionType());
        assertEquals(QuestionType.ESTIMATION, questions.get(2).getQuestionType());
        assertEquals(QuestionType.VERSUS, questions.get(3).getQuestionType());

        Question first = questions.get(0);
        assertEquals("Geography", first.getCategory());
        assertEquals("What is the capital of Australia?", first.getQuestion());
        assertEquals(List.of("Sydney", "Canberra", "Melbourne", "Perth"), first.getAnswers());
        assertEquals(2, first.getCorrectAnswer());
        assertEquals(1896, questions.get(2).getCorrectAnswer());
    }

    @Test
    void test_empty_array_gives_empty_list() throws IOException {
        assertTrue(loader.load(write("[]")).isEmpty());
    }

    @Test
    void test_missing_category_and_answers_default_to_empty() throws IOException {
        Path file = write("[{\"question_type\": \"EstimationQuestion\", \"question\": \"How tall?\", \"correct_answer\": 330}]");

        Question q = loader.load(file).get(0);

        assertEquals("", q.getCategory());
        assertEquals(List.of(), q.getAnswers());
    }

    @Test
    void test_rejects_malformed_json() throws IOException {
        assertLoadFailure("[{\"question_type\": ");
    }

    @Test
    void test_rejects_null_document() throws IOException {
        assertLoadFailure("null");
    }

    @Test
    void test_rejects_unknown_question_type() throws IOException {
        assertLoadFailure("[{\"question_type\": \"TrickQuestion\", \"question\": \"?\", \"answers\": [\"a\"], \"correct_answer\": 1}]");
    }

    @Test
    void test_rejects_missing_question_type() throws IOException {
        assertLoadFailure("[{\"question\": \"?\", \"answers\": [\"a\"], \"correct_answer\": 1}]");
    }

    @Test
    void test_rejects_blank_prompt() throws IOException {
        assertLoadFailure("[{\"question_type\": \"NormalQuestion\", \"question\": \" \", \"answers\": [\"a\"], \"correct_answer\": 1}]");
    }

    @Test
    void test_rejects_null_answer() throws IOException {
        assertLoadFailure("[{\"question_type\": \"NormalQuestion\", \"question\": \"?\", \"answers\": [\"a\", null], \"correct_answer\": 1}]");
    }

    @Test
    void test_rejects_correct_answer_outside_options() throws IOException {
        assertLoadFailure("[{\"question_type\": \"BettingQuestion\", \"question\": \"?\", \"answers\": [\"a\", \"b\"], \"correct_answer\": 3}]");
        assertLoadFailure("[{\"question_type\": \"NormalQuestion\", \"question\": \"?\", \"answers\": [\"a\", \"b\"], \"correct_answer\": 0}]");
    }

    @Test
    void test_rejects_negative_estimate() throws IOException {
        assertLoadFailure("[{\"question_type\": \"EstimationQuestion\", \"question\": \"?\", \"correct_answer\": -1}]");
    }

    @Test
    void test_missing_file_is_a_load_failure() {
        GameshowException e = assertThrows(GameshowException.class,
                () -> loader.load(tempDir.resolve("nope.json")));

        assertEquals(ErrorKind.LOAD_FAILURE, e.getKind());
        assertNotNull(e.getCause());
    }

    @Test
    void test_loadByName_reads_from_questions_dir() {
        assertEquals(2, loader.loadByName("second-round.json").size());
    }

    @Test
    void test_loadByName_rejects_escaping_names() {
        for (String name : List.of("../application.properties", "../../../pom.xml", "", " ", ".")) {
            GameshowException e = assertThrows(GameshowException.class, () -> loader.loadByName(name));
            assertEquals(ErrorKind.INVALID_INPUT, e.getKind(), name);
        }
    }
}
