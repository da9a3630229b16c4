package com.clout.gameshow.config;

import com.clout.gameshow.model.Question;
import com.clout.gameshow.service.QuestionLoader;
import com.clout.gameshow.store.GameshowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

@Slf4j
@Configuration
public class GameshowConfig {

    /**
     * The single game of this process. A question file that cannot be loaded
     * aborts startup.
     */
    @Bean
    GameshowStore gameshowStore(QuestionLoader questionLoader, GameshowSettings settings) {
        Path file = Path.of(settings.getQuestionsFile());
        List<Question> questions = questionLoader.load(file);
        log.info("Loaded {} questions from {}", questions.size(), file);
        return new GameshowStore(questions);
    }

    @Bean
    Random jokerRandom() {
        return new Random();
    }
}
