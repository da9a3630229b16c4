package com.clout.gameshow.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunable constants of the game show. Every value has a default, so an empty
 * environment still starts a playable game.
 */
@Getter
@Component
public class GameshowSettings {

    private final String questionsFile;
    private final String questionsDir;
    private final long initialMoney;
    private final int initialJokers;
    private final long normalQuestionReward;
    private final long estimationQuestionReward;

    public GameshowSettings(
            @Value("${gameshow.questions-file:./Questions/questions-example.json}") String questionsFile,
            @Value("${gameshow.questions-dir:./Questions}") String questionsDir,
            @Value("${gameshow.initial-money:500}") long initialMoney,
            @Value("${gameshow.initial-jokers:3}") int initialJokers,
            @Value("${gameshow.normal-question-reward:500}") long normalQuestionReward,
            @Value("${gameshow.estimation-question-reward:1000}") long estimationQuestionReward) {
        this.questionsFile = questionsFile;
        this.questionsDir = questionsDir;
        this.initialMoney = initialMoney;
        this.initialJokers = initialJokers;
        this.normalQuestionReward = normalQuestionReward;
        this.estimationQuestionReward = estimationQuestionReward;
    }
}
