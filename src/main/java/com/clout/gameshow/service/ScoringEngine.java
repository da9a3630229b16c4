package com.clout.gameshow.service;

import com.clout.gameshow.config.GameshowSettings;
import com.clout.gameshow.model.Player;
import com.clout.gameshow.model.PlayerSnapshot;
import com.clout.gameshow.model.QuestionType;
import com.clout.gameshow.model.event.ShowResults;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Money settlement per question type. Works only on the players it is handed;
 * the caller holds the players write lock.
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    private final GameshowSettings settings;

    /**
     * Applies the scoring rule of {@code type} and returns the roster before and after.
     */
    public ShowResults settle(QuestionType type, int correctAnswer, List<Player> players) {
        List<PlayerSnapshot> before = snapshot(players);
        switch (type) {
            case NORMAL -> scoreNormal(correctAnswer, players);
            case BETTING -> scoreBetting(correctAnswer, players);
            case ESTIMATION -> scoreEstimation(correctAnswer, players);
            case VERSUS -> scoreVersus(correctAnswer, players);
        }
        return new ShowResults(correctAnswer, before, snapshot(players));
    }

    void scoreNormal(int correctAnswer, List<Player> players) {
        for (Player player : players) {
            if (player.getAnswer() == correctAnswer) {
                player.setMoney(player.getMoney() + settings.getNormalQuestionReward());
            }
        }
    }

    void scoreBetting(int correctAnswer, List<Player> players) {
        for (Player player : players) {
            if (player.getAnswer() == correctAnswer) {
                player.setMoney(player.getMoney() + player.getMoneyBet());
            } else {
                player.setMoney(keepInGame(player.getMoney() - player.getMoneyBet()));
            }
        }
    }

    /**
     * Everybody tied for the smallest distance to the correct value wins the reward.
     */
    void scoreEstimation(int correctAnswer, List<Player> players) {
        long best = Long.MAX_VALUE;
        List<Player> closest = new ArrayList<>();
        for (Player player : players) {
            long diff = Math.abs((long) player.getAnswer() - correctAnswer);
            if (diff < best) {
                best = diff;
                closest.clear();
                closest.add(player);
            } else if (diff == best) {
                closest.add(player);
            }
        }
        for (Player winner : closest) {
            winner.setMoney(winner.getMoney() + settings.getEstimationQuestionReward());
        }
    }

    /**
     * A correct selector halves its opponent's money, a wrong one doubles it. All factors are
     * collected from the unmodified roster first and then applied once per player.
     */
    void scoreVersus(int correctAnswer, List<Player> players) {
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < players.size(); i++) {
            indexByName.put(players.get(i).getName(), i);
        }

        double[] factors = new double[players.size()];
        Arrays.fill(factors, 1.0);
        for (Player selector : players) {
            if (!selector.hasOpponent()) {
                continue;
            }
            Integer target = indexByName.get(selector.getVsPlayer());
            if (target == null) {
                // opponent was kicked after being selected
                continue;
            }
            // only the opponent is affected; the selector's own money stays as is
            factors[target] *= selector.getAnswer() == correctAnswer ? 0.5 : 2.0;
        }

        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            player.setMoney(keepInGame((long) (player.getMoney() * factors[i])));
        }
    }

    /**
     * A balance that would drop to zero (or below) becomes 1 so the player can keep playing.
     */
    private static long keepInGame(long money) {
        return money <= 0 ? 1 : money;
    }

    private static List<PlayerSnapshot> snapshot(List<Player> players) {
        return players.stream()
                .map(Player::snapshot)
                .collect(Collectors.toUnmodifiableList());
    }
}
