package com.clout.gameshow.service;

import com.clout.gameshow.config.GameshowSettings;
import com.clout.gameshow.exception.GameshowException;
import com.clout.gameshow.model.Phase;
import com.clout.gameshow.model.Player;
import com.clout.gameshow.model.PlayerSnapshot;
import com.clout.gameshow.model.Question;
import com.clout.gameshow.store.GameshowStore;
import com.clout.gameshow.store.OrderedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Player-facing actions. Each one is legal only in specific phases and, once every
 * player has done their part, marks the phase ready for the next poll.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerActionService {

    private final GameshowStore store;
    private final GameshowSettings settings;
    private final Random jokerRandom;

    /**
     * Registers a player; joining again with the same (trimmed) name changes nothing.
     *
     * @return the trimmed name
     */
    public String join(String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            throw GameshowException.invalidInput("Empty name is not allowed!");
        }

        try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
            if (store.findPlayer(name).isEmpty()) {
                store.getPlayers().add(new Player(name, settings.getInitialJokers(), settings.getInitialMoney()));
                log.info("Player {} joined", name);
            }
        }
        return name;
    }

    public List<PlayerSnapshot> players() {
        try (OrderedLock.Handle playersHandle = store.playersLock().read()) {
            return store.snapshotPlayers();
        }
    }

    public void placeBet(String name, long amount) {
        Phase phase;
        boolean everyoneBet;
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            phase = requirePhase(p -> p.isWaiting(Phase.Stage.BETTING_BETTING), "BettingBetting(false)");
            if (amount < 1) {
                throw GameshowException.invalidInput("money_bet is invalid (< 1 or > player money)!");
            }
            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                Player player = requirePlayer(name);
                if (amount > player.getMoney()) {
                    throw GameshowException.invalidInput("money_bet is invalid (< 1 or > player money)!");
                }
                player.setMoneyBet(amount);
                everyoneBet = store.getPlayers().stream().allMatch(Player::hasBet);
            }
        }
        log.debug("Player {} bet {}", name, amount);
        if (everyoneBet) {
            markReady(phase);
        }
    }

    public void selectOpponent(String name, String target) {
        Phase phase;
        boolean everyoneSelected;
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            phase = requirePhase(p -> p.isWaiting(Phase.Stage.VERSUS_SELECTING), "VersusSelecting(false)");
            if (name != null && name.equals(target)) {
                throw GameshowException.invalidInput("name and vs_player are equal!");
            }
            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                Player player = requirePlayer(name);
                requirePlayer(target);
                player.setVsPlayer(target);
                everyoneSelected = store.getPlayers().stream().allMatch(Player::hasOpponent);
            }
        }
        log.debug("Player {} selected {}", name, target);
        if (everyoneSelected) {
            markReady(phase);
        }
    }

    public void submitAnswer(String name, int answer) {
        Phase phase;
        boolean everyoneAnswered;
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            phase = requirePhase(p -> p.getStage().isAnswering() && !p.isReady(), "*Answering(false)");
            if (answer < 1) {
                throw GameshowException.invalidInput("answer is invalid (< 1)!");
            }
            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                requirePlayer(name).setAnswer(answer);
                everyoneAnswered = store.getPlayers().stream().allMatch(Player::hasAnswered);
            }
        }
        log.debug("Player {} answered {}", name, answer);
        if (everyoneAnswered) {
            markReady(phase);
        }
    }

    /**
     * Spends one joker and reveals two wrong options of the current question.
     *
     * @return two distinct 1-based option indices, neither of them the correct one
     */
    public List<Integer> requestFiftyFifty(String name) {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            requirePhase(p -> p.isWaiting(Phase.Stage.NORMAL_ANSWERING) || p.isWaiting(Phase.Stage.BETTING_ANSWERING),
                    "NormalAnswering(false) or BettingAnswering(false)");

            List<Integer> wrongAnswers;
            try (OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
                wrongAnswers = drawWrongAnswers(store.getCurrentQuestion());
            }

            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                Player player = requirePlayer(name);
                if (player.getJokers() < 1) {
                    throw GameshowException.noJokersLeft(name);
                }
                player.setJokers(player.getJokers() - 1);
            }
            log.debug("Player {} used a fifty-fifty joker", name);
            return wrongAnswers;
        }
    }

    private List<Integer> drawWrongAnswers(Question question) {
        List<Integer> candidates = new ArrayList<>();
        for (int option = 1; option <= question.getAnswers().size(); option++) {
            if (option != question.getCorrectAnswer()) {
                candidates.add(option);
            }
        }
        if (candidates.size() < 2) {
            throw GameshowException.invalidInput("Question has too few answers for a fifty-fifty joker!");
        }
        Collections.shuffle(candidates, jokerRandom);
        return List.copyOf(candidates.subList(0, 2));
    }

    // ----------------- helpers -------------------

    private Phase requirePhase(Predicate<Phase> allowed, String expected) {
        Phase phase = store.getPhase();
        if (!allowed.test(phase)) {
            throw GameshowException.phaseMismatch("Phase is " + phase + ", not " + expected + "!");
        }
        return phase;
    }

    private Player requirePlayer(String name) {
        return store.findPlayer(name).orElseThrow(() -> GameshowException.notFound(name));
    }

    /**
     * Flips {@code expected} to ready unless another request advanced or flipped it meanwhile.
     * Compared by identity: every transition stores a new instance, so an equal phase of a
     * later question does not match.
     */
    private void markReady(Phase expected) {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            if (store.getPhase() == expected) {
                store.setPhase(expected.asReady());
                log.debug("Phase {} is ready", expected);
            }
        }
    }
}
