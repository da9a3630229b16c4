package com.clout.gameshow.controller;

import com.clout.gameshow.dto.GameStateDTO;
import com.clout.gameshow.dto.GiveMoneyRequest;
import com.clout.gameshow.dto.LoadQuestionsRequest;
import com.clout.gameshow.dto.PlayerJokersDTO;
import com.clout.gameshow.dto.PlayerMoneyDTO;
import com.clout.gameshow.dto.SetJokersRequest;
import com.clout.gameshow.service.ModeratorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
@RequiredArgsConstructor
public class ModeratorController {

    private final ModeratorService moderatorService;

    @GetMapping("/api/getGameState")
    @ResponseBody
    public ResponseEntity<GameStateDTO> getGameState() {
        return ResponseEntity.ok(moderatorService.status());
    }

    @PostMapping("/api/giveMoney")
    @ResponseBody
    public ResponseEntity<PlayerMoneyDTO> giveMoney(@RequestBody GiveMoneyRequest req) {
        long balance = moderatorService.giveMoney(req.getName(), req.getMoney());
        return ResponseEntity.ok(new PlayerMoneyDTO(req.getName(), balance));
    }

    @PostMapping("/api/setJokers")
    @ResponseBody
    public ResponseEntity<PlayerJokersDTO> setJokers(@RequestBody SetJokersRequest req) {
        int jokers = moderatorService.setJokers(req.getName(), req.getJokers());
        return ResponseEntity.ok(new PlayerJokersDTO(req.getName(), jokers));
    }

    @GetMapping("/api/kickPlayer")
    @ResponseBody
    public ResponseEntity<Void> kickPlayer(@RequestParam("name") String name) {
        moderatorService.kick(name);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/activateNextQuestion")
    @ResponseBody
    public ResponseEntity<Void> activateNextQuestion() {
        moderatorService.requestNextQuestion();
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/forceQuestionAnswering")
    @ResponseBody
    public ResponseEntity<Void> forceQuestionAnswering() {
        moderatorService.forceBettingOrSelectingReady();
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/forceQuestionResults")
    @ResponseBody
    public ResponseEntity<Void> forceQuestionResults() {
        moderatorService.forceAnsweringReady();
        return ResponseEntity.ok().build();
    }

    // answers with the question index that was current before the jump
    @GetMapping("/api/setNextQuestion")
    @ResponseBody
    public ResponseEntity<String> setNextQuestion(@RequestParam("number") int number) {
        return ResponseEntity.ok(Integer.toString(moderatorService.jumpToQuestion(number)));
    }

    @PostMapping("/api/loadQuestions")
    @ResponseBody
    public ResponseEntity<String> loadQuestions(@RequestBody LoadQuestionsRequest req) {
        return ResponseEntity.ok(Integer.toString(moderatorService.reloadQuestions(req.getFilename())));
    }
}
