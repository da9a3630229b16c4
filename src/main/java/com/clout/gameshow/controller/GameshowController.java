package com.clout.gameshow.controller;

import com.clout.gameshow.model.PlayerSnapshot;
import com.clout.gameshow.model.event.GameEvent;
import com.clout.gameshow.service.AdvancementService;
import com.clout.gameshow.service.PlayerActionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.List;

@Controller
@RequiredArgsConstructor
public class GameshowController {

    private final PlayerActionService playerActionService;
    private final AdvancementService advancementService;

    @GetMapping("/api/joinPlayer")
    @ResponseBody
    public ResponseEntity<String> joinPlayer(@RequestParam("name") String name) {
        return ResponseEntity.ok(playerActionService.join(name));
    }

    // lists pending answers too, meant for the moderator view
    @GetMapping("/api/getPlayerData")
    @ResponseBody
    public ResponseEntity<List<PlayerSnapshot>> getPlayerData() {
        return ResponseEntity.ok(playerActionService.players());
    }

    @GetMapping("/api/betMoney")
    @ResponseBody
    public ResponseEntity<Void> betMoney(@RequestParam("name") String name,
                                         @RequestParam("money_bet") long moneyBet) {
        playerActionService.placeBet(name, moneyBet);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/attackPlayer")
    @ResponseBody
    public ResponseEntity<Void> attackPlayer(@RequestParam("name") String name,
                                             @RequestParam("vs_player") String vsPlayer) {
        playerActionService.selectOpponent(name, vsPlayer);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/answerQuestion")
    @ResponseBody
    public ResponseEntity<Void> answerQuestion(@RequestParam("name") String name,
                                               @RequestParam("answer") int answer) {
        playerActionService.submitAnswer(name, answer);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/getJokerFiftyFifty")
    @ResponseBody
    public ResponseEntity<List<Integer>> getJokerFiftyFifty(@RequestParam("name") String name) {
        return ResponseEntity.ok(playerActionService.requestFiftyFifty(name));
    }

    // polling is what advances the game: a ready phase transitions before the log is returned
    @GetMapping("/api/getGameEvents")
    @ResponseBody
    public ResponseEntity<List<GameEvent>> getGameEvents() {
        return ResponseEntity.ok(advancementService.pollAndAdvance());
    }
}
