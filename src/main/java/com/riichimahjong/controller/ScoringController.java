package com.riichimahjong.controller;

import com.riichimahjong.engine.Payment;
import com.riichimahjong.engine.ScoreBreakdown;
import com.riichimahjong.engine.ScoringResult;
import com.riichimahjong.engine.YakuEntry;
import com.riichimahjong.service.ScoreRequest;
import com.riichimahjong.service.ScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 计分控制器
 */
@Controller
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final ScoringService scoringService;
    private final SimpMessagingTemplate messagingTemplate;

    public ScoringController(ScoringService scoringService, SimpMessagingTemplate messagingTemplate) {
        this.scoringService = scoringService;
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * 计算得点
     */
    @PostMapping("/api/score")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> score(@RequestBody ScoreRequest request) {
        try {
            ScoringResult result = scoringService.score(request);
            HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
            return ResponseEntity.status(status).body(buildView(result));
        } catch (IllegalArgumentException e) {
            log.warn("请求格式错误：{}", e.getMessage());
            return ResponseEntity.badRequest().body(buildBadRequestView(e.getMessage()));
        }
    }

    /**
     * 通过 WebSocket 计算得点，结果推送给请求方
     */
    @MessageMapping("/score/calculate")
    public void calculate(@Payload ScoreRequest request) {
        log.info("收到计分请求：客户端={}", request.getClientId());
        if (request.getClientId() == null || request.getClientId().isEmpty()) {
            log.warn("计分请求缺少 clientId，无法推送结果");
            return;
        }

        Map<String, Object> view;
        try {
            view = buildView(scoringService.score(request));
        } catch (IllegalArgumentException e) {
            log.warn("请求格式错误：{}", e.getMessage());
            view = buildBadRequestView(e.getMessage());
        }
        messagingTemplate.convertAndSend("/topic/score/" + request.getClientId(), view);
    }

    /**
     * 构建返回视图
     */
    private Map<String, Object> buildView(ScoringResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("success", result.isSuccess());
        if (!result.isSuccess()) {
            view.put("error", result.getError().name());
            view.put("message", result.getMessage());
            return view;
        }

        ScoreBreakdown breakdown = result.getBreakdown();
        view.put("han", breakdown.getHan());
        view.put("fu", breakdown.getFu());
        view.put("yakuman", breakdown.isYakuman());
        view.put("yakumanMultiple", breakdown.getYakumanMultiple());
        view.put("limit", breakdown.getLimit() != null ? breakdown.getLimit().name() : null);
        view.put("label", breakdown.getLabel());
        view.put("basePoints", breakdown.getBasePoints());
        view.put("totalPoints", breakdown.getTotalPoints());
        view.put("shape", breakdown.getShape());
        view.put("wait", breakdown.getWait());
        view.put("decomposition", breakdown.getDecomposition());

        List<Map<String, Object>> yaku = new ArrayList<>();
        for (YakuEntry entry : breakdown.getYaku()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("yaku", entry.getYaku().name());
            item.put("name", entry.getName());
            item.put("han", entry.getHan());
            yaku.add(item);
        }
        view.put("yaku", yaku);

        Payment payment = breakdown.getPayment();
        List<Map<String, Object>> shares = new ArrayList<>();
        for (Payment.Share share : payment.getShares()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("payer", share.getPayer().name());
            item.put("amount", share.getAmount());
            shares.add(item);
        }
        view.put("payments", shares);
        view.put("honbaBonus", payment.getHonbaBonus());
        view.put("riichiDeposit", payment.getRiichiDeposit());
        return view;
    }

    private Map<String, Object> buildBadRequestView(String message) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("success", false);
        view.put("error", "BAD_REQUEST");
        view.put("message", message);
        return view;
    }
}
