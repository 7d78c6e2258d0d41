package com.ventture.credit.controller;

import com.ventture.credit.repository.EvaluationHistoryRepository;
import com.ventture.credit.service.HistoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "history")
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private final HistoryService history;

    // newest first
    @GetMapping
    public List<EvaluationHistoryRepository.HistoryRow> list(@RequestParam(defaultValue = "20") int limit) {
        return history.latest(limit);
    }

    @GetMapping("/summary")
    public EvaluationHistoryRepository.Summary summary() {
        return history.summary();
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        return Map.of("ok", true, "deleted", history.clear());
    }
}
