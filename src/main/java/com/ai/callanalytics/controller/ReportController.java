package com.ai.callanalytics.controller;

import com.ai.callanalytics.entity.view.DailyStatisticsView;
import com.ai.callanalytics.entity.view.HotLeadView;
import com.ai.callanalytics.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/hot-leads")
    public List<HotLeadView> hotLeads(@RequestParam(required = false) Integer limit) {
        return reportService.hotLeads(limit);
    }

    @GetMapping("/daily-statistics")
    public List<DailyStatisticsView> dailyStatistics(@RequestParam(required = false) Integer days) {
        return reportService.dailyStatistics(days);
    }
}
