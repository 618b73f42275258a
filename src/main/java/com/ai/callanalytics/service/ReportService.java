package com.ai.callanalytics.service;

import com.ai.callanalytics.entity.view.DailyStatisticsView;
import com.ai.callanalytics.entity.view.HotLeadView;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.repository.view.DailyStatisticsViewRepository;
import com.ai.callanalytics.repository.view.HotLeadViewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only projections over the {@code leads_calientes} and {@code estadisticas_conversaciones}
 * views. Nothing is cached; every call re-runs the view query.
 */
@Service
@RequiredArgsConstructor
public class ReportService {

    private final HotLeadViewRepository hotLeadRepository;
    private final DailyStatisticsViewRepository statisticsRepository;
    private final Clock clock;

    @Value("${leads.reports.hot-leads.default-limit:10}")
    private int defaultHotLeadLimit;

    @Value("${leads.reports.statistics.default-days:7}")
    private int defaultStatisticsDays;

    @Transactional(readOnly = true)
    public List<HotLeadView> hotLeads() {
        return hotLeadRepository.findAllByOrderByStartTimeDesc();
    }

    /**
     * Most recent hot leads first, capped at {@code limit} (the configured default when null).
     */
    @Transactional(readOnly = true)
    public List<HotLeadView> hotLeads(Integer limit) {
        int size = limit == null ? defaultHotLeadLimit : limit;
        if (size <= 0) {
            throw new InvalidArgumentException("limit must be positive: " + size);
        }
        return hotLeadRepository.findAllByOrderByStartTimeDesc(PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public List<DailyStatisticsView> dailyStatistics() {
        return statisticsRepository.findAllByOrderByFechaDesc();
    }

    /**
     * Days from {@code today - days} up to today, newest first. Days without calls are absent.
     */
    @Transactional(readOnly = true)
    public List<DailyStatisticsView> dailyStatistics(Integer days) {
        int window = days == null ? defaultStatisticsDays : days;
        if (window < 0) {
            throw new InvalidArgumentException("days must not be negative: " + window);
        }
        LocalDate from = LocalDate.now(clock).minusDays(window);
        return statisticsRepository.findByFechaGreaterThanEqualOrderByFechaDesc(from);
    }
}
