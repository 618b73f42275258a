package com.ai.callanalytics.repository.view;

import com.ai.callanalytics.entity.view.DailyStatisticsView;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface DailyStatisticsViewRepository extends JpaRepository<DailyStatisticsView, LocalDate> {

    List<DailyStatisticsView> findAllByOrderByFechaDesc();

    List<DailyStatisticsView> findByFechaGreaterThanEqualOrderByFechaDesc(LocalDate from);
}
