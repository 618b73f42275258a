package com.ai.callanalytics.repository.view;

import com.ai.callanalytics.entity.view.HotLeadView;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HotLeadViewRepository extends JpaRepository<HotLeadView, String> {

    List<HotLeadView> findAllByOrderByStartTimeDesc();

    List<HotLeadView> findAllByOrderByStartTimeDesc(Pageable pageable);
}
