package com.sandy.netwatch.monitor.repository;

import com.sandy.netwatch.monitor.entity.Alert;
import com.sandy.netwatch.monitor.model.AlertCategory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {
    Optional<Alert> findTopBySignatureAndCreatedAtAfter(String signature, LocalDateTime after);
    List<Alert> findByOrderByCreatedAtDescIdDesc(Pageable pageable);
    List<Alert> findByCategoryOrderByCreatedAtAsc(AlertCategory category);
    List<Alert> findByMonitoredKeyOrderByCreatedAtAsc(String monitoredKey);
}
