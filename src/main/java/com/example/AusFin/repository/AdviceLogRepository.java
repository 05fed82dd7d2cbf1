package com.example.AusFin.repository;

import com.example.AusFin.model.AdviceLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AdviceLogRepository extends JpaRepository<AdviceLog, Long> {

    List<AdviceLog> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
