package com.flagship.member_ledger.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.flagship.member_ledger.membership.Period;
import com.flagship.member_ledger.membership.PeriodRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness check. Reports the database and, when it is reachable, the
 * current billing period.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final PeriodRepository periodRepository;

    public HealthController(DataSource dataSource, PeriodRepository periodRepository) {
        this.dataSource = dataSource;
        this.periodRepository = periodRepository;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        Period period = periodRepository.findCurrent();
        response.put("period", period.getId());
        response.put("balanceUpdate", period.isBalanceDone() ? "DONE"
            : period.isBalanceStarted() ? "RUNNING" : "PENDING");
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
