package com.flagship.wallet_ledger.health;

import com.flagship.wallet_ledger.reference.UserAccountRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint. Unlike actuator health it needs no
 * authorization. Reports DOWN when the database is unreachable or no
 * treasury account exists, since no transfer can succeed in either case.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final UserAccountRepository userAccountRepository;

    public HealthController(DataSource dataSource, UserAccountRepository userAccountRepository) {
        this.dataSource = dataSource;
        this.userAccountRepository = userAccountRepository;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean treasuryPresent = dbHealthy && checkTreasury();
        response.put("treasury", treasuryPresent ? "PRESENT" : "MISSING");

        if (!dbHealthy || !treasuryPresent) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }

    private boolean checkTreasury() {
        try {
            return userAccountRepository.findFirstBySystemTrue().isPresent();
        } catch (Exception e) {
            return false;
        }
    }
}
