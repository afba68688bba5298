package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lease table that keeps two nodes from syncing the same principal at once.
 * Upserts are idempotent, so a lost lock only costs duplicate provider calls.
 */
@Slf4j
@Service
public class SyncLockService {
    private static final String LOCK_TABLE = "principal_sync_locks";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final Duration lockTtl;

    public SyncLockService(JdbcTemplate jdbcTemplate, Clock clock, MirrorProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.lockTtl = properties.getSync().getLockTtl();
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "principal_id VARCHAR(255) PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Lock table initialized");
        } catch (DataAccessException e) {
            log.warn("Could not initialize lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * @return true when this node now holds the lock for the principal
     */
    public boolean tryLock(String principalId, String nodeId) {
        Instant now = clock.instant();
        try {
            // An expired lease belongs to nobody
            int expired = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE principal_id = ? AND expires_at < ?",
                principalId, Timestamp.from(now));
            if (expired > 0) {
                log.debug("Removed expired sync lock of principal {}", principalId);
            }
            jdbcTemplate.update(
                "INSERT INTO " + LOCK_TABLE + " (principal_id, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                principalId, nodeId, Timestamp.from(now), Timestamp.from(now.plus(lockTtl)));
            log.debug("Acquired sync lock for principal {}", principalId);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Principal {} is already being synced by another node", principalId);
            return false;
        } catch (DataAccessException e) {
            log.error("Error acquiring sync lock for principal {}: {}", principalId, e.getMessage(), e);
            return false;
        }
    }

    public void releaseLock(String principalId, String nodeId) {
        try {
            int rows = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE principal_id = ? AND locked_by = ?",
                principalId, nodeId);
            if (rows > 0) {
                log.debug("Released sync lock for principal {}", principalId);
            } else {
                log.warn("Sync lock for principal {} was not held by node {}", principalId, nodeId);
            }
        } catch (DataAccessException e) {
            log.error("Error releasing sync lock for principal {}: {}", principalId, e.getMessage(), e);
        }
    }

    /**
     * Identifies this instance: the platform instance id, the hostname, or a JVM-derived fallback.
     */
    public String getNodeId() {
        String nodeId = System.getenv("FLY_APP_INSTANCE_ID");
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getenv("HOSTNAME");
        }
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getProperty("user.name") + "-" + System.getProperty("java.vm.name");
        }
        return nodeId;
    }
}
