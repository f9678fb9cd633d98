package strokeseg.orchestrator.store;

import java.sql.Timestamp;
import java.time.Instant;

final class JdbcSupport {
    private JdbcSupport() {}

    static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }
}
