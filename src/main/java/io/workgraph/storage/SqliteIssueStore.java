package io.workgraph.storage;

import io.workgraph.model.DependencyCategory;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueEvent;
import io.workgraph.model.IssueState;
import io.workgraph.model.IssueStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * SQLite-backed {@link IssueStore}. An unbound instance opens a connection per call;
 * {@link #inTransaction(Function)} hands the work a bound instance that shares one
 * connection inside a {@code BEGIN IMMEDIATE} transaction.
 */
public final class SqliteIssueStore implements IssueStore {
    private static final String ISSUE_COLUMNS = """
            id,title,description,issue_type,priority,status,assignee,defer_until_ms,notes,
            close_reason,verified,created_at_ms,updated_at_ms,closed_at_ms
            """;
    private static final String EDGE_COLUMNS = "from_id,to_id,type,created_at_ms,created_by,note";

    private final Database database;
    private final Connection bound;

    public SqliteIssueStore(Database database) {
        this(database, null);
    }

    private SqliteIssueStore(Database database, Connection bound) {
        this.database = database;
        this.bound = bound;
    }

    @Override
    public Optional<Issue> findIssue(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return withConnection("Failed to read issue " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + ISSUE_COLUMNS + " FROM issues WHERE id=?")) {
                ps.setString(1, id.trim());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(readIssue(c, rs));
                }
            }
        });
    }

    @Override
    public void insertIssue(Issue issue) {
        inTransaction(store -> ((SqliteIssueStore) store).withConnection("Failed to insert issue " + issue.id(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO issues(" + ISSUE_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?) ON CONFLICT(id) DO NOTHING")) {
                ps.setString(1, issue.id());
                ps.setString(2, issue.title());
                ps.setString(3, nullToEmpty(issue.description()));
                ps.setString(4, issue.issueType());
                ps.setInt(5, issue.priority());
                ps.setString(6, issue.status().wireName());
                setNullableString(ps, 7, normalizeAssignee(issue.assignee()));
                setNullableLong(ps, 8, issue.deferUntilMs());
                ps.setString(9, nullToEmpty(issue.notes()));
                setNullableString(ps, 10, issue.closeReason());
                setNullableString(ps, 11, issue.verified());
                ps.setLong(12, issue.createdAtMs());
                ps.setLong(13, issue.updatedAtMs());
                setNullableLong(ps, 14, issue.closedAtMs());
                if (ps.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Issue already exists: " + issue.id());
                }
            }
            writeLabels(c, issue.id(), issue.labels());
            return null;
        }));
    }

    @Override
    public boolean saveDetails(Issue issue) {
        return inTransaction(store -> ((SqliteIssueStore) store).withConnection("Failed to update issue " + issue.id(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE issues SET title=?,description=?,issue_type=?,priority=?,notes=?,updated_at_ms=? WHERE id=?")) {
                ps.setString(1, issue.title());
                ps.setString(2, nullToEmpty(issue.description()));
                ps.setString(3, issue.issueType());
                ps.setInt(4, issue.priority());
                ps.setString(5, nullToEmpty(issue.notes()));
                ps.setLong(6, issue.updatedAtMs());
                ps.setString(7, issue.id());
                if (ps.executeUpdate() == 0) {
                    return false;
                }
            }
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM labels WHERE issue_id=?")) {
                ps.setString(1, issue.id());
                ps.executeUpdate();
            }
            writeLabels(c, issue.id(), issue.labels());
            return true;
        }));
    }

    @Override
    public boolean compareAndSetState(String issueId, IssueStatus expectedStatus, String expectedAssignee,
                                      IssueState next, long nowMs) {
        return withConnection("Failed to update state of " + issueId, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE issues
                    SET status=?,assignee=?,defer_until_ms=?,closed_at_ms=?,close_reason=?,verified=?,updated_at_ms=?
                    WHERE id=? AND status=? AND assignee IS ?
                    """)) {
                ps.setString(1, next.status().wireName());
                setNullableString(ps, 2, normalizeAssignee(next.assignee()));
                setNullableLong(ps, 3, next.deferUntilMs());
                setNullableLong(ps, 4, next.closedAtMs());
                setNullableString(ps, 5, next.closeReason());
                setNullableString(ps, 6, next.verified());
                ps.setLong(7, nowMs);
                ps.setString(8, issueId);
                ps.setString(9, expectedStatus.wireName());
                setNullableString(ps, 10, normalizeAssignee(expectedAssignee));
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean deleteIssue(String issueId) {
        return withConnection("Failed to delete issue " + issueId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM issues WHERE id=?")) {
                ps.setString(1, issueId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<Issue> queryIssues(IssueQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(ISSUE_COLUMNS).append(" FROM issues WHERE status IN (");
        List<IssueStatus> statuses = new ArrayList<>(query.statuses());
        for (int i = 0; i < statuses.size(); i++) {
            sql.append(i == 0 ? "?" : ",?");
        }
        sql.append(')');
        if (query.assignee() != null) {
            sql.append(" AND assignee=?");
        }
        if (query.label() != null) {
            sql.append(" AND EXISTS (SELECT 1 FROM labels l WHERE l.issue_id=issues.id AND l.label=?)");
        }
        switch (query.deferral()) {
            case NOT_DEFERRED -> sql.append(" AND (defer_until_ms IS NULL OR defer_until_ms <= ?)");
            case DEFERRED -> sql.append(" AND defer_until_ms IS NOT NULL AND defer_until_ms > ?");
            case ANY -> {
            }
        }
        sql.append(" ORDER BY priority ASC, created_at_ms ASC, rowid ASC");
        if (query.limit() > 0) {
            sql.append(" LIMIT ?");
        }
        return withConnection("Failed to query issues", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int idx = 1;
                for (IssueStatus status : statuses) {
                    ps.setString(idx++, status.wireName());
                }
                if (query.assignee() != null) {
                    ps.setString(idx++, query.assignee());
                }
                if (query.label() != null) {
                    ps.setString(idx++, query.label());
                }
                if (query.deferral() != IssueQuery.Deferral.ANY) {
                    ps.setLong(idx++, query.atMs());
                }
                if (query.limit() > 0) {
                    ps.setInt(idx, query.limit());
                }
                List<Issue> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(readIssue(c, rs));
                    }
                }
                return out;
            }
        });
    }

    @Override
    public List<DependencyEdge> edgesFrom(String issueId) {
        return queryEdges("SELECT " + EDGE_COLUMNS + " FROM dependencies WHERE from_id=? ORDER BY to_id ASC, type ASC",
                issueId);
    }

    @Override
    public List<DependencyEdge> edgesTo(String issueId) {
        return queryEdges("SELECT " + EDGE_COLUMNS + " FROM dependencies WHERE to_id=? ORDER BY from_id ASC, type ASC",
                issueId);
    }

    @Override
    public List<DependencyEdge> edgesByCategory(DependencyCategory category) {
        List<String> types = new ArrayList<>();
        for (DependencyType type : DependencyType.values()) {
            if (type.category() == category) {
                types.add(type.wireName());
            }
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(EDGE_COLUMNS).append(" FROM dependencies WHERE type IN (");
        for (int i = 0; i < types.size(); i++) {
            sql.append(i == 0 ? "?" : ",?");
        }
        sql.append(") ORDER BY from_id ASC, to_id ASC, type ASC");
        return withConnection("Failed to list " + category.name().toLowerCase() + " edges", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < types.size(); i++) {
                    ps.setString(i + 1, types.get(i));
                }
                return readEdges(ps);
            }
        });
    }

    @Override
    public boolean insertEdgeIfAbsent(DependencyEdge edge) {
        return withConnection("Failed to insert dependency " + edge.key(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO dependencies(" + EDGE_COLUMNS + ") VALUES(?,?,?,?,?,?) "
                            + "ON CONFLICT(from_id,to_id,type) DO NOTHING")) {
                ps.setString(1, edge.fromId());
                ps.setString(2, edge.toId());
                ps.setString(3, edge.type().wireName());
                ps.setLong(4, edge.createdAtMs());
                ps.setString(5, nullToEmpty(edge.createdBy()));
                setNullableString(ps, 6, edge.note());
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean deleteEdge(String fromId, String toId, DependencyType type) {
        return withConnection("Failed to delete dependency " + fromId + " -> " + toId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM dependencies WHERE from_id=? AND to_id=? AND type=?")) {
                ps.setString(1, fromId);
                ps.setString(2, toId);
                ps.setString(3, type.wireName());
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public void appendEvent(IssueEvent event) {
        withConnection("Failed to append event for " + event.issueId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO events(issue_id,event_type,actor,old_value,new_value,comment,created_at_ms) VALUES(?,?,?,?,?,?,?)")) {
                ps.setString(1, event.issueId());
                ps.setString(2, event.eventType());
                ps.setString(3, nullToEmpty(event.actor()));
                setNullableString(ps, 4, event.oldValue());
                setNullableString(ps, 5, event.newValue());
                setNullableString(ps, 6, event.comment());
                ps.setLong(7, event.createdAtMs());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<IssueEvent> events(String issueId, int limit) {
        int safeLimit = limit <= 0 ? Integer.MAX_VALUE : limit;
        return withConnection("Failed to read events for " + issueId, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT id,issue_id,event_type,actor,old_value,new_value,comment,created_at_ms FROM (
                        SELECT * FROM events WHERE issue_id=? ORDER BY id DESC LIMIT ?
                    ) ORDER BY id ASC
                    """)) {
                ps.setString(1, issueId);
                ps.setInt(2, safeLimit);
                List<IssueEvent> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new IssueEvent(
                                rs.getLong("id"),
                                rs.getString("issue_id"),
                                rs.getString("event_type"),
                                rs.getString("actor"),
                                rs.getString("old_value"),
                                rs.getString("new_value"),
                                rs.getString("comment"),
                                rs.getLong("created_at_ms")
                        ));
                    }
                }
                return out;
            }
        });
    }

    @Override
    public String nextChildId(String parentId) {
        return inTransaction(store -> ((SqliteIssueStore) store).withConnection("Failed to allocate child id of " + parentId, c -> {
            while (true) {
                int n;
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO child_counters(parent_id,last_child) VALUES(?,1)
                        ON CONFLICT(parent_id) DO UPDATE SET last_child=last_child+1
                        """)) {
                    ps.setString(1, parentId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement("SELECT last_child FROM child_counters WHERE parent_id=?")) {
                    ps.setString(1, parentId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new IllegalStateException("Child counter missing for " + parentId);
                        }
                        n = rs.getInt(1);
                    }
                }
                String candidate = parentId + "." + n;
                // Skip numbers taken by issues created with an explicit id.
                if (!existsIssue(c, candidate)) {
                    return candidate;
                }
            }
        }));
    }

    @Override
    public <T> T inTransaction(Function<IssueStore, T> work) {
        if (bound != null) {
            return work.apply(this);
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.apply(new SqliteIssueStore(database, c));
                c.commit();
                return out;
            } catch (RuntimeException e) {
                rollback(c, e);
                throw e;
            } catch (SQLException e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw Database.translate("Failed to run transaction", e);
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private <T> T withConnection(String failure, SqlWork<T> work) {
        if (bound != null) {
            try {
                return work.run(bound);
            } catch (SQLException e) {
                throw Database.translate(failure, e);
            }
        }
        try (Connection c = database.openConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw Database.translate(failure, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    private List<DependencyEdge> queryEdges(String sql, String issueId) {
        return withConnection("Failed to read dependencies of " + issueId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, issueId);
                return readEdges(ps);
            }
        });
    }

    private static List<DependencyEdge> readEdges(PreparedStatement ps) throws SQLException {
        List<DependencyEdge> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new DependencyEdge(
                        rs.getString("from_id"),
                        rs.getString("to_id"),
                        DependencyType.fromString(rs.getString("type")),
                        rs.getLong("created_at_ms"),
                        rs.getString("created_by"),
                        rs.getString("note")
                ));
            }
        }
        return out;
    }

    private static Issue readIssue(Connection c, ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return new Issue(
                id,
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("issue_type"),
                rs.getInt("priority"),
                IssueStatus.fromString(rs.getString("status")),
                rs.getString("assignee"),
                getNullableLong(rs, "defer_until_ms"),
                rs.getString("notes"),
                readLabels(c, id),
                rs.getString("close_reason"),
                rs.getString("verified"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                getNullableLong(rs, "closed_at_ms")
        );
    }

    private static List<String> readLabels(Connection c, String issueId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT label FROM labels WHERE issue_id=? ORDER BY label ASC")) {
            ps.setString(1, issueId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    private static void writeLabels(Connection c, String issueId, List<String> labels) throws SQLException {
        if (labels == null || labels.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO labels(issue_id,label) VALUES(?,?) ON CONFLICT(issue_id,label) DO NOTHING")) {
            for (String label : labels) {
                ps.setString(1, issueId);
                ps.setString(2, label);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static boolean existsIssue(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM issues WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.BIGINT);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    private static String normalizeAssignee(String assignee) {
        return assignee == null || assignee.isBlank() ? null : assignee.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
