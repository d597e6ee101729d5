package com.deerbot.db;

import com.deerbot.server.ai.snapshot.ChainSnapshot;
import com.deerbot.util.SnapshotCodec;

import java.io.IOException;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class ChainSnapshotDao {

    private final String dbPath;

    public ChainSnapshotDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<ChainSnapshot> loadSnapshot(String language) throws SQLException, IOException {
        String sql = "SELECT snapshot_blob FROM chain_snapshot WHERE language = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    byte[] blob = rs.getBytes("snapshot_blob");
                    return Optional.ofNullable(SnapshotCodec.fromBytes(blob));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertSnapshot(String language, ChainSnapshot snapshot) throws SQLException, IOException {
        byte[] blob = SnapshotCodec.toBytes(snapshot);
        try (Connection conn = connect()) {
            upsertSnapshot(conn, language, snapshot.order, blob);
        }
    }

    /**
     * Stores the snapshot and marks its sources as analyzed in one
     * transaction. Either both land or neither does.
     */
    public void saveCorpus(String language, ChainSnapshot snapshot, Collection<String> sources)
            throws SQLException, IOException {
        byte[] blob = SnapshotCodec.toBytes(snapshot);
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                upsertSnapshot(conn, language, snapshot.order, blob);
                for (String source : sources) {
                    AnalyzedSourceDao.markAnalyzed(conn, language, source);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private static void upsertSnapshot(Connection conn, String language, int order, byte[] blob)
            throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO chain_snapshot (language, chain_order, snapshot_blob, created_ts) " +
                "VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(language) DO UPDATE SET " +
                "chain_order = excluded.chain_order, snapshot_blob = excluded.snapshot_blob, " +
                "created_ts = excluded.created_ts";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            ps.setInt(2, order);
            ps.setBytes(3, blob);
            ps.setLong(4, now);
            ps.executeUpdate();
        }
    }

    public List<String> listLanguages() throws SQLException {
        List<String> languages = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement("SELECT language FROM chain_snapshot ORDER BY language");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                languages.add(rs.getString("language"));
            }
        }
        return languages;
    }

    public void deleteByLanguage(String language) throws SQLException {
        String sql = "DELETE FROM chain_snapshot WHERE language = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            ps.executeUpdate();
        }
    }
}
