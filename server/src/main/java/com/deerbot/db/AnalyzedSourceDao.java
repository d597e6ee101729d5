package com.deerbot.db;

import java.sql.*;
import java.util.LinkedHashSet;
import java.util.Set;

public class AnalyzedSourceDao {

    private final String dbPath;

    public AnalyzedSourceDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * @return true if the source was not recorded before
     */
    public boolean markAnalyzed(String language, String sourceId) throws SQLException {
        try (Connection conn = connect()) {
            return markAnalyzed(conn, language, sourceId);
        }
    }

    /**
     * Same as {@link #markAnalyzed(String, String)} on a caller-owned
     * connection, so it can join the caller's transaction.
     */
    static boolean markAnalyzed(Connection conn, String language, String sourceId) throws SQLException {
        String sql = "INSERT INTO analyzed_source (language, source_id, created_ts) VALUES (?, ?, ?) " +
                "ON CONFLICT(language, source_id) DO NOTHING";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            ps.setString(2, sourceId);
            ps.setLong(3, System.currentTimeMillis());
            return ps.executeUpdate() > 0;
        }
    }

    public Set<String> listSources(String language) throws SQLException {
        String sql = "SELECT source_id FROM analyzed_source WHERE language = ? ORDER BY id";
        Set<String> sources = new LinkedHashSet<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sources.add(rs.getString("source_id"));
                }
            }
        }
        return sources;
    }

    public void deleteByLanguage(String language) throws SQLException {
        String sql = "DELETE FROM analyzed_source WHERE language = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, language);
            ps.executeUpdate();
        }
    }
}
