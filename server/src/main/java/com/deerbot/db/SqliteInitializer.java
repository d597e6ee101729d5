package com.deerbot.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One serialized chain per language
                stmt.execute("CREATE TABLE IF NOT EXISTS chain_snapshot (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "language TEXT NOT NULL UNIQUE, " +
                        "chain_order INTEGER NOT NULL, " +
                        "snapshot_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // Sources already fed into a language's chain
                stmt.execute("CREATE TABLE IF NOT EXISTS analyzed_source (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "language TEXT NOT NULL, " +
                        "source_id TEXT NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (language, source_id)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_source_lookup " +
                        "ON analyzed_source (language, source_id);");
            }
        }
    }
}
