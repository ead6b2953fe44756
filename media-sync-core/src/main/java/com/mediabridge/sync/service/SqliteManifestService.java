/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mediabridge.sync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.File;

/**
 * Manifest stored in a SQLite database file in write-ahead-log mode.
 */
public class SqliteManifestService extends AbstractManifestService {
    private static final Logger log = LoggerFactory.getLogger(SqliteManifestService.class);

    public static final String JDBC_URL_BASE = "jdbc:sqlite:";
    public static final String MEMORY_URL = JDBC_URL_BASE + ":memory:";

    /**
     * in-memory manifest, lost on close
     */
    public static SqliteManifestService inMemory() {
        return new SqliteManifestService(MEMORY_URL);
    }

    private File dbFile;
    private final String jdbcUrl;
    private volatile boolean closed;

    public SqliteManifestService(File dbFile) {
        this(JDBC_URL_BASE + dbFile.toString());
        this.dbFile = dbFile;
        if ((!dbFile.exists() && dbFile.getParentFile() != null && !dbFile.getParentFile().canWrite())
                || (dbFile.exists() && !dbFile.canWrite()))
            throw new IllegalArgumentException("Cannot write to " + dbFile);
    }

    protected SqliteManifestService(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    @Override
    public synchronized void close() {
        try {
            if (!closed) ((SingleConnectionDataSource) getJdbcTemplate().getDataSource()).destroy();
        } catch (Throwable t) {
            log.warn("could not close data source", t);
        }
        closed = true;
        super.close();
    }

    @Override
    protected JdbcTemplate createJdbcTemplate() {
        SingleConnectionDataSource ds = new SingleConnectionDataSource();
        ds.setUrl(jdbcUrl);
        ds.setSuppressClose(true);
        return new JdbcTemplate(ds);
    }

    @Override
    protected void createTable() {
        JdbcTemplate template = getJdbcTemplate();
        template.execute("PRAGMA journal_mode=WAL");
        template.execute("PRAGMA synchronous=NORMAL");
        try {
            template.update("CREATE TABLE IF NOT EXISTS " + tableName + " (" +
                    "key TEXT PRIMARY KEY NOT NULL," +
                    "relPath TEXT NOT NULL," +
                    "signature TEXT NOT NULL," +
                    "size INTEGER NOT NULL," +
                    "mtime REAL NOT NULL," +
                    "lastSeenRunId TEXT NOT NULL," +
                    "deletedAt REAL NULL" +
                    ")");
            template.update("CREATE INDEX IF NOT EXISTS idx_" + tableName + "_lastSeenRunId ON "
                    + tableName + " (lastSeenRunId)");
        } catch (RuntimeException e) {
            log.error("could not create manifest table {} in {}", tableName, jdbcUrl);
            throw e;
        }
    }

    @Override
    protected String upsertSql() {
        return "INSERT INTO " + tableName + " (key, relPath, signature, size, mtime, lastSeenRunId, deletedAt) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(key) DO UPDATE SET relPath = excluded.relPath, signature = excluded.signature, " +
                "size = excluded.size, mtime = excluded.mtime, lastSeenRunId = excluded.lastSeenRunId, " +
                "deletedAt = excluded.deletedAt";
    }

    public File getDbFile() {
        return dbFile;
    }
}
