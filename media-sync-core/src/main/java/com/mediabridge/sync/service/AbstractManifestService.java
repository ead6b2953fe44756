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
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * JDBC plumbing shared by manifest implementations. The template is created lazily on first use and every
 * statement runs under this instance's monitor, so writes are serialized.
 */
public abstract class AbstractManifestService implements ManifestService {
    private static final Logger log = LoggerFactory.getLogger(AbstractManifestService.class);

    public static final String DEFAULT_TABLE_NAME = "entries";

    protected String tableName = DEFAULT_TABLE_NAME;
    private JdbcTemplate jdbcTemplate;
    private volatile boolean initialized = false;

    protected abstract JdbcTemplate createJdbcTemplate();

    protected abstract void createTable();

    /**
     * dialect-specific insert-or-replace statement taking the seven entry columns in table order
     */
    protected abstract String upsertSql();

    @Override
    public synchronized ManifestEntry get(String key) {
        initCheck();
        try {
            return getJdbcTemplate().queryForObject("SELECT * FROM " + tableName + " WHERE key = ?", mapper(), key);
        } catch (IncorrectResultSizeDataAccessException e) {
            return null;
        }
    }

    @Override
    public synchronized void upsert(ManifestEntry entry) {
        initCheck();
        getJdbcTemplate().update(upsertSql(), entry.getKey(), entry.getRelPath(), entry.getSignature(), entry.getSize(),
                entry.getMtime(), entry.getLastSeenRunId(), entry.getDeletedAt());
    }

    @Override
    public synchronized void markDeleted(String key) {
        initCheck();
        int count = getJdbcTemplate().update("UPDATE " + tableName + " SET deletedAt = ? WHERE key = ?",
                System.currentTimeMillis() / 1000.0, key);
        if (count == 0) log.debug("no manifest entry to mark deleted for {}", key);
    }

    @Override
    public synchronized List<String> keysNotTouchedByRun(String runId) {
        initCheck();
        return getJdbcTemplate().queryForList(
                "SELECT key FROM " + tableName + " WHERE lastSeenRunId != ? AND deletedAt IS NULL", String.class, runId);
    }

    @Override
    public synchronized long countActive() {
        initCheck();
        Long count = getJdbcTemplate().queryForObject(
                "SELECT COUNT(*) FROM " + tableName + " WHERE deletedAt IS NULL", Long.class);
        return count == null ? 0 : count;
    }

    protected RowMapper<ManifestEntry> mapper() {
        return (rs, rowNum) -> {
            // wasNull() must directly follow the deletedAt read
            double deletedAtValue = rs.getDouble("deletedAt");
            Double deletedAt = rs.wasNull() ? null : deletedAtValue;
            return new ManifestEntry(rs.getString("key"), rs.getString("relPath"), rs.getString("signature"),
                    rs.getLong("size"), rs.getDouble("mtime"), rs.getString("lastSeenRunId"), deletedAt);
        };
    }

    protected void initCheck() {
        if (!initialized) {
            synchronized (this) {
                if (!initialized) {
                    jdbcTemplate = createJdbcTemplate();
                    createTable();
                    initialized = true;
                }
            }
        }
    }

    /**
     * Implementations should close their data source, then call super.close(). Must be idempotent.
     */
    @Override
    public synchronized void close() {
        jdbcTemplate = null;
    }

    protected JdbcTemplate getJdbcTemplate() {
        if (jdbcTemplate == null)
            throw new UnsupportedOperationException("this manifest is not initialized or has been closed");
        return jdbcTemplate;
    }

    public String getTableName() {
        return tableName;
    }
}
