package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.keywords.KeywordEntry;
import com.delta.catalogcrawler.crawl.keywords.KeywordKind;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlSession;
import com.delta.catalogcrawler.crawl.model.CrawlSessionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class CatalogJdbcRepository implements PersistenceSink, CrawlLedger {
    private static final Logger log = LoggerFactory.getLogger(CatalogJdbcRepository.class);
    private static final TypeReference<LinkedHashMap<String, String>> LINK_MAP = new TypeReference<>() {};
    private static final int LOOKUP_BATCH_SIZE = 500;

    private static final String UPDATE_RECORD_SQL = """
        UPDATE catalog_records
        SET title = :title,
            detail_url = :detailUrl,
            image_url = COALESCE(:imageUrl, image_url),
            price = COALESCE(:price, price),
            currency = COALESCE(:currency, currency),
            brand = COALESCE(:brand, brand),
            category = COALESCE(:category, category),
            purchase_links = COALESCE(:purchaseLinks, purchase_links),
            purchase_platform = COALESCE(:purchasePlatform, purchase_platform)
        WHERE id = :id
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean upsert(CatalogRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("sourceId", record.sourceId())
            .addValue("title", record.title())
            .addValue("detailUrl", record.detailUrl())
            .addValue("imageUrl", record.imageUrl(), Types.VARCHAR)
            .addValue("price", record.price(), Types.DOUBLE)
            .addValue("currency", record.currency(), Types.VARCHAR)
            .addValue("brand", record.brand(), Types.VARCHAR)
            .addValue("category", record.category(), Types.VARCHAR)
            .addValue("purchaseLinks", record.hasPurchaseLinks() ? writeLinks(record.purchaseLinks()) : null, Types.VARCHAR)
            .addValue("purchasePlatform", record.purchasePlatform(), Types.VARCHAR)
            .addValue("capturedAt", toTimestamp(record.capturedAt() == null ? Instant.now() : record.capturedAt()));

        int updated = jdbc.update(UPDATE_RECORD_SQL, params);
        if (updated > 0) {
            return true;
        }
        try {
            return jdbc.update(
                """
                    INSERT INTO catalog_records (
                        id,
                        source_id,
                        title,
                        detail_url,
                        image_url,
                        price,
                        currency,
                        brand,
                        category,
                        purchase_links,
                        purchase_platform,
                        captured_at
                    )
                    VALUES (
                        :id,
                        :sourceId,
                        :title,
                        :detailUrl,
                        :imageUrl,
                        :price,
                        :currency,
                        :brand,
                        :category,
                        :purchaseLinks,
                        :purchasePlatform,
                        :capturedAt
                    )
                    """,
                params
            ) > 0;
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race with another pipeline writing the same id.
            return jdbc.update(UPDATE_RECORD_SQL, params) > 0;
        }
    }

    public Optional<CatalogRecord> findRecord(String id) {
        List<CatalogRecord> rows = jdbc.query(
            """
                SELECT *
                FROM catalog_records
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            recordRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<CatalogRecord> findRecords(Collection<String> ids) {
        List<String> distinct = ids.stream().distinct().toList();
        List<CatalogRecord> out = new ArrayList<>(distinct.size());
        for (int start = 0; start < distinct.size(); start += LOOKUP_BATCH_SIZE) {
            List<String> batch = distinct.subList(start, Math.min(distinct.size(), start + LOOKUP_BATCH_SIZE));
            out.addAll(jdbc.query(
                """
                    SELECT *
                    FROM catalog_records
                    WHERE id IN (:ids)
                    """,
                new MapSqlParameterSource("ids", batch),
                recordRowMapper()
            ));
        }
        return out;
    }

    public long countRecords() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM catalog_records", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public Map<String, Map<String, String>> knownPurchaseLinks(String sourceId) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT id, purchase_links
                FROM catalog_records
                WHERE source_id = :sourceId
                  AND purchase_links IS NOT NULL
                """,
            new MapSqlParameterSource("sourceId", sourceId),
            rs -> {
                Map<String, String> links = readLinks(rs.getString("purchase_links"));
                if (!links.isEmpty()) {
                    out.put(rs.getString("id"), links);
                }
            }
        );
        return out;
    }

    @Override
    public long insertCrawlRun(Instant startedAt, int sourcesTotal) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", "RUNNING")
            .addValue("sourcesTotal", sourcesTotal);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (started_at, status, sources_total, sources_failed, records_found)
                VALUES (:startedAt, :status, :sourcesTotal, 0, 0)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert crawl run");
        }
        return key.longValue();
    }

    @Override
    public void completeCrawlRun(
        long crawlRunId,
        Instant finishedAt,
        String status,
        int sourcesFailed,
        int recordsFound,
        String notes
    ) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    sources_failed = :sourcesFailed,
                    records_found = :recordsFound,
                    notes = :notes
                WHERE id = :crawlRunId
                """,
            new MapSqlParameterSource()
                .addValue("crawlRunId", crawlRunId)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("status", status)
                .addValue("sourcesFailed", sourcesFailed)
                .addValue("recordsFound", recordsFound)
                .addValue("notes", truncate(notes, 2000))
        );
    }

    @Override
    public long openSession(Long crawlRunId, String sourceId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId, Types.BIGINT)
            .addValue("sourceId", sourceId)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", CrawlSessionStatus.RUNNING.code());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_sessions (crawl_run_id, source_id, started_at, pages_walked, records_found, status)
                VALUES (:crawlRunId, :sourceId, :startedAt, 0, 0, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to open crawl session for " + sourceId);
        }
        return key.longValue();
    }

    @Override
    public void closeSession(
        long sessionId,
        Instant completedAt,
        int pagesWalked,
        int recordsFound,
        CrawlSessionStatus status,
        String error
    ) {
        int updated = jdbc.update(
            """
                UPDATE crawl_sessions
                SET completed_at = :completedAt,
                    pages_walked = :pagesWalked,
                    records_found = :recordsFound,
                    status = :status,
                    error = :error
                WHERE id = :sessionId
                  AND completed_at IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("sessionId", sessionId)
                .addValue("completedAt", toTimestamp(completedAt))
                .addValue("pagesWalked", pagesWalked)
                .addValue("recordsFound", recordsFound)
                .addValue("status", status.code())
                .addValue("error", truncate(error, 2000))
        );
        if (updated == 0) {
            log.warn("Crawl session {} was already closed; ignoring close as {}", sessionId, status.code());
        }
    }

    public Optional<CrawlSession> findSession(long sessionId) {
        List<CrawlSession> rows = jdbc.query(
            """
                SELECT *
                FROM crawl_sessions
                WHERE id = :sessionId
                """,
            new MapSqlParameterSource("sessionId", sessionId),
            sessionRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<CrawlSession> findRecentSessions(int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM crawl_sessions
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            sessionRowMapper()
        );
    }

    public List<KeywordEntry> findKeywordMappings(KeywordKind kind) {
        return jdbc.query(
            """
                SELECT keyword, mapped_value
                FROM keyword_mappings
                WHERE kind = :kind
                ORDER BY position, id
                """,
            new MapSqlParameterSource("kind", kind.code()),
            (rs, rowNum) -> new KeywordEntry(rs.getString("keyword"), rs.getString("mapped_value"))
        );
    }

    public void insertKeywordMapping(KeywordKind kind, String keyword, String value, int position) {
        jdbc.update(
            """
                INSERT INTO keyword_mappings (kind, keyword, mapped_value, position)
                VALUES (:kind, :keyword, :value, :position)
                """,
            new MapSqlParameterSource()
                .addValue("kind", kind.code())
                .addValue("keyword", keyword)
                .addValue("value", value)
                .addValue("position", position)
        );
    }

    private RowMapper<CatalogRecord> recordRowMapper() {
        return (rs, rowNum) -> {
            double price = rs.getDouble("price");
            Double boxedPrice = rs.wasNull() ? null : price;
            return new CatalogRecord(
                rs.getString("id"),
                rs.getString("source_id"),
                rs.getString("title"),
                rs.getString("detail_url"),
                rs.getString("image_url"),
                boxedPrice,
                rs.getString("currency"),
                rs.getString("brand"),
                rs.getString("category"),
                readLinks(rs.getString("purchase_links")),
                rs.getString("purchase_platform"),
                toInstant(rs.getTimestamp("captured_at"))
            );
        };
    }

    private RowMapper<CrawlSession> sessionRowMapper() {
        return (rs, rowNum) -> {
            long crawlRunId = rs.getLong("crawl_run_id");
            Long boxedRunId = rs.wasNull() ? null : crawlRunId;
            return new CrawlSession(
                rs.getLong("id"),
                boxedRunId,
                rs.getString("source_id"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getInt("pages_walked"),
                rs.getInt("records_found"),
                CrawlSessionStatus.fromCode(rs.getString("status")),
                rs.getString("error")
            );
        };
    }

    private String writeLinks(Map<String, String> links) {
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize purchase links", e);
        }
    }

    private Map<String, String> readLinks(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw, LINK_MAP);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed purchase_links value: {}", raw);
            return Map.of();
        }
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
