package com.psl.search.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Date;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PaperRepository {
    static final String COLUMNS = "id, title, abstract, authors_json, doi, arxiv_id, provider, provider_id, "
        + "publication_date, publication_year, venue, citation_count, pdf_url, category, is_processed";
    private static final String HYBRID_SCORE = "(? * (1 - (embedding <=> CAST(? AS vector))) "
        + "+ ? * (CASE WHEN title ILIKE ? OR abstract ILIKE ? THEN 1 ELSE 0 END))";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PaperRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public PaperRecord findByDoi(String normalizedDoi) {
        if (normalizedDoi == null) {
            return null;
        }
        return first(jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM papers WHERE lower(doi) = ? LIMIT 1",
            normalizedDoi
        ));
    }

    public PaperRecord findByProviderId(String provider, String providerId) {
        if (provider == null || providerId == null) {
            return null;
        }
        return first(jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM papers WHERE provider = ? AND provider_id = ? LIMIT 1",
            provider,
            providerId
        ));
    }

    public PaperRecord findByNormalizedTitle(String normalizedTitle) {
        if (normalizedTitle == null || normalizedTitle.isEmpty()) {
            return null;
        }
        return first(jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM papers WHERE normalized_title = ? LIMIT 1",
            normalizedTitle
        ));
    }

    /**
     * Inserts the record unless any unique identity (DOI, provider id, normalized title) already exists.
     *
     * @return the new id, or null when a concurrent writer won the race
     */
    public Long insertIfAbsent(PaperRecord record, String normalizedTitle) {
        List<Long> ids = jdbcTemplate.queryForList(
            "INSERT INTO papers (title, normalized_title, abstract, authors_json, doi, arxiv_id, provider, provider_id, "
                + "publication_date, publication_year, venue, citation_count, pdf_url, category, is_processed) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE) "
                + "ON CONFLICT DO NOTHING RETURNING id",
            Long.class,
            record.getTitle(),
            normalizedTitle,
            record.getAbstractText(),
            writeAuthors(record.getAuthors()),
            record.getDoi(),
            record.getArxivId(),
            record.getProvider(),
            record.getProviderId(),
            toSqlDate(record.getPublicationDate()),
            record.getPublicationYear(),
            record.getVenue(),
            record.getCitationCount(),
            record.getPdfUrl(),
            record.getCategory()
        );
        return ids.isEmpty() ? null : ids.get(0);
    }

    public int fillMissingFields(long id, PaperRecord observed) {
        return jdbcTemplate.update(
            "UPDATE papers SET "
                + "abstract = COALESCE(NULLIF(abstract, ''), ?), "
                + "authors_json = CASE WHEN authors_json = '[]' THEN ? ELSE authors_json END, "
                + "doi = COALESCE(doi, ?), "
                + "arxiv_id = COALESCE(arxiv_id, ?), "
                + "publication_date = COALESCE(publication_date, ?), "
                + "publication_year = COALESCE(publication_year, ?), "
                + "venue = COALESCE(venue, ?), "
                + "pdf_url = COALESCE(pdf_url, ?), "
                + "citation_count = GREATEST(citation_count, ?), "
                + "updated_at = now() "
                + "WHERE id = ?",
            observed.getAbstractText(),
            writeAuthors(observed.getAuthors()),
            observed.getDoi(),
            observed.getArxivId(),
            toSqlDate(observed.getPublicationDate()),
            observed.getPublicationYear(),
            observed.getVenue(),
            observed.getPdfUrl(),
            observed.getCitationCount(),
            id
        );
    }

    public List<PaperRecord> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>(ids);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM papers WHERE id IN (" + placeholders(ids.size()) + ") ORDER BY id",
            args.toArray()
        );
        List<PaperRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(toRecord(row));
        }
        return records;
    }

    /**
     * Hybrid similarity search over embedded rows; the score is computed in SQL with the given weights.
     */
    public List<ScoredRecord> hybridSearch(
        String vectorLiteral,
        String query,
        String category,
        double semanticWeight,
        double keywordWeight,
        double minScore,
        int limit
    ) {
        String pattern = likePattern(query);
        List<Object> args = new ArrayList<>();
        args.add(semanticWeight);
        args.add(vectorLiteral);
        args.add(keywordWeight);
        args.add(pattern);
        args.add(pattern);
        StringBuilder sql = new StringBuilder("SELECT * FROM (SELECT ")
            .append(COLUMNS)
            .append(", ")
            .append(HYBRID_SCORE)
            .append(" AS hybrid_score FROM papers WHERE embedding IS NOT NULL");
        if (category != null) {
            sql.append(" AND category = ?");
            args.add(category);
        }
        sql.append(") scored WHERE hybrid_score >= ? ORDER BY hybrid_score DESC, id ASC LIMIT ?");
        args.add(minScore);
        args.add(limit);

        List<ScoredRecord> results = new ArrayList<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), args.toArray())) {
            results.add(new ScoredRecord(toRecord(row), ((Number) row.get("hybrid_score")).doubleValue()));
        }
        return results;
    }

    public Map<Long, Double> indexScores(
        List<Long> ids,
        String vectorLiteral,
        String query,
        double semanticWeight,
        double keywordWeight
    ) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyMap();
        }
        String pattern = likePattern(query);
        List<Object> args = new ArrayList<>();
        args.add(semanticWeight);
        args.add(vectorLiteral);
        args.add(keywordWeight);
        args.add(pattern);
        args.add(pattern);
        args.addAll(ids);
        Map<Long, Double> scores = new LinkedHashMap<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(
            "SELECT id, " + HYBRID_SCORE + " AS hybrid_score FROM papers "
                + "WHERE embedding IS NOT NULL AND id IN (" + placeholders(ids.size()) + ")",
            args.toArray()
        )) {
            scores.put(((Number) row.get("id")).longValue(), ((Number) row.get("hybrid_score")).doubleValue());
        }
        return scores;
    }

    public List<Long> findUnembeddedIds(List<Long> preferredIds, int limit) {
        List<Long> selected = new ArrayList<>();
        if (preferredIds != null && !preferredIds.isEmpty()) {
            selected.addAll(jdbcTemplate.queryForList(
                "SELECT id FROM papers WHERE embedding IS NULL AND id IN (" + placeholders(preferredIds.size())
                    + ") ORDER BY id LIMIT " + Math.max(0, limit),
                Long.class,
                preferredIds.toArray()
            ));
        }
        int remaining = limit - selected.size();
        if (remaining > 0) {
            for (Long id : jdbcTemplate.queryForList(
                "SELECT id FROM papers WHERE embedding IS NULL ORDER BY id LIMIT ?",
                Long.class,
                limit
            )) {
                if (selected.size() >= limit) {
                    break;
                }
                if (!selected.contains(id)) {
                    selected.add(id);
                }
            }
        }
        return selected;
    }

    public int[] updateEmbeddings(Map<Long, String> vectorLiteralsById) {
        List<Object[]> batch = new ArrayList<>();
        for (Map.Entry<Long, String> entry : vectorLiteralsById.entrySet()) {
            batch.add(new Object[] {entry.getValue(), entry.getKey()});
        }
        return jdbcTemplate.batchUpdate(
            "UPDATE papers SET embedding = CAST(? AS vector), is_processed = TRUE, embedded_at = now(), "
                + "updated_at = now() WHERE id = ?",
            batch
        );
    }

    public long countUnembedded() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM papers WHERE embedding IS NULL", Long.class);
        return count == null ? 0L : count;
    }

    PaperRecord toRecord(Map<String, Object> row) {
        PaperRecord record = new PaperRecord();
        record.setId(((Number) row.get("id")).longValue());
        record.setTitle((String) row.get("title"));
        record.setAbstractText((String) row.get("abstract"));
        record.setAuthors(readAuthors((String) row.get("authors_json")));
        record.setDoi((String) row.get("doi"));
        record.setArxivId((String) row.get("arxiv_id"));
        record.setProvider((String) row.get("provider"));
        record.setProviderId((String) row.get("provider_id"));
        Object date = row.get("publication_date");
        record.setPublicationDate(date == null ? null : date.toString());
        Object year = row.get("publication_year");
        record.setPublicationYear(year == null ? null : ((Number) year).intValue());
        record.setVenue((String) row.get("venue"));
        Object citations = row.get("citation_count");
        record.setCitationCount(citations == null ? 0 : ((Number) citations).intValue());
        record.setPdfUrl((String) row.get("pdf_url"));
        record.setCategory((String) row.get("category"));
        record.setEmbedded(Boolean.TRUE.equals(row.get("is_processed")));
        return record;
    }

    private PaperRecord first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? null : toRecord(rows.get(0));
    }

    private String writeAuthors(List<String> authors) {
        try {
            return objectMapper.writeValueAsString(authors == null ? List.of() : authors);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("authors not serializable", e);
        }
    }

    private List<String> readAuthors(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            return new ArrayList<>();
        }
    }

    static Date toSqlDate(String isoDate) {
        if (isoDate == null || isoDate.length() != 10) {
            return null;
        }
        try {
            return Date.valueOf(LocalDate.parse(isoDate));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String likePattern(String query) {
        String escaped = query == null ? "" : query.trim()
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }
}
