package com.foiarelay.directory.persistence;

import com.foiarelay.directory.model.CanonicalRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "directory.store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
public class DirectoryJdbcRepository implements DirectoryRepository {
    private static final Logger log = LoggerFactory.getLogger(DirectoryJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DirectoryJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public String backend() {
        return "jdbc";
    }

    @Override
    public List<CanonicalRecord> loadAll() {
        return jdbc.query(
            """
                SELECT unit_id, name, abbreviation, parent_agency_name, parent_abbreviation,
                       emails_json, website, postal_address, phone, foia_officer_name,
                       last_reconciled_at
                FROM agency_directory
                ORDER BY sort_order
                """,
            new MapSqlParameterSource(),
            recordMapper()
        );
    }

    @Override
    @Transactional
    public void replaceAll(List<CanonicalRecord> records) {
        int deleted = jdbc.update("DELETE FROM agency_directory", new MapSqlParameterSource());
        List<CanonicalRecord> safe = records == null ? List.of() : records;
        SqlParameterSource[] batch = new SqlParameterSource[safe.size()];
        for (int i = 0; i < safe.size(); i++) {
            batch[i] = toParams(safe.get(i), i);
        }
        if (batch.length > 0) {
            jdbc.batchUpdate(
                """
                    INSERT INTO agency_directory (
                        unit_id, sort_order, name, abbreviation, parent_agency_name, parent_abbreviation,
                        emails_json, website, postal_address, phone, foia_officer_name, last_reconciled_at
                    ) VALUES (
                        :unitId, :sortOrder, :name, :abbreviation, :parentAgencyName, :parentAbbreviation,
                        :emailsJson, :website, :postalAddress, :phone, :foiaOfficerName, :lastReconciledAt
                    )
                    """,
                batch
            );
        }
        log.info("Replaced agency directory: {} removed, {} written", deleted, batch.length);
    }

    public int count() {
        Integer total = jdbc.queryForObject("SELECT COUNT(*) FROM agency_directory", new MapSqlParameterSource(), Integer.class);
        return total == null ? 0 : total;
    }

    private SqlParameterSource toParams(CanonicalRecord record, int sortOrder) {
        return new MapSqlParameterSource()
            .addValue("unitId", record.unitId())
            .addValue("sortOrder", sortOrder)
            .addValue("name", nullToEmpty(record.name()))
            .addValue("abbreviation", nullToEmpty(record.abbreviation()))
            .addValue("parentAgencyName", nullToEmpty(record.parentAgencyName()))
            .addValue("parentAbbreviation", nullToEmpty(record.parentAbbreviation()))
            .addValue("emailsJson", writeEmails(record.emails()))
            .addValue("website", nullToEmpty(record.website()))
            .addValue("postalAddress", nullToEmpty(record.postalAddress()))
            .addValue("phone", nullToEmpty(record.phone()))
            .addValue("foiaOfficerName", nullToEmpty(record.foiaOfficerName()))
            .addValue("lastReconciledAt", Timestamp.from(
                record.lastReconciledAt() == null ? Instant.EPOCH : record.lastReconciledAt()
            ));
    }

    private RowMapper<CanonicalRecord> recordMapper() {
        return (rs, rowNum) -> {
            Timestamp reconciledAt = rs.getTimestamp("last_reconciled_at");
            return new CanonicalRecord(
                rs.getString("unit_id"),
                rs.getString("name"),
                rs.getString("abbreviation"),
                rs.getString("parent_agency_name"),
                rs.getString("parent_abbreviation"),
                readEmails(rs.getString("emails_json")),
                rs.getString("website"),
                rs.getString("postal_address"),
                rs.getString("phone"),
                rs.getString("foia_officer_name"),
                reconciledAt == null ? null : reconciledAt.toInstant()
            );
        };
    }

    private String writeEmails(List<String> emails) {
        try {
            return objectMapper.writeValueAsString(emails == null ? List.of() : emails);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize emails", e);
        }
    }

    private List<String> readEmails(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable emails column value '{}'; treating as empty", json);
            return List.of();
        }
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
