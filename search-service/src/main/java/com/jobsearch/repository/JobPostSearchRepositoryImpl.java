package com.jobsearch.repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.transaction.annotation.Transactional;

import com.jobsearch.dto.JobPostHit;
import com.jobsearch.query.compiler.CompiledQuery;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;

/**
 * Реализация {@link JobPostSearchRepository}, Spring Data подключает её по суффиксу Impl.
 *
 * Соединение берётся из пула HikariCP на время транзакции и возвращается
 * при её завершении, в том числе при ошибке.
 */
@Slf4j
public class JobPostSearchRepositoryImpl implements JobPostSearchRepository {

    // $1, $2, ... -> ?1, ?2, ... (позиционные параметры JPA)
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public List<JobPostHit> search(CompiledQuery query) {
        Query nativeQuery = entityManager.createNativeQuery(toOrdinalPlaceholders(query.getStatement()));

        List<String> parameters = query.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            nativeQuery.setParameter(i + 1, parameters.get(i));
        }

        List<?> rows = nativeQuery.getResultList();
        log.debug("Search statement returned {} rows", rows.size());
        return rows.stream()
            .map(row -> toHit((Object[]) row))
            .collect(Collectors.toList());
    }

    static String toOrdinalPlaceholders(String statement) {
        return PLACEHOLDER.matcher(statement).replaceAll("?$1");
    }

    private static JobPostHit toHit(Object[] row) {
        Long id = row[0] == null ? null : ((Number) row[0]).longValue();
        return new JobPostHit(id, toLocalDateTime(row[1]));
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        throw new IllegalStateException("Unsupported datetime_pulled type: " + value.getClass().getName());
    }
}
