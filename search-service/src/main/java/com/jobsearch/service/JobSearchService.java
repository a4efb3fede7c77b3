package com.jobsearch.service;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.jobsearch.dto.JobPostHit;
import com.jobsearch.query.QueryNode;
import com.jobsearch.query.QueryValidationException;
import com.jobsearch.query.compiler.CompiledQuery;
import com.jobsearch.query.compiler.QueryCompiler;
import com.jobsearch.repository.JobPostRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Бизнес-логика поиска вакансий.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSearchService {

    private final QueryCompiler queryCompiler;
    private final JobPostRepository jobPostRepository;

    @Value("${jobsearch.max-limit:1000}")
    private int maxLimit;

    /**
     * Поиск вакансий по дереву запроса.
     *
     * Последовательность:
     * 1. Проверяем limit (компилятор вставляет его в SQL как есть)
     * 2. Компилируем дерево в SQL с параметрами $1..$n
     * 3. Выполняем запрос на соединении из пула
     *
     * @throws QueryValidationException некорректное дерево или limit -> HTTP 400
     * @throws SearchExecutionException ошибка базы -> HTTP 500
     */
    public List<JobPostHit> search(QueryNode tree, int limit) {
        if (limit < 1 || limit > maxLimit) {
            throw new QueryValidationException("limit must be between 1 and " + maxLimit + ", got " + limit);
        }

        CompiledQuery compiled = queryCompiler.compile(tree, limit);
        log.debug("Compiled search statement: {}", compiled.getStatement());

        List<JobPostHit> jobs;
        try {
            jobs = jobPostRepository.search(compiled);
        } catch (RuntimeException e) {
            log.error("Search execution failed for statement {}", compiled.getStatement(), e);
            throw new SearchExecutionException("Search execution failed", e);
        }

        log.info("Search over fields {} with {} parameters and limit {} returned {} jobs",
            compiled.getRequiredFields(), compiled.getParameters().size(), limit, jobs.size());
        return jobs;
    }
}
