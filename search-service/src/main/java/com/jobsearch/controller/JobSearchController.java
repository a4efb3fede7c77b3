package com.jobsearch.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jobsearch.dto.JobPostHit;
import com.jobsearch.dto.QueryNodeRequest;
import com.jobsearch.dto.SearchResponse;
import com.jobsearch.query.QueryNode;
import com.jobsearch.query.QueryTreeParser;
import com.jobsearch.service.JobSearchService;

import lombok.RequiredArgsConstructor;

/**
 * REST API поиска вакансий.
 *
 * Доступные endpoints:
 * - POST /api/v1/jobs/search?limit=10 - поиск по дереву запроса
 * - GET /api/v1/health - проверка, что сервис жив
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class JobSearchController {

    private final JobSearchService jobSearchService;
    private final QueryTreeParser queryTreeParser;

    /**
     * Поиск вакансий.
     *
     * Ожидает JSON:
     * {
     *   "type": "operator",
     *   "operator": "AND",
     *   "children": [
     *     {"type": "condition", "condition": {"field": "organization", "value": "apple"}},
     *     {"type": "condition", "condition": {"field": "technology", "value": ".net"}}
     *   ]
     * }
     *
     * Возвращает {"status": "success", "count": N, "jobs": [...]}.
     */
    @PostMapping("/jobs/search")
    public ResponseEntity<SearchResponse> searchJobs(
            @RequestBody QueryNodeRequest request,
            @RequestParam(name = "limit", defaultValue = "${jobsearch.default-limit:10}") int limit) {
        QueryNode tree = queryTreeParser.parse(request);
        List<JobPostHit> jobs = jobSearchService.search(tree, limit);
        return ResponseEntity.ok(SearchResponse.success(jobs));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
