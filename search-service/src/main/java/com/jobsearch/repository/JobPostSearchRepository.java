package com.jobsearch.repository;

import java.util.List;

import com.jobsearch.dto.JobPostHit;
import com.jobsearch.query.compiler.CompiledQuery;

public interface JobPostSearchRepository {

    /**
     * Выполняет скомпилированный поисковый запрос.
     *
     * @param query SQL с плейсхолдерами $1..$n и параметрами в том же порядке
     * @return строки результата в порядке, который вернула база
     */
    List<JobPostHit> search(CompiledQuery query);
}
