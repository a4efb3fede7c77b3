package com.jobsearch.dto;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchResponse {

    String status;
    int count;
    List<JobPostHit> jobs;

    public static SearchResponse success(List<JobPostHit> jobs) {
        return SearchResponse.builder()
            .status("success")
            .count(jobs.size())
            .jobs(jobs)
            .build();
    }
}
