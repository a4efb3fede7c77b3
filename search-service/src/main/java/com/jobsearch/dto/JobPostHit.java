package com.jobsearch.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * Строка результата поиска: колонки jp.id и jp.datetime_pulled.
 */
@Value
public class JobPostHit {

    Long id;

    @JsonProperty("datetime_pulled")
    LocalDateTime datetimePulled;
}
