package com.jobsearch.entity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * JPA Entity - таблица "job_posts" в PostgreSQL.
 *
 * Схема принадлежит базе (ddl-auto: none), маппинг только описывает её:
 * - id (PRIMARY KEY)
 * - datetime_pulled (TIMESTAMP) - когда вакансия была выгружена
 * - organization_id -> organizations.id
 * - job_posts_tech (job_post_id, tech_id) -> tech
 * - job_posts_job_functions (job_post_id, job_function_id) -> job_functions
 *
 * Поисковый SQL строит {@code QueryCompiler}, имена таблиц и колонок должны совпадать.
 */
@Data
@Entity
@Table(name = "job_posts")
public class JobPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "datetime_pulled", nullable = false)
    private LocalDateTime datetimePulled;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Organization organization;

    @ManyToMany
    @JoinTable(
        name = "job_posts_tech",
        joinColumns = @JoinColumn(name = "job_post_id"),
        inverseJoinColumns = @JoinColumn(name = "tech_id"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<Technology> technologies = new ArrayList<>();

    @ManyToMany
    @JoinTable(
        name = "job_posts_job_functions",
        joinColumns = @JoinColumn(name = "job_post_id"),
        inverseJoinColumns = @JoinColumn(name = "job_function_id"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<JobFunction> jobFunctions = new ArrayList<>();
}
