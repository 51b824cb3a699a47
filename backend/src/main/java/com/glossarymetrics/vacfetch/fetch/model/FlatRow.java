package com.glossarymetrics.vacfetch.fetch.model;

import java.util.Arrays;
import java.util.List;

public record FlatRow(
    String id,
    String name,
    String alternateUrl,
    String employerId,
    String employerName,
    String areaId,
    String areaName,
    String salaryFrom,
    String salaryTo,
    String salaryCurrency,
    String salaryGross,
    String publishedAt,
    String schedule,
    String employment,
    String requirement,
    String responsibility,
    String detailDescriptionHtml,
    String detailKeySkills,
    String detailProfessionalRoles
) {
    public static final List<String> COLUMNS = List.of(
        "id",
        "name",
        "alternate_url",
        "employer_id",
        "employer_name",
        "area_id",
        "area_name",
        "salary_from",
        "salary_to",
        "salary_currency",
        "salary_gross",
        "published_at",
        "schedule",
        "employment",
        "requirement",
        "responsibility",
        "detail_description_html",
        "detail_key_skills",
        "detail_professional_roles"
    );

    public List<String> values() {
        return Arrays.asList(
            id,
            name,
            alternateUrl,
            employerId,
            employerName,
            areaId,
            areaName,
            salaryFrom,
            salaryTo,
            salaryCurrency,
            salaryGross,
            publishedAt,
            schedule,
            employment,
            requirement,
            responsibility,
            detailDescriptionHtml,
            detailKeySkills,
            detailProfessionalRoles
        );
    }

    public boolean hasDetail() {
        return detailDescriptionHtml != null || detailKeySkills != null || detailProfessionalRoles != null;
    }
}
