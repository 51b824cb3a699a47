package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.glossarymetrics.vacfetch.fetch.model.FlatRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class VacancyRowMapper {
    private static final String LIST_SEPARATOR = ", ";

    public FlatRow toRow(JsonNode vacancy, JsonNode detail) {
        JsonNode salary = vacancy.path("salary");
        JsonNode employer = vacancy.path("employer");
        JsonNode area = vacancy.path("area");
        JsonNode snippet = vacancy.path("snippet");

        String description = null;
        String keySkills = null;
        String professionalRoles = null;
        if (detail != null && detail.isObject()) {
            description = text(detail.path("description"));
            keySkills = joinNames(detail.path("key_skills"));
            professionalRoles = joinNames(detail.path("professional_roles"));
        }

        return new FlatRow(
            text(vacancy.path("id")),
            text(vacancy.path("name")),
            text(vacancy.path("alternate_url")),
            text(employer.path("id")),
            text(employer.path("name")),
            text(area.path("id")),
            text(area.path("name")),
            text(salary.path("from")),
            text(salary.path("to")),
            text(salary.path("currency")),
            text(salary.path("gross")),
            text(vacancy.path("published_at")),
            text(vacancy.path("schedule").path("name")),
            text(vacancy.path("employment").path("name")),
            text(snippet.path("requirement")),
            text(snippet.path("responsibility")),
            description,
            keySkills,
            professionalRoles
        );
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private String joinNames(JsonNode array) {
        if (array == null || !array.isArray()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (JsonNode element : array) {
            String name = text(element.path("name"));
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return String.join(LIST_SEPARATOR, names);
    }
}
