package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glossarymetrics.vacfetch.fetch.model.VacancyPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class VacancyPageParser {
    private static final Logger log = LoggerFactory.getLogger(VacancyPageParser.class);

    private final ObjectMapper objectMapper;

    public VacancyPageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public VacancyPage parse(String body, String sourceUrl) {
        if (body == null || body.isBlank()) {
            log.warn("Empty vacancy page body from {}", sourceUrl);
            return VacancyPage.EMPTY;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse vacancy page from {}", sourceUrl, e);
            return VacancyPage.EMPTY;
        }
        if (root == null || !root.isObject()) {
            log.warn("Vacancy page from {} is not a JSON object", sourceUrl);
            return VacancyPage.EMPTY;
        }
        int pages = readPages(root.get("pages"));
        if (pages < 0) {
            log.warn("Vacancy page from {} has missing or invalid pages field: {}", sourceUrl, root.get("pages"));
            return VacancyPage.EMPTY;
        }
        if (pages == 0) {
            return VacancyPage.EMPTY;
        }
        List<JsonNode> items = new ArrayList<>();
        JsonNode itemsNode = root.get("items");
        if (itemsNode != null && itemsNode.isArray()) {
            for (JsonNode item : itemsNode) {
                items.add(item);
            }
        }
        return new VacancyPage(items, pages);
    }

    private int readPages(JsonNode node) {
        if (node == null || node.isNull()) {
            return -1;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }
}
