package com.eventfilter.registry;

import com.eventfilter.filter.TeamContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 团队目录：从 JSON 文件读取各团队的时区、属性类型与 cohort，用于构建内存登记表。
 *
 * <pre>
 * {"teams": [{"id": 1, "timezone": "Europe/Berlin",
 *             "eventProperties": {"is_paid": "BOOLEAN"},
 *             "personProperties": {"email": "STRING"},
 *             "cohorts": [5, 8]}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamCatalog(List<Team> teams) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public TeamCatalog {
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(
        long id,
        String timezone,
        Map<String, PropertyType> eventProperties,
        Map<String, PropertyType> personProperties,
        List<Long> cohorts
    ) {
        public Team {
            timezone = timezone == null ? "UTC" : timezone;
            eventProperties = eventProperties == null ? Map.of() : Map.copyOf(eventProperties);
            personProperties = personProperties == null ? Map.of() : Map.copyOf(personProperties);
            cohorts = cohorts == null ? List.of() : List.copyOf(cohorts);
        }
    }

    public Optional<TeamContext> team(long teamId) {
        return teams.stream()
            .filter(team -> team.id() == teamId)
            .findFirst()
            .map(team -> TeamContext.of(team.id(), team.timezone()));
    }

    public InMemoryPropertyTypeRegistry propertyTypeRegistry() {
        InMemoryPropertyTypeRegistry.Builder builder = InMemoryPropertyTypeRegistry.builder();
        for (Team team : teams) {
            team.eventProperties().forEach((key, type) -> builder.eventProperty(team.id(), key, type));
            team.personProperties().forEach((key, type) -> builder.personProperty(team.id(), key, type));
        }
        return builder.build();
    }

    public InMemoryCohortStore cohortStore() {
        InMemoryCohortStore.Builder builder = InMemoryCohortStore.builder();
        for (Team team : teams) {
            for (Long cohortId : team.cohorts()) {
                builder.cohort(team.id(), cohortId);
            }
        }
        return builder.build();
    }

    public static TeamCatalog empty() {
        return new TeamCatalog(List.of());
    }

    /**
     * 从 JSON 文件读取团队目录。
     *
     * @param file 目录文件
     * @return 反序列化后的团队目录
     * @throws IOException 读取、解析失败或时区非法时抛出
     */
    public static TeamCatalog load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("目录文件不能为空");
        }
        TeamCatalog catalog;
        try {
            catalog = OBJECT_MAPPER.readValue(Files.readAllBytes(file), TeamCatalog.class);
        } catch (IOException exception) {
            throw new IOException("读取团队目录失败: " + file.toAbsolutePath(), exception);
        }
        for (Team team : catalog.teams()) {
            try {
                TeamContext.of(team.id(), team.timezone());
            } catch (DateTimeException exception) {
                throw new IOException("团队 " + team.id() + " 的时区非法: " + team.timezone(), exception);
            }
        }
        return catalog;
    }
}
