package com.crossvenue.arb.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves city names, franchise names and ticker codes to one canonical team name per sport.
 * Ambiguous cities ("chicago", "los angeles") are only resolved when the sport is known.
 */
@Slf4j
public class TeamAliasResolver {

    public static final String DEFAULT_RESOURCE = "team-aliases.json";

    private final Map<String, Map<String, String>> bySport;

    public TeamAliasResolver(Map<String, Map<String, String>> bySport) {
        this.bySport = bySport;
    }

    public static TeamAliasResolver fromClasspath(ObjectMapper objectMapper) {
        return fromClasspath(objectMapper, DEFAULT_RESOURCE);
    }

    public static TeamAliasResolver fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = TeamAliasResolver.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Team alias resource {} not found, names will be compared as-is", resource);
                return new TeamAliasResolver(Map.of());
            }
            return fromJson(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + resource, e);
        }
    }

    static TeamAliasResolver fromJson(JsonNode root) {
        Map<String, Map<String, String>> sports = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> sport = fields.next();
            Map<String, String> aliases = new HashMap<>();
            for (JsonNode team : sport.getValue()) {
                String name = team.path("name").asText();
                aliases.put(normalize(name), name);
                for (JsonNode alias : team.path("aliases")) {
                    String previous = aliases.put(normalize(alias.asText()), name);
                    if (previous != null && !previous.equals(name)) {
                        log.warn("Alias '{}' maps to both {} and {} in {}", alias.asText(), previous, name, sport.getKey());
                    }
                }
            }
            sports.put(sport.getKey(), Map.copyOf(aliases));
        }
        log.info("Loaded team aliases for {} sports", sports.size());
        return new TeamAliasResolver(Map.copyOf(sports));
    }

    /**
     * @param sport sport key, or null to search every sport (only unambiguous hits resolve)
     */
    public Optional<String> resolve(String sport, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(raw);
        if (sport != null && bySport.containsKey(sport)) {
            return Optional.ofNullable(bySport.get(sport).get(key));
        }
        Set<String> hits = new HashSet<>();
        for (Map<String, String> aliases : bySport.values()) {
            String hit = aliases.get(key);
            if (hit != null) {
                hits.add(hit);
            }
        }
        return hits.size() == 1 ? Optional.of(hits.iterator().next()) : Optional.empty();
    }

    public String canonicalOrSelf(String sport, String raw) {
        return resolve(sport, raw).orElse(raw == null ? null : raw.trim());
    }

    public static String normalize(String s) {
        if (s == null) {
            return "";
        }
        String folded = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return folded.toLowerCase(Locale.ROOT)
                .replace('.', ' ')
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
