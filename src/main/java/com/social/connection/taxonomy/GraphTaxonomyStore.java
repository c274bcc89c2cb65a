package com.social.connection.taxonomy;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.RelationCategory;
import com.social.connection.core.model.SubRelationRule;
import com.social.connection.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Graph-backed implementation of {@link TaxonomyStore}.
 *
 * <p>Stores {@code (:RelationCategory)-[:HAS_SUB_RELATION]->(:SubRelation)} nodes.
 * Lower-cased {@code nameKey} properties carry the case-insensitive keys, and a
 * {@code seq} property keeps seed order so ambiguous lookups stay deterministic.</p>
 */
public class GraphTaxonomyStore implements TaxonomyStore {
    private static final Logger log = LoggerFactory.getLogger(GraphTaxonomyStore.class);

    private static final String MATCH_RULES = "MATCH (rc:RelationCategory)-[:HAS_SUB_RELATION]->(r:SubRelation)\n";

    private static final String RETURN_RULE = """
            RETURN rc.name as category, r.name as name, r.directionality as directionality,
                   r.approvalRequired as approvalRequired, r.reverseLabel as reverseLabel,
                   r.defaultBucket as defaultBucket
            """;

    private final GraphConnection connection;

    public GraphTaxonomyStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<SubRelationRule> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String query = MATCH_RULES
                + "WHERE r.nameKey = $nameKey\n"
                + RETURN_RULE
                + "ORDER BY r.seq ASC LIMIT 1";
        List<Map<String, Object>> rows = connection.query(query, Map.of("nameKey", key(name)));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToRule(rows.get(0)));
    }

    @Override
    public SeedResult seed(Collection<TaxonomyEntry> entries) {
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        long nextSeq = countRules();

        for (TaxonomyEntry entry : entries) {
            SubRelationRule rule = entry.toRule();
            Optional<SubRelationRule> existing = find(rule.getCategory().name(), rule.getName());
            if (existing.isPresent()) {
                SubRelationRule current = existing.get();
                SubRelationRule candidate = rule.toBuilder()
                        .category(current.getCategory())
                        .name(current.getName())
                        .build();
                if (current.equals(candidate)) {
                    unchanged++;
                    continue;
                }
                updateRule(candidate);
                updated++;
            } else {
                insertRule(rule, nextSeq++);
                inserted++;
            }
        }
        log.info("taxonomy.seeded graph={} inserted={} updated={} unchanged={}",
                connection.getGraphName(), inserted, updated, unchanged);
        return new SeedResult(inserted, updated, unchanged);
    }

    @Override
    public List<RelationCategory> categories() {
        String query = """
                MATCH (rc:RelationCategory)-[:HAS_SUB_RELATION]->(r:SubRelation)
                WITH rc, min(r.seq) as firstSeq
                RETURN rc.name as name
                ORDER BY firstSeq ASC
                """;
        return connection.query(query, Map.of()).stream()
                .map(row -> new RelationCategory((String) row.get("name")))
                .collect(Collectors.toList());
    }

    @Override
    public List<SubRelationRule> rulesOf(String categoryName) {
        String query = MATCH_RULES
                + "WHERE rc.nameKey = $categoryKey\n"
                + RETURN_RULE
                + "ORDER BY r.seq ASC";
        return connection.query(query, Map.of("categoryKey", key(categoryName))).stream()
                .map(this::mapToRule)
                .collect(Collectors.toList());
    }

    @Override
    public List<SubRelationRule> allRules() {
        String query = MATCH_RULES + RETURN_RULE + "ORDER BY r.seq ASC";
        return connection.query(query, Map.of()).stream()
                .map(this::mapToRule)
                .collect(Collectors.toList());
    }

    private Optional<SubRelationRule> find(String categoryName, String name) {
        String query = MATCH_RULES
                + "WHERE rc.nameKey = $categoryKey AND r.nameKey = $nameKey\n"
                + RETURN_RULE;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "categoryKey", key(categoryName),
                "nameKey", key(name)));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToRule(rows.get(0)));
    }

    private long countRules() {
        List<Map<String, Object>> rows = connection.query("MATCH (r:SubRelation) RETURN count(r) as cnt", Map.of());
        if (rows.isEmpty()) {
            return 0;
        }
        Object cnt = rows.get(0).get("cnt");
        return cnt instanceof Number n ? n.longValue() : 0;
    }

    private void insertRule(SubRelationRule rule, long seq) {
        String query = """
                MERGE (rc:RelationCategory {nameKey: $categoryKey})
                ON CREATE SET rc.name = $category
                CREATE (r:SubRelation {
                    name: $name,
                    nameKey: $nameKey,
                    categoryKey: $categoryKey,
                    directionality: $directionality,
                    approvalRequired: $approvalRequired,
                    reverseLabel: $reverseLabel,
                    defaultBucket: $defaultBucket,
                    seq: $seq
                })
                CREATE (rc)-[:HAS_SUB_RELATION]->(r)
                """;
        Map<String, Object> params = ruleParams(rule);
        params.put("category", rule.getCategory().name());
        params.put("name", rule.getName());
        params.put("seq", seq);
        connection.execute(query, params);
        log.debug("Inserted sub-relation {} in {}", rule.getName(), rule.getCategory().name());
    }

    private void updateRule(SubRelationRule rule) {
        String query = """
                MATCH (rc:RelationCategory)-[:HAS_SUB_RELATION]->(r:SubRelation)
                WHERE rc.nameKey = $categoryKey AND r.nameKey = $nameKey
                SET r.directionality = $directionality,
                    r.approvalRequired = $approvalRequired,
                    r.reverseLabel = $reverseLabel,
                    r.defaultBucket = $defaultBucket
                """;
        connection.execute(query, ruleParams(rule));
        log.debug("Updated sub-relation {} in {}", rule.getName(), rule.getCategory().name());
    }

    private Map<String, Object> ruleParams(SubRelationRule rule) {
        Map<String, Object> params = new HashMap<>();
        params.put("categoryKey", key(rule.getCategory().name()));
        params.put("nameKey", key(rule.getName()));
        params.put("directionality", rule.getDirectionality().label());
        params.put("approvalRequired", rule.isApprovalRequired());
        params.put("reverseLabel", rule.getReverseLabel());
        params.put("defaultBucket", rule.getDefaultBucket().map(BucketType::label).orElse(""));
        return params;
    }

    private SubRelationRule mapToRule(Map<String, Object> row) {
        Object approval = row.get("approvalRequired");
        return SubRelationRule.builder()
                .category((String) row.get("category"))
                .name((String) row.get("name"))
                .directionality(Directionality.fromLabel((String) row.get("directionality")))
                .approvalRequired(!(approval instanceof Boolean b) || b)
                .reverseLabel((String) row.get("reverseLabel"))
                .defaultBucket(BucketType.parse((String) row.get("defaultBucket")))
                .build();
    }

    private static String key(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
