package com.startsmart.rules;

import com.startsmart.core.NotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of rule tables keyed by table name ({@code grid}, then one per point-query category).
 */
public final class RuleBook {
    private static final Logger LOG = LogManager.getLogger(RuleBook.class);

    public static final String GRID_TABLE = "grid";

    private final Map<String, RuleTable> tables;

    public RuleBook(Map<String, RuleTable> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static RuleBook loadClasspath(String dir, Collection<String> tableNames) {
        RuleTableLoader loader = new RuleTableLoader();
        Map<String, RuleTable> tables = new LinkedHashMap<>();
        String prefix = dir == null || dir.isBlank() ? "" : dir.replaceAll("/+$", "") + "/";
        for (String name : tableNames) {
            RuleTable table = loader.loadResource(prefix + name + ".json");
            tables.put(name, table);
            LOG.info("loaded rule table {} ({} rules, base={})", name, table.rules.size(), table.baseScore);
        }
        return new RuleBook(tables);
    }

    public RuleTable table(String name) {
        RuleTable table = name == null ? null : tables.get(name);
        if (table == null) {
            throw new NotFoundException("no rule table for " + name);
        }
        return table;
    }

    public boolean has(String name) {
        return name != null && tables.containsKey(name);
    }

    public Set<String> names() {
        return tables.keySet();
    }
}
