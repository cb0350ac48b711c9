package com.startsmart.rules;

import com.startsmart.core.ConfigurationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses rule tables from JSON. Any structural problem is a {@link ConfigurationException}.
 */
public final class RuleTableLoader {

    public RuleTable loadResource(String resourcePath) {
        try (InputStream in = RuleTableLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ConfigurationException("rule table not found on classpath: " + resourcePath);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resourcePath);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read rule table " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    public RuleTable parse(String json, String source) {
        try {
            JSONObject root = new JSONObject(json);
            String name = root.getString("table").trim();
            double base = root.optDouble("base_score", RuleTable.DEFAULT_BASE_SCORE);
            if (!(base >= 0.0 && base <= 1.0)) {
                throw new ConfigurationException(source + ": base_score must be within [0,1]");
            }
            JSONArray rows = root.getJSONArray("rules");
            List<Rule> rules = new ArrayList<>(rows.length());
            Set<String> names = new HashSet<>();
            for (int i = 0; i < rows.length(); i++) {
                Rule rule = parseRule(rows.getJSONObject(i));
                if (!names.add(rule.name)) {
                    throw new ConfigurationException(source + ": duplicate rule name " + rule.name);
                }
                rules.add(rule);
            }
            return new RuleTable(name, base, rules);
        } catch (JSONException e) {
            throw new ConfigurationException(source + ": malformed rule table: " + e.getMessage(), e);
        }
    }

    private Rule parseRule(JSONObject o) {
        String name = o.getString("name").trim();
        if (name.isEmpty()) {
            throw new ConfigurationException("rule without a name");
        }
        RuleCondition condition = parseCondition(o.getJSONObject("when"), name);
        double delta = o.optDouble("delta", 0.0);
        Rule.Scale scale = null;
        JSONObject rawScale = o.optJSONObject("scale");
        if (rawScale != null) {
            scale = new Rule.Scale(
                    rawScale.getString("feature"),
                    rawScale.getDouble("weight"),
                    rawScale.optDouble("pivot", 0.0)
            );
        }
        String concern = o.has("concern") ? o.getString("concern") : null;
        return new Rule(name, condition, delta, scale, o.getString("reason"), concern);
    }

    RuleCondition parseCondition(JSONObject o, String ruleName) {
        if (o.optBoolean("always", false)) {
            return Conditions.always();
        }
        if (o.has("any")) {
            return Conditions.any(parseList(o.getJSONArray("any"), ruleName));
        }
        if (o.has("all")) {
            return Conditions.all(parseList(o.getJSONArray("all"), ruleName));
        }
        String feature = o.optString("feature", "").trim();
        if (feature.isEmpty()) {
            throw new ConfigurationException("rule " + ruleName + ": condition needs a feature, any, all or always");
        }
        if (o.optBoolean("present", false)) {
            return Conditions.present(feature);
        }
        if (o.optBoolean("absent", false)) {
            return Conditions.absent(feature);
        }
        if (o.has("between")) {
            JSONArray range = o.getJSONArray("between");
            if (range.length() != 2) {
                throw new ConfigurationException("rule " + ruleName + ": between needs [low, high]");
            }
            return Conditions.between(feature, range.getDouble(0), range.getDouble(1));
        }
        if (o.has("eq") && !(o.get("eq") instanceof Number)) {
            return Conditions.equalsText(feature, String.valueOf(o.get("eq")));
        }
        for (Conditions.Op op : Conditions.Op.values()) {
            if (op != Conditions.Op.BETWEEN && o.has(op.jsonKey())) {
                return Conditions.compare(feature, op, o.getDouble(op.jsonKey()));
            }
        }
        throw new ConfigurationException("rule " + ruleName + ": unsupported condition " + o);
    }

    private List<RuleCondition> parseList(JSONArray parts, String ruleName) {
        if (parts.isEmpty()) {
            throw new ConfigurationException("rule " + ruleName + ": empty any/all list");
        }
        List<RuleCondition> out = new ArrayList<>(parts.length());
        for (int i = 0; i < parts.length(); i++) {
            out.add(parseCondition(parts.getJSONObject(i), ruleName));
        }
        return out;
    }
}
