package com.contentlib.ingest.pipeline.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
    private final List<Rule> rules;
    private final List<String> sitemapUrls;

    public RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
        this.rules = List.copyOf(rules);
        this.sitemapUrls = List.copyOf(sitemapUrls);
    }

    public static RobotsRules allowAll() {
        return new RobotsRules(List.of(), List.of());
    }

    public static RobotsRules disallowAll() {
        return new RobotsRules(List.of(new Rule("/", false)), List.of());
    }

    public List<String> getSitemapUrls() {
        return sitemapUrls;
    }

    public boolean isAllowed(String pathAndQuery) {
        if (rules.isEmpty()) {
            return true;
        }
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) {
                continue;
            }
            // longest match wins, allow breaks ties
            if (best == null
                || rule.path().length() > best.path().length()
                || (rule.path().length() == best.path().length() && rule.allow() && !best.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    public static RobotsRules parse(String robotsText) {
        return parse(robotsText, null);
    }

    public static RobotsRules parse(String robotsText, String agentToken) {
        if (robotsText == null || robotsText.isBlank()) {
            return allowAll();
        }
        String token = agentToken == null ? null : agentToken.toLowerCase(Locale.ROOT);
        List<String> sitemaps = new ArrayList<>();
        List<Rule> wildcardRules = new ArrayList<>();
        List<Rule> specificRules = new ArrayList<>();

        List<String> groupAgents = new ArrayList<>();
        boolean collectingAgents = false;
        for (String rawLine : robotsText.split("\\R")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (key) {
                case "user-agent" -> {
                    if (!collectingAgents) {
                        groupAgents.clear();
                    }
                    groupAgents.add(value.toLowerCase(Locale.ROOT));
                    collectingAgents = true;
                }
                case "sitemap" -> {
                    collectingAgents = false;
                    if (!value.isBlank()) {
                        sitemaps.add(value);
                    }
                }
                case "allow", "disallow" -> {
                    collectingAgents = false;
                    if (value.isBlank()) {
                        continue;
                    }
                    Rule rule = new Rule(value, "allow".equals(key));
                    if (token != null && groupAgents.stream().anyMatch(agent -> !agent.equals("*") && token.startsWith(agent))) {
                        specificRules.add(rule);
                    } else if (groupAgents.contains("*")) {
                        wildcardRules.add(rule);
                    }
                }
                default -> collectingAgents = false;
            }
        }
        return new RobotsRules(specificRules.isEmpty() ? wildcardRules : specificRules, sitemaps);
    }

    public record Rule(String path, boolean allow) {
        public boolean matches(String testPath) {
            String normalizedPath = path.startsWith("/") ? path : "/" + path;
            if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
                return testPath.startsWith(normalizedPath);
            }
            StringBuilder regex = new StringBuilder("^");
            for (char c : normalizedPath.toCharArray()) {
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '$') {
                    regex.append('$');
                } else {
                    regex.append(Pattern.quote(Character.toString(c)));
                }
            }
            return Pattern.compile(regex.toString()).matcher(testPath).find();
        }
    }
}
