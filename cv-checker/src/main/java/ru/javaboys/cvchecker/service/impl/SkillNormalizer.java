package ru.javaboys.cvchecker.service.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Brings skill names from job descriptions and résumés to one canonical spelling,
 * so that matching can be a plain equality check.
 */
public class SkillNormalizer {

    private static final Map<String, String> DEFAULT_ALIASES = Map.ofEntries(
            Map.entry("react.js", "React"),
            Map.entry("reactjs", "React"),
            Map.entry("react js", "React"),
            Map.entry("k8s", "Kubernetes"),
            Map.entry("kube", "Kubernetes"),
            Map.entry("node", "Node.js"),
            Map.entry("nodejs", "Node.js"),
            Map.entry("node js", "Node.js"),
            Map.entry("js", "JavaScript"),
            Map.entry("javascript", "JavaScript"),
            Map.entry("ecmascript", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("typescript", "TypeScript"),
            Map.entry("postgres", "PostgreSQL"),
            Map.entry("postgresql", "PostgreSQL"),
            Map.entry("psql", "PostgreSQL"),
            Map.entry("mysql", "MySQL"),
            Map.entry("mongo", "MongoDB"),
            Map.entry("mongodb", "MongoDB"),
            Map.entry("golang", "Go"),
            Map.entry("go", "Go"),
            Map.entry("python", "Python"),
            Map.entry("python3", "Python"),
            Map.entry("py", "Python"),
            Map.entry("java", "Java"),
            Map.entry("c#", "C#"),
            Map.entry("csharp", "C#"),
            Map.entry("c sharp", "C#"),
            Map.entry("c++", "C++"),
            Map.entry("cpp", "C++"),
            Map.entry(".net", ".NET"),
            Map.entry("dotnet", ".NET"),
            Map.entry("asp.net", "ASP.NET"),
            Map.entry("aws", "AWS"),
            Map.entry("amazon web services", "AWS"),
            Map.entry("azure", "Azure"),
            Map.entry("microsoft azure", "Azure"),
            Map.entry("gcp", "GCP"),
            Map.entry("google cloud", "GCP"),
            Map.entry("google cloud platform", "GCP"),
            Map.entry("vue", "Vue"),
            Map.entry("vue.js", "Vue"),
            Map.entry("vuejs", "Vue"),
            Map.entry("angular", "Angular"),
            Map.entry("angularjs", "Angular"),
            Map.entry("angular.js", "Angular"),
            Map.entry("spring boot", "Spring Boot"),
            Map.entry("springboot", "Spring Boot"),
            Map.entry("fastapi", "FastAPI"),
            Map.entry("django", "Django"),
            Map.entry("docker", "Docker"),
            Map.entry("terraform", "Terraform"),
            Map.entry("kubernetes", "Kubernetes"),
            Map.entry("ci/cd", "CI/CD"),
            Map.entry("cicd", "CI/CD"),
            Map.entry("ci cd", "CI/CD"),
            Map.entry("ml", "Machine Learning"),
            Map.entry("machine learning", "Machine Learning"),
            Map.entry("ai", "Artificial Intelligence"),
            Map.entry("nlp", "Natural Language Processing"),
            Map.entry("sql", "SQL"),
            Map.entry("nosql", "NoSQL"),
            Map.entry("graphql", "GraphQL"),
            Map.entry("rest", "REST"),
            Map.entry("restful", "REST"),
            Map.entry("rest api", "REST"),
            Map.entry("git", "Git"),
            Map.entry("linux", "Linux"),
            Map.entry("kafka", "Kafka"),
            Map.entry("apache kafka", "Kafka"),
            Map.entry("redis", "Redis")
    );

    private final Map<String, String> aliases;

    public SkillNormalizer() {
        this(Map.of());
    }

    public SkillNormalizer(Map<String, String> extraAliases) {
        Map<String, String> all = new HashMap<>(DEFAULT_ALIASES);
        if (extraAliases != null) {
            extraAliases.forEach((alias, canonical) -> {
                if (alias != null && canonical != null && !canonical.isBlank()) {
                    all.put(lookupKey(alias), canonical.trim());
                }
            });
        }
        this.aliases = Map.copyOf(all);
    }

    /**
     * @return canonical name, or {@code null} for a blank input
     */
    public String normalize(String skill) {
        if (skill == null) return null;
        String cleaned = skill.trim().replaceAll("\\s+", " ");
        // "Python," / "Docker." from sloppy lists; keeps "C#", "C++"
        cleaned = cleaned.replaceAll("[,;:.!?]+$", "").trim();
        if (cleaned.isEmpty()) return null;
        String canonical = aliases.get(lookupKey(cleaned));
        return canonical != null ? canonical : cleaned;
    }

    /**
     * Normalizes and de-duplicates (case-insensitively), keeping first-seen order.
     *
     * @return unmodifiable list
     */
    public List<String> normalizeAll(Collection<String> skills) {
        if (skills == null) return List.of();
        List<String> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String s : skills) {
            String n = normalize(s);
            if (n != null && seen.add(matchKey(n))) {
                result.add(n);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Key used for equality matching between normalized names.
     */
    public String matchKey(String normalizedSkill) {
        return normalizedSkill.toLowerCase(Locale.ROOT);
    }

    private static String lookupKey(String s) {
        return s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
