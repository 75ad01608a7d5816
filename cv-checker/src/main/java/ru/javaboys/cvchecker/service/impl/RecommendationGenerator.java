package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.ai.LlmException;
import ru.javaboys.cvchecker.ai.LlmJsonReader;
import ru.javaboys.cvchecker.ai.LlmResponseFormatException;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.ai.dto.ReportInfo;
import ru.javaboys.cvchecker.exception.ReportGenerationException;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.HybridScore;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.MatchReport;
import ru.javaboys.cvchecker.model.Recommendation;
import ru.javaboys.cvchecker.model.RecommendationCategoryEnum;
import ru.javaboys.cvchecker.model.RecommendationPriorityEnum;
import ru.javaboys.cvchecker.model.ScoreBreakdown;
import ru.javaboys.cvchecker.model.WorkHistoryEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static ru.javaboys.cvchecker.service.impl.TextUtils.joinOrNone;
import static ru.javaboys.cvchecker.service.impl.TextUtils.notBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.nullIfBlank;

/**
 * Turns a score into a summary and prioritized advice. Recommendations, strengths and gaps
 * are always padded to {@link #MIN_ITEMS} entries, since consumers rely on that length.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationGenerator {

    public static final int MIN_ITEMS = 5;
    static final int MAX_ITEMS = 10;

    static final String SYSTEM_PROMPT = """
            You are an expert career coach and technical recruiter. Generate actionable recommendations
            that improve this CV for this specific job.
            Priorities:
            - HIGH: critical gaps that significantly impact the match
            - MEDIUM: important improvements that strengthen the profile
            - LOW: nice-to-have enhancements
            Each recommendation must be specific, explain WHY it matters for this role and HOW to apply it.
            Return EXACTLY ONE JSON object (no extra text):
            {
              "executiveSummary": "2-3 sentence overview",
              "recommendations": [
                {"priority": "HIGH|MEDIUM|LOW",
                 "category": "ADD_SKILL|MODIFY_CONTENT|EMPHASIZE_EXPERIENCE|REMOVE_CONTENT|RESTRUCTURE",
                 "title": "specific action", "rationale": "why this matters", "example": "optional example"}
              ],
              "quickWins": ["easy improvement", ...]
            }
            Give at least 5 recommendations. Be constructive and encouraging.
            """;

    private static final List<String> GENERIC_STRENGTHS = List.of(
            "CV presents professional experience in a structured way",
            "Background shows hands-on delivery of work relevant to the role",
            "Profile demonstrates continuous professional development",
            "Experience spans responsibilities that transfer to this position",
            "Candidate brings practical industry exposure");

    private static final List<String> GENERIC_GAPS = List.of(
            "Quantified achievements (metrics, impact) are limited",
            "Alignment between CV wording and job terminology could be stronger",
            "Evidence of depth in the core technologies could be more explicit",
            "Leadership and collaboration examples are not prominent",
            "Recent learning or certifications relevant to the role are not highlighted");

    private static final List<Recommendation> GENERIC_RECOMMENDATIONS = List.of(
            generic(RecommendationCategoryEnum.MODIFY_CONTENT,
                    "Quantify your achievements",
                    "Numbers (percentages, revenue, users, time saved) make impact concrete for recruiters.",
                    "Reduced API latency by 40% by introducing caching"),
            generic(RecommendationCategoryEnum.MODIFY_CONTENT,
                    "Mirror the job description's terminology",
                    "Screening tools and recruiters look for the exact terms used in the posting.",
                    null),
            generic(RecommendationCategoryEnum.EMPHASIZE_EXPERIENCE,
                    "Lead with the most relevant experience",
                    "Recruiters skim the first third of a CV; put the best-matching roles and projects there.",
                    null),
            generic(RecommendationCategoryEnum.RESTRUCTURE,
                    "Add a concise professional summary tailored to this role",
                    "A 2-3 line summary frames the rest of the CV around the target position.",
                    null),
            generic(RecommendationCategoryEnum.REMOVE_CONTENT,
                    "Trim outdated or unrelated details",
                    "Irrelevant content dilutes the signal of the experience that matters for this job.",
                    null));

    private final LlmService llmService;
    private final LlmJsonReader jsonReader;

    public MatchReport generate(HybridScore score, JobRequirements job, CandidateProfile profile) {
        ScoreBreakdown breakdown = score.getBreakdown();
        log.info("Generating recommendations for score: {}", breakdown.getOverallScore());

        String user = """
                ANALYSIS RESULTS:
                Final score: %s/100 (grade %s)
                Skill match: %s%%, experience alignment: %s%%, semantic match: %s%%, soft skills: %s%%

                Strengths:
                %s

                Gaps:
                %s

                Missing required skills: %s
                Semantic reasoning: %s

                JOB REQUIREMENTS:
                Title: %s
                Required skills: %s
                Preferred skills: %s
                Experience: %s years
                Level: %s

                CANDIDATE PROFILE:
                Name: %s
                Total experience: %s years
                Skills: %s

                Generate actionable recommendations to improve this candidate's match for this role.
                """.formatted(
                breakdown.getOverallScore(), breakdown.getLetterGrade().getLabel(),
                breakdown.getSkillMatchScore(), breakdown.getExperienceAlignmentScore(),
                breakdown.getSemanticMatchScore(), breakdown.getSoftSkillsScore(),
                bullets(score.getStrengths()),
                bullets(score.getGaps()),
                joinOrNone(score.getDeterministic().getMissingSkills()),
                nullIfBlank(score.getSemantic().getReasoning(), "n/a"),
                job.getTitle(),
                joinOrNone(job.getRequiredSkills()),
                joinOrNone(job.getPreferredSkills()),
                job.getMinYearsExperience(),
                job.getSeniorityLevel().getId(),
                profile.getName(),
                profile.getTotalYearsExperience(),
                joinOrNone(profile.getSkills().subList(0, Math.min(15, profile.getSkills().size()))));

        ReportInfo dto;
        try {
            dto = jsonReader.read(llmService.complete(SYSTEM_PROMPT, user), ReportInfo.class);
        } catch (LlmException e) {
            throw new ReportGenerationException("Report generation call failed: " + e.getMessage(), e);
        } catch (LlmResponseFormatException e) {
            throw new ReportGenerationException("Invalid JSON from report generator: " + e.getMessage(), e);
        }

        List<Recommendation> recommendations = toRecommendations(dto);
        int fromModel = recommendations.size();
        padRecommendations(recommendations, score.getDeterministic().getMissingSkills());
        recommendations.sort(Comparator.comparing(Recommendation::getPriority));
        if (fromModel < MIN_ITEMS) {
            log.warn("Only {} recommendations generated, padded to {}", fromModel, recommendations.size());
        }

        String summary = nullIfBlank(dto.getExecutiveSummary(), null);
        if (summary == null) {
            summary = String.format(Locale.US, "Candidate scored %.2f/100 (grade %s) for %s.",
                    breakdown.getOverallScore(), breakdown.getLetterGrade().getLabel(), job.getTitle());
        }

        MatchReport report = MatchReport.builder()
                .summary(summary)
                .recommendations(List.copyOf(cap(recommendations)))
                .strengths(padStrengths(score.getStrengths(), profile))
                .gaps(padGaps(score.getGaps(), job, profile))
                .build();

        log.info("Report generated with {} recommendations", report.getRecommendations().size());
        return report;
    }

    private List<Recommendation> toRecommendations(ReportInfo dto) {
        List<Recommendation> out = new ArrayList<>();
        Set<String> titles = new HashSet<>();
        if (dto.getRecommendations() != null) {
            for (ReportInfo.RecommendationItem it : dto.getRecommendations()) {
                if (it == null || !notBlank(it.getTitle())) continue;
                if (!titles.add(it.getTitle().trim().toLowerCase(Locale.ROOT))) continue;
                out.add(Recommendation.builder()
                        .category(parseCategory(it.getCategory()))
                        .priority(parsePriority(it.getPriority()))
                        .title(it.getTitle().trim())
                        .rationale(nullIfBlank(it.getRationale(), ""))
                        .example(nullIfBlank(it.getExample(), null))
                        .build());
            }
        }
        if (dto.getQuickWins() != null) {
            for (String win : dto.getQuickWins()) {
                if (!notBlank(win) || !titles.add(win.trim().toLowerCase(Locale.ROOT))) continue;
                out.add(Recommendation.builder()
                        .category(RecommendationCategoryEnum.MODIFY_CONTENT)
                        .priority(RecommendationPriorityEnum.LOW)
                        .title(win.trim())
                        .rationale("Quick win: small effort, visible improvement.")
                        .build());
            }
        }
        return out;
    }

    void padRecommendations(List<Recommendation> recommendations, List<String> missingSkills) {
        Set<String> titles = new HashSet<>();
        for (Recommendation r : recommendations) titles.add(r.getTitle().toLowerCase(Locale.ROOT));

        for (String skill : missingSkills) {
            if (recommendations.size() >= MIN_ITEMS) return;
            String title = "Add evidence of " + skill;
            if (!titles.add(title.toLowerCase(Locale.ROOT))) continue;
            recommendations.add(Recommendation.builder()
                    .category(RecommendationCategoryEnum.ADD_SKILL)
                    .priority(RecommendationPriorityEnum.MEDIUM)
                    .title(title)
                    .rationale(skill + " is a required skill for this role and is not visible in the CV.")
                    .example("Describe a project where you used " + skill + " and the outcome it produced")
                    .build());
        }
        for (Recommendation r : GENERIC_RECOMMENDATIONS) {
            if (recommendations.size() >= MIN_ITEMS) return;
            if (titles.add(r.getTitle().toLowerCase(Locale.ROOT))) recommendations.add(r);
        }
    }

    List<String> padStrengths(List<String> compiled, CandidateProfile profile) {
        Set<String> out = new LinkedHashSet<>(compiled);
        for (WorkHistoryEntry e : profile.getWorkHistory()) {
            if (out.size() >= MIN_ITEMS) break;
            if (notBlank(e.getTitle()) && notBlank(e.getCompany())) {
                out.add(String.format(Locale.US, "Experience as %s at %s", e.getTitle(), e.getCompany()));
            }
        }
        for (String cert : profile.getCertifications()) {
            if (out.size() >= MIN_ITEMS) break;
            out.add("Holds certification: " + cert);
        }
        for (String project : profile.getProjects()) {
            if (out.size() >= MIN_ITEMS) break;
            out.add("Relevant project: " + project);
        }
        fill(out, GENERIC_STRENGTHS);
        return List.copyOf(cap(new ArrayList<>(out)));
    }

    List<String> padGaps(List<String> compiled, JobRequirements job, CandidateProfile profile) {
        Set<String> out = new LinkedHashSet<>(compiled);
        Set<String> has = new HashSet<>();
        for (String s : profile.getSkills()) has.add(s.toLowerCase(Locale.ROOT));
        for (String preferred : job.getPreferredSkills()) {
            if (out.size() >= MIN_ITEMS) break;
            if (!has.contains(preferred.toLowerCase(Locale.ROOT))) {
                out.add("Preferred skill not evident: " + preferred);
            }
        }
        if (out.size() < MIN_ITEMS && !job.getEducationRequirements().isEmpty() && profile.getEducation().isEmpty()) {
            out.add("Education requirement not addressed: " + String.join("; ", job.getEducationRequirements()));
        }
        fill(out, GENERIC_GAPS);
        return List.copyOf(cap(new ArrayList<>(out)));
    }

    private static void fill(Set<String> out, List<String> generic) {
        for (String g : generic) {
            if (out.size() >= MIN_ITEMS) return;
            out.add(g);
        }
    }

    private static <T> List<T> cap(List<T> items) {
        return items.size() <= MAX_ITEMS ? items : items.subList(0, MAX_ITEMS);
    }

    static RecommendationCategoryEnum parseCategory(String s) {
        RecommendationCategoryEnum c = s == null ? null
                : RecommendationCategoryEnum.fromId(s.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        return c != null ? c : RecommendationCategoryEnum.MODIFY_CONTENT;
    }

    static RecommendationPriorityEnum parsePriority(String s) {
        RecommendationPriorityEnum p = s == null ? null : RecommendationPriorityEnum.fromId(s.trim().toUpperCase(Locale.ROOT));
        return p != null ? p : RecommendationPriorityEnum.MEDIUM;
    }

    private static String bullets(List<String> items) {
        if (items == null || items.isEmpty()) return "- none";
        StringBuilder sb = new StringBuilder();
        for (String it : items) sb.append("- ").append(it).append('\n');
        return sb.toString().trim();
    }

    private static Recommendation generic(RecommendationCategoryEnum category, String title, String rationale, String example) {
        return Recommendation.builder()
                .category(category)
                .priority(RecommendationPriorityEnum.LOW)
                .title(title)
                .rationale(rationale)
                .example(example)
                .build();
    }
}
