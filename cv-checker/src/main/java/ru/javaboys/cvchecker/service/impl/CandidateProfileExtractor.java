package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.ai.LlmException;
import ru.javaboys.cvchecker.ai.LlmJsonReader;
import ru.javaboys.cvchecker.ai.LlmResponseFormatException;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.ai.dto.ResumeInfo;
import ru.javaboys.cvchecker.config.CvCheckerProperties;
import ru.javaboys.cvchecker.exception.ExtractionException;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.WorkHistoryEntry;

import java.time.Clock;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static ru.javaboys.cvchecker.service.impl.TextUtils.cleanList;
import static ru.javaboys.cvchecker.service.impl.TextUtils.notBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.nullIfBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.round2;
import static ru.javaboys.cvchecker.service.impl.TextUtils.safeTrim;

@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateProfileExtractor {

    static final String SYSTEM_PROMPT = """
            You are an expert CV/resume parser. The CV is given as Markdown-like text.
            Return EXACTLY ONE JSON object (no extra text) with this schema:
            {
              "name": "string",
              "email": "string" | null,
              "phone": "string" | null,
              "location": "string" | null,
              "skills": ["string", ...],
              "totalYearsExperience": number,
              "workHistory": [
                {"company": "string", "title": "string", "startDate": "yyyy-MM|yyyy", "endDate": "yyyy-MM|yyyy|Present",
                 "durationYears": number, "responsibilities": ["string", ...]}
              ],
              "education": [{"degree": "string", "institution": "string", "graduationYear": "yyyy"}],
              "certifications": ["string", ...],
              "projects": ["string", ...]
            }
            Rules:
            - skills: every technical and soft skill mentioned anywhere in the CV.
            - Normalize skill names (e.g. "React.js" -> "React", "K8s" -> "Kubernetes").
            - Normalize dates to "yyyy-MM"; if only the year is known use "yyyy". Current job ends with "Present".
            - durationYears: length of each job in years, computed from its dates.
            - If information is missing use null or [] as appropriate.
            """;

    private static final Set<String> PRESENT = Set.of("present", "current", "now", "ongoing", "today", "till now", "to date");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})(?:[-/.](\\d{1,2}))?");
    private static final Pattern MONTH_YEAR = Pattern.compile("(\\d{1,2})[-/.](\\d{4})");

    private final LlmService llmService;
    private final LlmJsonReader jsonReader;
    private final SkillNormalizer skillNormalizer;
    private final CvCheckerProperties properties;
    private final Clock clock;

    public CandidateProfile extract(String cvText) {
        if (cvText == null || cvText.isBlank()) {
            throw new IllegalArgumentException("cvText must not be empty");
        }
        log.info("Parsing CV (length: {})", cvText.length());

        String user = """
                Parse this CV:
                ----------------
                %s
                """.formatted(safeTrim(cvText, properties.getAnalysis().getMaxInputChars()));

        ResumeInfo dto;
        try {
            dto = jsonReader.read(llmService.complete(SYSTEM_PROMPT, user), ResumeInfo.class);
        } catch (LlmException e) {
            throw new ExtractionException(AnalysisStageEnum.CV_PARSING, "CV extraction failed: " + e.getMessage(), e);
        } catch (LlmResponseFormatException e) {
            throw new ExtractionException(AnalysisStageEnum.CV_PARSING, "Invalid JSON from CV parser: " + e.getMessage(), e);
        }

        if (dto.getSkills() == null) {
            throw new ExtractionException(AnalysisStageEnum.CV_PARSING, "CV parser response has no skills");
        }

        List<WorkHistoryEntry> history = new ArrayList<>();
        if (dto.getWorkHistory() != null) {
            YearMonth now = YearMonth.now(clock);
            for (ResumeInfo.ExperienceItem item : dto.getWorkHistory()) {
                if (item == null) continue;
                history.add(toEntry(item, now));
            }
        }

        CandidateProfile profile = CandidateProfile.builder()
                .name(nullIfBlank(dto.getName(), "Unknown candidate"))
                .email(nullIfBlank(dto.getEmail(), null))
                .phone(nullIfBlank(dto.getPhone(), null))
                .location(nullIfBlank(dto.getLocation(), null))
                .skills(skillNormalizer.normalizeAll(dto.getSkills()))
                .totalYearsExperience(totalYears(history, dto.getTotalYearsExperience()))
                .workHistory(List.copyOf(history))
                .education(formatEducation(dto.getEducation()))
                .certifications(cleanList(dto.getCertifications()))
                .projects(cleanList(dto.getProjects()))
                .build();

        log.info("CV parsing complete - Name: {}, skills: {}, experience: {} years",
                profile.getName(), profile.getSkills().size(), profile.getTotalYearsExperience());
        return profile;
    }

    private WorkHistoryEntry toEntry(ResumeInfo.ExperienceItem item, YearMonth now) {
        Double duration = item.getDurationYears();
        if (duration == null || duration.isNaN() || duration < 0) {
            duration = durationYears(item.getStartDate(), item.getEndDate(), now);
        }
        return WorkHistoryEntry.builder()
                .company(nullIfBlank(item.getCompany(), ""))
                .title(nullIfBlank(item.getTitle(), ""))
                .startDate(nullIfBlank(item.getStartDate(), ""))
                .endDate(nullIfBlank(item.getEndDate(), ""))
                .durationYears(duration == null ? 0.0 : round2(duration))
                .responsibilities(cleanList(item.getResponsibilities()))
                .build();
    }

    /**
     * Summed per-entry durations; overlapping jobs are counted twice.
     * Falls back to the model's own estimate when no entry has a duration.
     */
    static double totalYears(List<WorkHistoryEntry> history, @Nullable Double modelEstimate) {
        double sum = 0;
        for (WorkHistoryEntry e : history) {
            sum += e.getDurationYears();
        }
        if (sum > 0) return round2(sum);
        if (modelEstimate == null || modelEstimate.isNaN() || modelEstimate < 0) return 0.0;
        return round2(modelEstimate);
    }

    @Nullable
    static Double durationYears(String startDate, String endDate, YearMonth now) {
        YearMonth start = parseYearMonth(startDate, now);
        if (start == null) return null;
        YearMonth end = notBlank(endDate) ? parseEndYearMonth(endDate, now) : now;
        if (end == null || end.isBefore(start)) return null;
        return ChronoUnit.MONTHS.between(start, end) / 12.0;
    }

    /**
     * Start of a range: a bare year means January.
     */
    @Nullable
    static YearMonth parseYearMonth(String s, YearMonth now) {
        return parse(s, now, 1);
    }

    /**
     * End of a range: a bare year means December, but never later than {@code now}.
     */
    @Nullable
    static YearMonth parseEndYearMonth(String s, YearMonth now) {
        YearMonth end = parse(s, now, 12);
        return end != null && end.isAfter(now) ? now : end;
    }

    @Nullable
    private static YearMonth parse(String s, YearMonth now, int monthOfBareYear) {
        if (!notBlank(s)) return null;
        String t = s.trim().toLowerCase(Locale.ROOT);
        if (PRESENT.contains(t)) return now;
        Matcher my = MONTH_YEAR.matcher(t);
        if (my.matches()) {
            return yearMonth(Integer.parseInt(my.group(2)), Integer.parseInt(my.group(1)));
        }
        Matcher ym = YEAR_MONTH.matcher(t);
        if (ym.matches()) {
            int month = ym.group(2) == null ? monthOfBareYear : Integer.parseInt(ym.group(2));
            return yearMonth(Integer.parseInt(ym.group(1)), month);
        }
        return null;
    }

    @Nullable
    private static YearMonth yearMonth(int year, int month) {
        if (month < 1 || month > 12) return null;
        return YearMonth.of(year, month);
    }

    private static List<String> formatEducation(List<ResumeInfo.EducationItem> items) {
        if (items == null) return List.of();
        List<String> out = new ArrayList<>();
        for (ResumeInfo.EducationItem ed : items) {
            if (ed == null) continue;
            String degree = nullIfBlank(ed.getDegree(), null);
            String institution = nullIfBlank(ed.getInstitution(), null);
            if (degree == null && institution == null) continue;
            StringBuilder sb = new StringBuilder(degree != null ? degree : "Studies");
            if (institution != null) sb.append(" from ").append(institution);
            if (notBlank(ed.getGraduationYear())) sb.append(" (").append(ed.getGraduationYear().trim()).append(')');
            out.add(sb.toString());
        }
        return List.copyOf(out);
    }
}
