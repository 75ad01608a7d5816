package ru.javaboys.cvchecker.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.cvchecker.ai.ScriptedLlmService;
import ru.javaboys.cvchecker.exception.ExtractionException;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.WorkHistoryEntry;

import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CandidateProfileExtractorTest {

    private static final YearMonth NOW = YearMonth.of(2025, 6);

    @Test
    void extract_shouldMapAndNormalizeProfile() {
        ScriptedLlmService llm = new ScriptedLlmService().reply(TestFixtures.CV_JSON);

        CandidateProfile profile = TestFixtures.cvExtractor(llm).extract(TestFixtures.CV_TEXT);

        assertThat(profile.getName()).isEqualTo("Jane Doe");
        assertThat(profile.getEmail()).isEqualTo("jane@example.com");
        assertThat(profile.getPhone()).isNull();
        assertThat(profile.getSkills()).containsExactly("Python", "FastAPI", "Azure", "Docker");
        assertThat(profile.getTotalYearsExperience()).isEqualTo(6.0);
        assertThat(profile.getWorkHistory()).hasSize(1);
        assertThat(profile.getWorkHistory().get(0).getEndDate()).isEqualTo("Present");
        assertThat(profile.getEducation()).containsExactly("BSc Computer Science from MIT (2019)");
        assertThat(profile.getCertifications()).containsExactly("AZ-204");
    }

    @Test
    void extract_shouldComputeMissingDurationsFromDates() {
        ScriptedLlmService llm = new ScriptedLlmService().reply("""
                {
                  "name": "John",
                  "skills": ["Java"],
                  "totalYearsExperience": 1,
                  "workHistory": [
                    {"company": "A", "title": "Dev", "startDate": "2020-01", "endDate": "Present"},
                    {"company": "B", "title": "Intern", "startDate": "2019-01", "endDate": "2019-07"}
                  ]
                }
                """);

        CandidateProfile profile = TestFixtures.cvExtractor(llm).extract("John's CV");

        assertThat(profile.getWorkHistory()).extracting(WorkHistoryEntry::getDurationYears)
                .containsExactly(5.42, 0.5);
        assertThat(profile.getTotalYearsExperience()).isEqualTo(5.92);
    }

    @Test
    void extract_shouldFallBackToModelEstimateWithoutHistory() {
        ScriptedLlmService llm = new ScriptedLlmService().reply("{\"skills\": [], \"totalYearsExperience\": 3.5}");

        CandidateProfile profile = TestFixtures.cvExtractor(llm).extract("Short CV");

        assertThat(profile.getName()).isEqualTo("Unknown candidate");
        assertThat(profile.getSkills()).isEmpty();
        assertThat(profile.getWorkHistory()).isEmpty();
        assertThat(profile.getTotalYearsExperience()).isEqualTo(3.5);
    }

    @Test
    void extract_shouldFailWhenSkillsAbsent() {
        ScriptedLlmService llm = new ScriptedLlmService().reply("{\"name\": \"John\"}");

        assertThatThrownBy(() -> TestFixtures.cvExtractor(llm).extract("John's CV"))
                .isInstanceOf(ExtractionException.class)
                .satisfies(e -> assertThat(((ExtractionException) e).getStage()).isEqualTo(AnalysisStageEnum.CV_PARSING));
    }

    @Test
    void parseYearMonth_shouldAcceptCommonFormats() {
        assertThat(CandidateProfileExtractor.parseYearMonth("2019-06", NOW)).isEqualTo(YearMonth.of(2019, 6));
        assertThat(CandidateProfileExtractor.parseYearMonth("06/2019", NOW)).isEqualTo(YearMonth.of(2019, 6));
        assertThat(CandidateProfileExtractor.parseYearMonth("2019", NOW)).isEqualTo(YearMonth.of(2019, 1));
        assertThat(CandidateProfileExtractor.parseYearMonth("Present", NOW)).isEqualTo(NOW);
        assertThat(CandidateProfileExtractor.parseYearMonth("13/2019", NOW)).isNull();
        assertThat(CandidateProfileExtractor.parseYearMonth("last spring", NOW)).isNull();
    }

    @Test
    void durationYears_shouldRejectReversedRanges() {
        assertThat(CandidateProfileExtractor.durationYears("2022-01", "2021-01", NOW)).isNull();
        assertThat(CandidateProfileExtractor.durationYears("2024-06", null, NOW)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void durationYears_shouldReadBareEndYearAsDecember() {
        assertThat(CandidateProfileExtractor.durationYears("2020-06", "2020", NOW)).isCloseTo(0.5, within(1e-9));
        assertThat(CandidateProfileExtractor.durationYears("2019", "2020", NOW)).isCloseTo(23 / 12.0, within(1e-9));
        assertThat(CandidateProfileExtractor.parseEndYearMonth("2025", NOW)).isEqualTo(NOW);
        assertThat(CandidateProfileExtractor.parseEndYearMonth("03/2021", NOW)).isEqualTo(YearMonth.of(2021, 3));
    }

    @Test
    void extract_shouldKeepExperienceOfJobEndingInBareYear() {
        ScriptedLlmService llm = new ScriptedLlmService().reply("""
                {"skills": ["Java"], "workHistory": [
                  {"company": "A", "title": "Dev", "startDate": "2020-06", "endDate": "2020"}
                ]}
                """);

        CandidateProfile profile = TestFixtures.cvExtractor(llm).extract("CV");

        assertThat(profile.getWorkHistory().get(0).getDurationYears()).isEqualTo(0.5);
        assertThat(profile.getTotalYearsExperience()).isEqualTo(0.5);
    }

    @Test
    void totalYears_shouldSumEntries() {
        List<WorkHistoryEntry> history = List.of(entry(2.5), entry(1.25));

        assertThat(CandidateProfileExtractor.totalYears(history, 10.0)).isEqualTo(3.75);
        assertThat(CandidateProfileExtractor.totalYears(List.of(), null)).isZero();
    }

    private static WorkHistoryEntry entry(double years) {
        return WorkHistoryEntry.builder()
                .company("X").title("Y").startDate("").endDate("")
                .durationYears(years).responsibilities(List.of())
                .build();
    }
}
