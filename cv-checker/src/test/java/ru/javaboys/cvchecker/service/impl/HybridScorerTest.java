package ru.javaboys.cvchecker.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.cvchecker.ai.ScriptedLlmService;
import ru.javaboys.cvchecker.model.HybridScore;
import ru.javaboys.cvchecker.model.LetterGradeEnum;
import ru.javaboys.cvchecker.model.ScoreBreakdown;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static ru.javaboys.cvchecker.service.impl.TestFixtures.job;
import static ru.javaboys.cvchecker.service.impl.TestFixtures.profile;

class HybridScorerTest {

    @Test
    void weights_shouldSumToOneHundred() {
        assertThat(HybridScorer.WEIGHT_SKILL + HybridScorer.WEIGHT_EXPERIENCE
                + HybridScorer.WEIGHT_SEMANTIC + HybridScorer.WEIGHT_SOFT_SKILLS).isEqualTo(100);
    }

    @Test
    void analyze_shouldGradeHighMatchAsA() {
        ScriptedLlmService llm = new ScriptedLlmService().reply(TestFixtures.SEMANTIC_JSON);

        HybridScore score = TestFixtures.hybridScorer(llm).analyze("job", "cv",
                job(List.of("Python", "FastAPI", "Azure"), 5),
                profile(List.of("Python", "FastAPI", "Azure", "Docker"), 6));

        ScoreBreakdown b = score.getBreakdown();
        assertThat(b.getSkillMatchScore()).isEqualTo(100.0);
        assertThat(b.getExperienceAlignmentScore()).isEqualTo(100.0);
        assertThat(b.getSemanticMatchScore()).isEqualTo(85.0);
        assertThat(b.getSoftSkillsScore()).isEqualTo(80.0);
        assertThat(b.getOverallScore()).isEqualTo(93.25);
        assertThat(b.getLetterGrade()).isEqualTo(LetterGradeEnum.A);
        assertThat(score.getStrengths()).contains(
                "Strong match on 3 required skills: Python, FastAPI, Azure",
                "Excellent experience level alignment",
                "Transferable skills identified: AWS -> Azure",
                "Clear API ownership");
        assertThat(score.getGaps()).containsExactly("No Terraform");
        assertThat(llm.userPrompts().get(0)).contains("Skill match: 100.0%");
    }

    @Test
    void analyze_shouldGradePartialMatchAsF() {
        ScriptedLlmService llm = new ScriptedLlmService()
                .reply("{\"semanticMatchScore\": 50, \"softSkillsScore\": 60, \"culturalFitNotes\": \"Some concern about ownership\"}");

        HybridScore score = TestFixtures.hybridScorer(llm).analyze("job", "cv",
                job(List.of("Python", "PostgreSQL", "Kubernetes"), 5),
                profile(List.of("Python"), 3));

        assertThat(score.getBreakdown().getOverallScore()).isEqualTo(46.83);
        assertThat(score.getBreakdown().getLetterGrade()).isEqualTo(LetterGradeEnum.F);
        assertThat(score.getGaps()).containsExactly(
                "Missing 2 required skills: PostgreSQL, Kubernetes",
                "Missing 2.0 years of experience",
                "Some concern about ownership");
    }

    @Test
    void combine_shouldClampComponentsAndStayInRange() {
        HybridScorer scorer = TestFixtures.hybridScorer(new ScriptedLlmService());

        ScoreBreakdown high = scorer.combine(140, 100, 100, 250);
        ScoreBreakdown low = scorer.combine(-10, 0, -5, 0);

        assertThat(high.getSkillMatchScore()).isEqualTo(100.0);
        assertThat(high.getOverallScore()).isEqualTo(100.0);
        assertThat(high.getLetterGrade()).isEqualTo(LetterGradeEnum.A_PLUS);
        assertThat(low.getOverallScore()).isZero();
        assertThat(low.getLetterGrade()).isEqualTo(LetterGradeEnum.F);
    }

    @Test
    void combine_shouldGradeFromRoundedOverall() {
        HybridScorer scorer = TestFixtures.hybridScorer(new ScriptedLlmService());

        ScoreBreakdown b = scorer.combine(90, 90, 90, 90);

        assertThat(b.getOverallScore()).isEqualTo(90.0);
        assertThat(b.getLetterGrade()).isEqualTo(LetterGradeEnum.A);
    }

    @Test
    void combine_shouldGradeWeightedSumJustBelowThresholdByReportedScore() {
        HybridScorer scorer = TestFixtures.hybridScorer(new ScriptedLlmService());

        // weighted sum 89.996 is reported as 90.00
        ScoreBreakdown roundedUp = scorer.combine(89.99, 90, 90, 90);
        // weighted sum 89.992 is reported as 89.99
        ScoreBreakdown roundedDown = scorer.combine(89.98, 90, 90, 90);

        assertThat(roundedUp.getOverallScore()).isEqualTo(90.0);
        assertThat(roundedUp.getLetterGrade()).isEqualTo(LetterGradeEnum.A);
        assertThat(roundedDown.getOverallScore()).isEqualTo(89.99);
        assertThat(roundedDown.getLetterGrade()).isEqualTo(LetterGradeEnum.B_PLUS);
    }
}
