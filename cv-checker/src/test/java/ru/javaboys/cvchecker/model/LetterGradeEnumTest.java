package ru.javaboys.cvchecker.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LetterGradeEnumTest {

    @ParameterizedTest
    @CsvSource({
            "100, A+", "95.0, A+", "94.99, A",
            "90.0, A", "89.99, B+", "85, B+",
            "84.99, B", "80, B", "79.99, C+",
            "75, C+", "74.99, C", "70, C",
            "69.99, D", "60, D", "59.99, F", "0, F"
    })
    void fromScore_shouldIncludeLowerBound(double score, String label) {
        assertThat(LetterGradeEnum.fromScore(score).getLabel()).isEqualTo(label);
    }

    @Test
    void fromScore_shouldNotDecreaseWithScore() {
        LetterGradeEnum previous = LetterGradeEnum.fromScore(0);
        for (int i = 1; i <= 10000; i++) {
            LetterGradeEnum current = LetterGradeEnum.fromScore(i / 100.0);
            assertThat(current.getLowerBound()).isGreaterThanOrEqualTo(previous.getLowerBound());
            previous = current;
        }
    }
}
