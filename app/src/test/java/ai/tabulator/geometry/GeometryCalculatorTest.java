package ai.tabulator.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.CandidateFixtures;
import ai.tabulator.extract.Rendering;
import ai.tabulator.group.Group;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeometryCalculatorTest {

    private final GeometryCalculator calculator = new GeometryCalculator(80);

    @Test
    void alignsEveryFittingMemberToWidestAnchor() {
        List<Candidate> members = CandidateFixtures.replacing(
                new Rendering("when 1", " then \"one\""),
                new Rendering("when 200", " then \"two hundred\""),
                new Rendering("when :other", " then \"other\""));

        List<Decision> decisions = calculator.decide(new Group(members), DegradationMode.PER_MEMBER);

        assertThat(decisions).extracting(Decision::kind).containsOnly(DecisionKind.ALIGNED);
        assertThat(decisions).extracting(Decision::column).containsOnly(11);
        assertThat(decisions).extracting(Decision::padding).containsExactly(5, 3, 0);
    }

    @Test
    void fallsBackToUnalignedWhenPaddedMemberOverflows() {
        List<Candidate> members = CandidateFixtures.replacing(
                new Rendering("when 1", " then \"this is a pretty long result string here\""),
                new Rendering("when :a_long_condition_name_for_testing", " then \"x\""));

        List<Decision> decisions = calculator.decide(new Group(members), DegradationMode.PER_MEMBER);

        assertThat(decisions).extracting(Decision::kind)
                .containsExactly(DecisionKind.SINGLE_LINE, DecisionKind.SINGLE_LINE);
    }

    @Test
    void leavesMemberThatCannotFitAloneAndSizesColumnWithoutIt() {
        List<Candidate> members = CandidateFixtures.replacing(
                new Rendering("when 1", " then \"one\""),
                new Rendering("when :a_condition_that_is_quite_long", " then \"" + "y".repeat(60) + "\""),
                new Rendering("when 22", " then \"two\""));

        List<Decision> decisions = calculator.decide(new Group(members), DegradationMode.PER_MEMBER);

        assertThat(decisions).extracting(Decision::kind)
                .containsExactly(DecisionKind.ALIGNED, DecisionKind.UNCHANGED, DecisionKind.ALIGNED);
        assertThat(decisions.get(0).column()).isEqualTo(7);
    }

    @Test
    void rewritesLoneMemberWithoutPadding() {
        List<Candidate> members = CandidateFixtures.replacing(new Rendering("when 1", " then \"one\""));

        List<Decision> decisions = calculator.decide(new Group(members), DegradationMode.PER_MEMBER);

        assertThat(decisions).singleElement().extracting(Decision::kind).isEqualTo(DecisionKind.SINGLE_LINE);
    }

    @Test
    void alignsWholeGroupOrNothing() {
        List<Candidate> fitting = CandidateFixtures.padding(
                new Rendering("x ", "= 1"),
                new Rendering("foo ", "= 2"),
                new Rendering("barbaz ", "= 3"));
        List<Candidate> overflowing = CandidateFixtures.padding(
                new Rendering("x ", "= \"a moderately long value that takes up space\""),
                new Rendering("this_is_an_extremely_long_variable_name ", "= \"short\""));

        List<Decision> aligned = calculator.decide(new Group(fitting), DegradationMode.WHOLE_GROUP);
        List<Decision> abandoned = calculator.decide(new Group(overflowing), DegradationMode.WHOLE_GROUP);

        assertThat(aligned).extracting(Decision::kind)
                .containsExactly(DecisionKind.ALIGNED, DecisionKind.ALIGNED, DecisionKind.UNCHANGED);
        assertThat(aligned).extracting(Decision::padding).containsExactly(5, 3, 0);
        assertThat(abandoned).extracting(Decision::kind).containsOnly(DecisionKind.UNCHANGED);
    }

    @Test
    void neverPadsSingletonGroup() {
        List<Candidate> single = CandidateFixtures.padding(new Rendering("x ", "= 1"));

        assertThat(calculator.decide(new Group(single), DegradationMode.WHOLE_GROUP))
                .extracting(Decision::kind).containsOnly(DecisionKind.UNCHANGED);
    }

    @Test
    void rewritesIndividuallyWhenRenderingFits() {
        List<Candidate> members = CandidateFixtures.replacing(
                new Rendering("def foo = 42", ""),
                new Rendering("def foo = \"" + "z".repeat(80) + "\"", ""));

        List<Decision> first = calculator.decide(new Group(members.subList(0, 1)), DegradationMode.NONE);
        List<Decision> second = calculator.decide(new Group(members.subList(1, 2)), DegradationMode.NONE);

        assertThat(first).extracting(Decision::kind).containsExactly(DecisionKind.SINGLE_LINE);
        assertThat(second).extracting(Decision::kind).containsExactly(DecisionKind.UNCHANGED);
    }

    @Test
    void computesColumnAsWidestAnchor() {
        List<Candidate> members = CandidateFixtures.padding(
                new Rendering("a", ""), new Rendering("abc", ""), new Rendering("abcdefghijk", ""));

        assertThat(GeometryCalculator.alignmentColumn(members)).isEqualTo(11);
        assertThat(GeometryCalculator.alignmentColumn(List.of())).isZero();
    }

    @Test
    void rejectsAlignmentLeftOfAnchor() {
        Candidate candidate = CandidateFixtures.padding(new Rendering("foo ", "= 1")).get(0);

        assertThat(catchThrowable(() -> Decision.aligned(candidate, 2))).isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> new GeometryCalculator(0))).isInstanceOf(IllegalArgumentException.class);
    }
}
