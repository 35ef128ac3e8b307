package ai.tabulator.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ai.tabulator.fixture.RubyFixtureParser;
import ai.tabulator.policy.PolicyKind;
import ai.tabulator.policy.PolicySet;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class TabulationEngineTest {

    private final TabulationEngine engine = new TabulationEngine(PolicySet.all(80), 80);

    @Test
    void runsPoliciesInFixedOrder() {
        PassResult result = engine.run(RubyFixtureParser.parseSource("""
                def size
                  @items.size
                end
                def bb = 2
                def ccc = 3
                case kind
                when :a
                  1
                end
                x = 1
                yy = 2
                """));

        assertThat(result.diagnostics()).extracting(Diagnostic::policy).containsExactly(
                PolicyKind.LINEARIZE_ROUTINE,
                PolicyKind.CONDENSE_BRANCH,
                PolicyKind.ALIGN_ROUTINE,
                PolicyKind.ALIGN_ASSIGNMENT);
        assertThat(result.deferred()).isZero();
        assertThat(result.rewrittenSource()).isEqualTo("""
                def size = @items.size
                def bb  = 2
                def ccc = 3
                case kind
                when :a then 1
                end
                x  = 1
                yy = 2
                """);
    }

    @Test
    void defersEditNestedInsideAcceptedOne() {
        PassResult result = engine.run(RubyFixtureParser.parseSource("""
                def foo
                  bar(
                    x = 1,
                    yy = 2
                  )
                end
                """));

        assertThat(result.deferred()).isEqualTo(1);
        assertThat(result.diagnostics()).extracting(Diagnostic::policy).containsExactly(PolicyKind.LINEARIZE_ROUTINE);
        assertThat(result.rewrittenSource()).isEqualTo("def foo = bar( x = 1, yy = 2 )\n");
    }

    @Test
    void producesNothingForCleanSource() {
        PassResult result = engine.run(RubyFixtureParser.parseSource("""
                def foo = 1
                x = 2
                """));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.rewrittenSource()).isEqualTo(result.source());
    }

    @Test
    void runsOnlyEnabledPolicies() {
        TabulationEngine condenseOnly = new TabulationEngine(PolicySet.of(EnumSet.of(PolicyKind.CONDENSE_BRANCH), 80), 80);

        PassResult result = condenseOnly.run(RubyFixtureParser.parseSource("""
                a = 1
                bbb = 2
                def foo
                  1
                end
                """));

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void diagnosticCarriesNodeSpanAndEdit() {
        PassResult result = engine.run(RubyFixtureParser.parseSource("a = 1\nbbb = 2\n"));

        assertThat(result.diagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.span().firstLine()).isEqualTo(1);
            assertThat(diagnostic.edit().isInsertion()).isTrue();
            assertThat(diagnostic.toString()).isEqualTo("1:0 align-assignment: Align assignment with other assignments in group");
        });
    }

    @Test
    void keepsLinePaddedByTwoPoliciesWithinWidth() {
        TabulationEngine narrow = new TabulationEngine(PolicySet.all(24), 24);

        PassResult result = narrow.run(RubyFixtureParser.parseSource("""
                def a = @a = 1
                def bbbbb = @bbbbb = 2
                """));

        assertThat(result.deferred()).isEqualTo(1);
        assertThat(result.diagnostics()).extracting(Diagnostic::policy).containsExactly(PolicyKind.ALIGN_ROUTINE);
        assertThat(result.rewrittenSource().split("\n")).allSatisfy(line -> assertThat(line).hasSizeLessThanOrEqualTo(24));
    }

    @Test
    void convergesSharedLineEditsWithinWidth() {
        TabulationEngine narrow = new TabulationEngine(PolicySet.all(24), 24);

        ConvergenceResult result = new ConvergenceRunner(narrow, new RubyFixtureParser(), 10).run("""
                def a = @a = 1
                def bbbbb = @bbbbb = 2
                """);

        assertThat(result.converged()).isTrue();
        assertThat(result.source()).isEqualTo("""
                def a     = @a     = 1
                def bbbbb = @bbbbb = 2
                """);
        assertThat(result.source().split("\n")).allSatisfy(line -> assertThat(line).hasSizeLessThanOrEqualTo(24));
    }
}
