package ai.tabulator.policy;

import static ai.tabulator.fixture.PolicyHarness.correct;
import static ai.tabulator.fixture.PolicyHarness.offenses;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.tabulator.engine.Diagnostic;
import java.util.List;
import org.junit.jupiter.api.Test;

class LinearizeRoutinePolicyTest {

    private static final PolicyKind KIND = PolicyKind.LINEARIZE_ROUTINE;

    @Test
    void convertsSimpleRoutineToEndless() {
        assertThat(correct(KIND, """
                def foo
                  42
                end
                """)).isEqualTo("def foo = 42\n");
    }

    @Test
    void convertsRoutinesWithParametersAndCalls() {
        assertThat(correct(KIND, """
                def add(a, b)
                  a + b
                end
                """)).isEqualTo("def add(a, b) = a + b\n");
        assertThat(correct(KIND, """
                def name
                  @name.to_s
                end
                """)).isEqualTo("def name = @name.to_s\n");
    }

    @Test
    void usesTrailingClauseSpellingForModifierWithCall() {
        assertThat(correct(KIND, """
                def clear!
                  data_layer.clear! if data_layer.respond_to?(:clear!)
                end
                """)).isEqualTo("def clear!() data_layer.clear! if data_layer.respond_to?(:clear!) end\n");
        assertThat(correct(KIND, """
                def skip
                  perform unless disabled?
                end
                """)).isEqualTo("def skip() perform unless disabled? end\n");
    }

    @Test
    void keepsEndlessSpellingForModifierOverLiterals() {
        assertThat(correct(KIND, """
                def maybe
                  42 if true
                end
                """)).isEqualTo("def maybe = 42 if true\n");
    }

    @Test
    void reportsTheChosenSpelling() {
        List<Diagnostic> endless = offenses(KIND, "def foo\n  42\nend\n");
        List<Diagnostic> traditional = offenses(KIND, "def skip\n  perform unless disabled?\nend\n");

        assertThat(endless).extracting(Diagnostic::message).containsExactly("Use endless method: `def foo = 42`");
        assertThat(traditional).extracting(Diagnostic::message)
                .containsExactly("Use single-line method: `def skip() perform unless disabled? end`");
    }

    @Test
    void skipsRoutinesAlreadyOnOneLine() {
        assertThat(offenses(KIND, "def foo = 42\n")).isEmpty();
        assertThat(offenses(KIND, "def foo() 42 end\n")).isEmpty();
        assertThat(offenses(KIND, "def foo; 42; end\n")).isEmpty();
    }

    @Test
    void skipsHeredocBodies() {
        assertThat(offenses(KIND, """
                def template
                  <<~HTML
                    <h1>Hello</h1>
                  HTML
                end
                """)).isEmpty();
    }

    @Test
    void skipsRescueAndEnsure() {
        assertThat(offenses(KIND, """
                def safe_call
                  risky_operation
                rescue StandardError
                  nil
                end
                """)).isEmpty();
        assertThat(offenses(KIND, """
                def with_cleanup
                  do_work
                ensure
                  cleanup
                end
                """)).isEmpty();
    }

    @Test
    void skipsMultiStatementBodiesAndBlocks() {
        assertThat(offenses(KIND, """
                def complex
                  setup
                  perform
                end
                """)).isEmpty();
        assertThat(offenses(KIND, """
                def read(query)
                  Result.try do
                    ds = apply_query(dataset, query)
                    ds.map { |row| build_record(row) }
                  end
                end
                """)).isEmpty();
        assertThat(offenses(KIND, """
                def process
                  items.each { |i|
                    validate(i)
                    transform(i)
                  }
                end
                """)).isEmpty();
    }

    @Test
    void allowsSingleStatementBlockAndTernary() {
        assertThat(correct(KIND, """
                def items
                  @items.map { |x| x * 2 }
                end
                """)).isEqualTo("def items = @items.map { |x| x * 2 }\n");
        assertThat(correct(KIND, """
                def status
                  valid? ? :ok : :error
                end
                """)).isEqualTo("def status = valid? ? :ok : :error\n");
    }

    @Test
    void respectsLineLength() {
        assertThat(offenses(KIND, """
                def very_long_method_name_that_takes_up_space
                  "this is also a long string that combined would exceed the limit"
                end
                """)).isEmpty();
    }

    @Test
    void keepsSingletonReceiver() {
        assertThat(correct(KIND, """
                def self.version
                  VERSION
                end
                """)).isEqualTo("def self.version = VERSION\n");
    }

    @Test
    void skipsSetters() {
        assertThat(offenses(KIND, """
                def []=(key, value)
                  @attributes[key] = value
                end
                """)).isEmpty();
        assertThat(offenses(KIND, """
                def name=(value)
                  @name = value
                end
                """)).isEmpty();
    }

    @Test
    void treatsComparisonOperatorsAsOrdinaryNames() {
        assertThat(LinearizeRoutinePolicy.isSetter("name=")).isTrue();
        assertThat(LinearizeRoutinePolicy.isSetter("[]=")).isTrue();
        assertThat(LinearizeRoutinePolicy.isSetter("==")).isFalse();
        assertThat(LinearizeRoutinePolicy.isSetter("<=")).isFalse();
        assertThat(LinearizeRoutinePolicy.isSetter("name")).isFalse();
    }

    @Test
    void skipsIfElseBodies() {
        assertThat(offenses(KIND, """
                def schema_id(id = nil)
                  if id
                    @schema_id = id.to_s
                  else
                    @schema_id ||= default_schema_id
                  end
                end
                """)).isEmpty();
    }

    @Test
    void skipsRoutineWithComment() {
        assertThat(offenses(KIND, """
                def answer
                  # deliberately constant
                  42
                end
                """)).isEmpty();
    }

    @Test
    void keepsIndentationOfNestedRoutine() {
        assertThat(correct(KIND, """
                class Foo
                  def bar
                    :bar
                  end
                end
                """)).isEqualTo("""
                class Foo
                  def bar = :bar
                end
                """);
    }

    @Test
    void rejectsNonPositiveLineLength() {
        Throwable thrown = catchThrowable(() -> new LinearizeRoutinePolicy(0));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }
}
