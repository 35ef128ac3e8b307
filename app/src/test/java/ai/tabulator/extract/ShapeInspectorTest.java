package ai.tabulator.extract;

import static org.assertj.core.api.Assertions.assertThat;

import ai.tabulator.fixture.RubyFixtureParser;
import ai.tabulator.tree.ArenaTree;
import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

class ShapeInspectorTest {

    private static SyntaxNode body(String source) {
        ArenaTree tree = RubyFixtureParser.parseSource(source);
        return tree.root().children().get(0).child(ChildRole.BODY).orElseThrow();
    }

    @Test
    void detectsHeredocAndMultiLineStrings() {
        assertThat(ShapeInspector.containsHeredoc(body("def t\n  <<~X\n    hi\n  X\nend\n"))).isTrue();
        assertThat(ShapeInspector.containsMultilineString(body("def t\n  \"a\nb\"\nend\n"))).isTrue();
        assertThat(ShapeInspector.containsMultilineString(body("def t\n  \"ab\"\nend\n"))).isFalse();
    }

    @Test
    void detectsMultiStatementBlocks() {
        assertThat(ShapeInspector.containsMultiStatementBlock(body("def t\n  each do |x|\n    a\n    b\n  end\nend\n")))
                .isTrue();
        assertThat(ShapeInspector.containsMultiStatementBlock(body("def t\n  each { |x| x }\nend\n"))).isFalse();
    }

    @Test
    void distinguishesModifierFromMultiLineConditional() {
        assertThat(ShapeInspector.containsMultilineKeywordConstruct(body("def t\n  if a\n    b\n  end\nend\n"))).isTrue();
        assertThat(ShapeInspector.containsMultilineKeywordConstruct(body("def t\n  b if a\nend\n"))).isFalse();
        assertThat(ShapeInspector.containsMultilineKeywordConstruct(body("def t\n  call(\n    1\n  )\nend\n"))).isFalse();
    }

    @Test
    void findsCallsAndKinds() {
        SyntaxNode literal = body("def t\n  42 if true\nend\n");
        SyntaxNode call = body("def t\n  go if ready?\nend\n");

        assertThat(ShapeInspector.containsCall(literal)).isFalse();
        assertThat(ShapeInspector.containsCall(call)).isTrue();
        assertThat(ShapeInspector.containsKind(call, NodeKind.CONDITIONAL)).isTrue();
        assertThat(ShapeInspector.containsKind(null, NodeKind.CALL)).isFalse();
    }

    @Test
    void checksCommentsOnLineRange() {
        ArenaTree tree = RubyFixtureParser.parseSource("a = 1\n# note\nb = 2\n");

        assertThat(ShapeInspector.hasCommentOnLines(tree, 1, 2)).isTrue();
        assertThat(ShapeInspector.hasCommentOnLines(tree, 3, 3)).isFalse();
        assertThat(ShapeInspector.hasCommentOnLines(tree, 3, 2)).isFalse();
    }
}
