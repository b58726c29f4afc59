package org.hybridsh.compiler.frontend.postprocess;

import org.hybridsh.compiler.frontend.parser.ast.AstPrinter;
import org.hybridsh.compiler.frontend.parser.ast.ExpressionStatement;
import org.hybridsh.compiler.frontend.parser.ast.For;
import org.hybridsh.compiler.frontend.parser.ast.FunctionDef;
import org.hybridsh.compiler.frontend.parser.ast.If;
import org.hybridsh.compiler.frontend.parser.ast.Module;
import org.hybridsh.compiler.frontend.parser.ast.NodeKind;
import org.hybridsh.compiler.frontend.parser.ast.Statement;
import org.hybridsh.compiler.frontend.parser.ast.SubprocCall;
import org.hybridsh.compiler.frontend.parser.ast.TryExcept;
import org.hybridsh.compiler.frontend.parser.ast.With;
import org.hybridsh.compiler.frontend.subproc.SubprocLineParser;
import org.hybridsh.compiler.frontend.subproc.SubprocParser;
import org.hybridsh.compiler.frontend.subproc.SubprocSyntaxException;
import org.hybridsh.compiler.frontend.subproc.UncapturedSubprocWrapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hybridsh.compiler.frontend.parser.ast.AstFixtures.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link DisambiguatingVisitor}. Trees are built by hand to match the source text
 * given alongside, line for line.
 */
@Tag("unit")
class DisambiguatingVisitorTest {

    private DisambiguatingVisitor visitor;

    @BeforeEach
    void setUp() {
        visitor = new DisambiguatingVisitor();
    }

    private static void assertSubproc(Statement statement, int line, int column, String... words) {
        assertThat(statement).isInstanceOf(ExpressionStatement.class);
        ExpressionStatement expression = (ExpressionStatement) statement;
        assertThat(expression.value()).isInstanceOf(SubprocCall.class);
        assertThat(((SubprocCall) expression.value()).arguments()).containsExactly(words);
        assertThat(expression.position()).isEqualTo(pos(line, column));
    }

    @Test
    @DisplayName("Assigned name stays an expression, unknown name becomes a subprocess")
    void scenarioA_assignmentBindsName() {
        ExpressionStatement foo = expr(2, name("foo"));
        ExpressionStatement bar = expr(3, name("bar"));
        Module tree = module(assign(1, name("foo"), num(1)), foo, bar);

        DisambiguationReport report = visitor.disambiguateWithReport(tree, "foo = 1\nfoo\nbar", Set.of());

        assertThat(report.tree()).isSameAs(tree);
        assertThat(tree.body().get(1)).isSameAs(foo);
        assertSubproc(tree.body().get(2), 3, 0, "bar");
        assertThat(report.outcomes()).extracting(StatementOutcome::outcome)
                .containsExactly(Outcome.UNCHANGED, Outcome.REPLACED);
        assertThat(report.forLine(3).orElseThrow().leftmostName()).isEqualTo("bar");
    }

    @Test
    @DisplayName("A command name known to the session is left as an expression")
    void scenarioB_initialBindingKeepsExpression() {
        ExpressionStatement statement = expr(1, binop(name("ls"), "-", name("la")));
        Module tree = module(statement);

        Module result = visitor.disambiguate(tree, "ls -la", Set.of("ls"));

        assertThat(result.body().get(0)).isSameAs(statement);
    }

    @Test
    void unboundCommand_isReplaced() {
        Module tree = module(expr(1, binop(name("ls"), "-", name("la"))));

        visitor.disambiguate(tree, "ls -la", Set.of());

        assertSubproc(tree.body().get(0), 1, 0, "ls", "-la");
    }

    @Test
    @DisplayName("Function-local bindings do not leak after the body")
    void scenarioC_functionFrameIsPopped() {
        ExpressionStatement inner = expr(3, 4, name("x"));
        FunctionDef f = def(1, "f", List.of(), assign(2, 4, name("x"), num(1)), inner);
        Module tree = module(f, expr(4, name("x")));

        visitor.disambiguate(tree, "def f():\n    x = 1\n    x\nx", Set.of());

        assertThat(f.body().get(1)).isSameAs(inner);
        assertSubproc(tree.body().get(1), 4, 0, "x");
    }

    @Test
    @DisplayName("Deleting a never-bound name is a no-op")
    void scenarioD_deleteOfUnboundName() {
        Module tree = module(del(1, 0, name("x")), expr(2, name("x")));

        DisambiguationReport report = visitor.disambiguateWithReport(tree, "del x\nx", Set.of());

        assertSubproc(tree.body().get(1), 2, 0, "x");
        assertThat(report.count(Outcome.REPLACED)).isEqualTo(1);
    }

    @Test
    void delete_unbindsPreviouslyAssignedName() {
        Module tree = module(
                assign(1, name("ls"), num(1)),
                del(2, 0, name("ls")),
                expr(3, binop(name("ls"), "-", name("l"))));

        visitor.disambiguate(tree, "ls = 1\ndel ls\nls -l", Set.of());

        assertSubproc(tree.body().get(2), 3, 0, "ls", "-l");
    }

    @Test
    void delete_ofSubscriptIsIgnored() {
        ExpressionStatement use = expr(3, name("xs"));
        Module tree = module(
                assign(1, name("xs"), list()),
                del(2, 0, subscript(name("xs"), num(0))),
                use);

        visitor.disambiguate(tree, "xs = []\ndel xs[0]\nxs", Set.of());

        assertThat(tree.body().get(2)).isSameAs(use);
    }

    @Test
    void delete_removesInnermostShadowFirst() {
        ExpressionStatement use = expr(4, 4, name("x"));
        FunctionDef f = def(1, "f", List.of(),
                assign(2, 4, name("x"), num(1)),
                del(3, 4, name("x")),
                use);
        Module tree = module(f);

        visitor.disambiguate(tree, "def f():\n    x = 1\n    del x\n    x", Set.of("x"));

        // The session-level x is still visible after the local one is deleted.
        assertThat(f.body().get(2)).isSameAs(use);
    }

    @Test
    @DisplayName("A global declaration binds at module level even after the function body")
    void globalDecl_visibleAfterFramePop() {
        FunctionDef f = def(1, "f", List.of(), global(2, 4, "counter"));
        ExpressionStatement use = expr(3, name("counter"));
        Module tree = module(f, use);

        visitor.disambiguate(tree, "def f():\n    global counter\ncounter", Set.of());

        assertThat(tree.body().get(1)).isSameAs(use);
    }

    @Test
    void functionName_visibleInsideAndAfterDefinition() {
        ExpressionStatement recursive = expr(2, 4, call(name("fact"), num(3)));
        ExpressionStatement after = expr(3, call(name("fact"), num(5)));
        FunctionDef fact = def(1, "fact", List.of("n"), recursive);
        Module tree = module(fact, after);

        visitor.disambiguate(tree, "def fact(n):\n    fact(3)\nfact(5)", Set.of());

        assertThat(fact.body().get(0)).isSameAs(recursive);
        assertThat(tree.body().get(1)).isSameAs(after);
    }

    @Test
    void functionParameters_areBoundInsideBodyOnly() {
        ExpressionStatement inside = expr(2, 4, name("path"));
        FunctionDef f = def(1, "f", List.of("path"), inside);
        Module tree = module(f, expr(3, name("path")));

        visitor.disambiguate(tree, "def f(path):\n    path\npath", Set.of());

        assertThat(f.body().get(0)).isSameAs(inside);
        assertSubproc(tree.body().get(1), 3, 0, "path");
    }

    @Test
    void functionParameters_unboundWhenOptionDisabled() {
        DisambiguatingVisitor strict = new DisambiguatingVisitor(new DisambiguationOptions(
                true, false, true, UncapturedSubprocWrapper.DEFAULT_OPEN, UncapturedSubprocWrapper.DEFAULT_CLOSE));
        FunctionDef f = def(1, "f", List.of("path"), expr(2, 4, name("path")));
        Module tree = module(f);

        strict.disambiguate(tree, "def f(path):\n    path", Set.of());

        assertSubproc(f.body().get(0), 2, 4, "path");
    }

    @Test
    void classBody_hasOwnFrame() {
        ExpressionStatement useClass = expr(3, name("Config"));
        Module tree = module(
                classDef(1, "Config", assign(2, 4, name("debug"), num(0))),
                useClass,
                expr(4, name("debug")));

        visitor.disambiguate(tree, "class Config:\n    debug = 0\nConfig\ndebug", Set.of());

        assertThat(tree.body().get(1)).isSameAs(useClass);
        assertSubproc(tree.body().get(2), 4, 0, "debug");
    }

    @Test
    void imports_bindAliasOrName() {
        ExpressionStatement useOs = expr(4, call(attr(name("os"), "getcwd")));
        ExpressionStatement useNp = expr(5, name("np"));
        ExpressionStatement useJoin = expr(6, call(name("join"), str("a")));
        ExpressionStatement useNumpy = expr(7, name("numpy"));
        Module tree = module(
                importStmt(1, alias("os.path", null)),
                importStmt(2, alias("numpy", "np")),
                importFrom(3, "os.path", alias("join", null)),
                useOs, useNp, useJoin, useNumpy);

        String source = "import os.path\nimport numpy as np\nfrom os.path import join\n"
                + "os.getcwd()\nnp\njoin('a')\nnumpy";
        visitor.disambiguate(tree, source, Set.of());

        assertThat(tree.body().get(3)).isSameAs(useOs);
        assertThat(tree.body().get(4)).isSameAs(useNp);
        assertThat(tree.body().get(5)).isSameAs(useJoin);
        assertSubproc(tree.body().get(6), 7, 0, "numpy");
    }

    @Test
    void forLoop_bindsTargetBeforeBody() {
        ExpressionStatement useKey = expr(2, 4, name("key"));
        ExpressionStatement useValue = expr(3, 4, name("value"));
        Module tree = module(forLoop(1, tuple(name("key"), name("value")), call(name("items")), useKey, useValue));

        visitor.disambiguate(tree, "for key, value in items():\n    key\n    value", Set.of("items"));

        For loop = (For) tree.body().get(0);
        assertThat(loop.body().get(0)).isSameAs(useKey);
        assertThat(loop.body().get(1)).isSameAs(useValue);
    }

    @Test
    void assignment_unpackingBindsEveryElement() {
        ExpressionStatement a = expr(2, name("a"));
        ExpressionStatement b = expr(3, name("b"));
        ExpressionStatement rest = expr(4, name("rest"));
        Module tree = module(
                assign(1, list(name("a"), tuple(name("b"), name("c")), starred(name("rest"))), name("src")),
                a, b, rest);

        visitor.disambiguate(tree, "[a, (b, c), *rest] = src\na\nb\nrest", Set.of("src"));

        assertThat(tree.body().get(1)).isSameAs(a);
        // Nested unpacking has no leftmost name, so b stays unbound.
        assertSubproc(tree.body().get(2), 3, 0, "b");
        assertThat(tree.body().get(3)).isSameAs(rest);
    }

    @Test
    void attributeTarget_bindsItsBaseName() {
        ExpressionStatement use = expr(2, name("obj"));
        Module tree = module(assign(1, attr(name("obj"), "field"), num(1)), use);

        visitor.disambiguate(tree, "obj.field = 1\nobj", Set.of());

        assertThat(tree.body().get(1)).isSameAs(use);
    }

    @Test
    void with_bindsAsTarget() {
        ExpressionStatement read = expr(2, 4, call(attr(name("fh"), "read")));
        Module tree = module(with(1, call(name("open"), str("x")), name("fh"), read));

        visitor.disambiguate(tree, "with open('x') as fh:\n    fh.read()", Set.of("open"));

        assertThat(((With) tree.body().get(0)).body().get(0)).isSameAs(read);
    }

    @Test
    void tryExcept_bindsHandlerNameAndWalksAllBodies() {
        TryExcept tryStmt = tryExcept(1,
                block(expr(2, 4, name("risky"))),
                handler(name("OSError"), "err", expr(4, 4, name("err"))));
        Module tree = module(tryStmt);

        visitor.disambiguate(tree, "try:\n    risky\nexcept OSError as err:\n    err", Set.of("OSError"));

        assertSubproc(tryStmt.body().get(0), 2, 4, "risky");
        assertThat(tryStmt.handlers().get(0).body().get(0)).isInstanceOf(ExpressionStatement.class);
        assertThat(((ExpressionStatement) tryStmt.handlers().get(0).body().get(0)).value().kind())
                .isEqualTo(NodeKind.NAME);
    }

    @Test
    void nestedBlocks_areRewritten() {
        If branch = ifStmt(1, name("ready"), expr(2, 4, name("make")));
        Module tree = module(branch);

        visitor.disambiguate(tree, "if ready:\n    make", Set.of("ready"));

        assertSubproc(branch.body().get(0), 2, 4, "make");
    }

    @Test
    void literalStatement_isReparseCandidate() {
        Module tree = module(expr(1, num(42)));

        DisambiguationReport report = visitor.disambiguateWithReport(tree, "42", Set.of());

        assertSubproc(tree.body().get(0), 1, 0, "42");
        assertThat(report.outcomes().get(0).leftmostName()).isNull();
    }

    @Test
    void parseFailure_keepsOriginalNode() {
        ExpressionStatement statement = expr(1, subscript(name("a"), num(0)));
        Module tree = module(statement);

        DisambiguationReport report = visitor.disambiguateWithReport(tree, "a[0]", Set.of());

        assertThat(tree.body().get(0)).isSameAs(statement);
        assertThat(report.outcomes()).singleElement().satisfies(o -> {
            assertThat(o.outcome()).isEqualTo(Outcome.UNCHANGED_PARSE_FAILURE);
            assertThat(o.detail()).contains("unexpected text");
        });
    }

    @Test
    void parseFailure_doesNotAffectSiblings() throws Exception {
        SubprocParser parser = mock(SubprocParser.class);
        when(parser.parse("$[broken]")).thenThrow(new SubprocSyntaxException("nope", 1, 0));
        when(parser.parse("$[fine]")).thenAnswer(inv -> new SubprocLineParser().parse(inv.getArgument(0)));
        DisambiguatingVisitor custom = new DisambiguatingVisitor(
                parser, new UncapturedSubprocWrapper(), DisambiguationOptions.defaults());
        ExpressionStatement broken = expr(1, name("broken"));
        Module tree = module(broken, expr(2, name("fine")));

        custom.disambiguate(tree, "broken\nfine", Set.of());

        assertThat(tree.body().get(0)).isSameAs(broken);
        assertSubproc(tree.body().get(1), 2, 0, "fine");
    }

    @Test
    void boundName_neverReachesParser() throws Exception {
        SubprocParser parser = mock(SubprocParser.class);
        DisambiguatingVisitor custom = new DisambiguatingVisitor(
                parser, new UncapturedSubprocWrapper(), DisambiguationOptions.defaults());

        custom.disambiguate(module(expr(1, name("known"))), "known", Set.of("known"));

        verify(parser, never()).parse(anyString());
    }

    @Test
    @DisplayName("A second run over a processed tree changes nothing")
    void secondRun_isIdempotent() {
        Module tree = module(
                assign(1, name("foo"), num(1)),
                expr(2, name("foo")),
                expr(3, binop(name("ls"), "-", name("la"))),
                expr(4, subscript(name("a"), num(0))));
        String source = "foo = 1\nfoo\nls -la\na[0]";
        visitor.disambiguate(tree, source, Set.of());
        String afterFirst = AstPrinter.print(tree);
        Statement replaced = tree.body().get(2);

        DisambiguationReport second = visitor.disambiguateWithReport(tree, source, Set.of());

        assertThat(AstPrinter.print(tree)).isEqualTo(afterFirst);
        assertThat(tree.body().get(2)).isSameAs(replaced);
        assertThat(second.count(Outcome.REPLACED)).isZero();
    }

    @Test
    void secondRun_withoutSkipProducesEqualReplacement() {
        DisambiguatingVisitor noSkip = new DisambiguatingVisitor(new DisambiguationOptions(
                true, true, false, UncapturedSubprocWrapper.DEFAULT_OPEN, UncapturedSubprocWrapper.DEFAULT_CLOSE));
        Module tree = module(expr(1, binop(name("ls"), "-", name("la"))));
        noSkip.disambiguate(tree, "ls -la", Set.of());
        Statement first = tree.body().get(0);

        noSkip.disambiguate(tree, "ls -la", Set.of());

        assertThat(tree.body().get(0)).isEqualTo(first);
    }

    @Test
    void callerBindings_areNotModified() {
        Set<String> session = new HashSet<>(Set.of("ls"));
        Module tree = module(del(1, 0, name("ls")), assign(2, name("y"), num(2)));

        visitor.disambiguate(tree, "del ls\ny = 2", session);

        assertThat(session).containsExactly("ls");
    }

    @Test
    void namespaceMapping_keysAreBindings() {
        ExpressionStatement statement = expr(1, name("ls"));
        Module tree = module(statement);

        visitor.disambiguate(tree, "ls", Map.of("ls", new Object()));

        assertThat(tree.body().get(0)).isSameAs(statement);
    }

    @Test
    void disabled_returnsTreeUntouched() {
        DisambiguatingVisitor disabled = new DisambiguatingVisitor(new DisambiguationOptions(
                false, true, true, UncapturedSubprocWrapper.DEFAULT_OPEN, UncapturedSubprocWrapper.DEFAULT_CLOSE));
        ExpressionStatement statement = expr(1, name("bar"));
        Module tree = module(statement);

        DisambiguationReport report = disabled.disambiguateWithReport(tree, "bar", Set.of());

        assertThat(tree.body().get(0)).isSameAs(statement);
        assertThat(report.outcomes()).isEmpty();
    }

    @Test
    void separateRuns_doNotShareScope() {
        Module first = module(assign(1, name("tmp"), num(1)));
        visitor.disambiguate(first, "tmp = 1", Set.of());
        Module second = module(expr(1, name("tmp")));

        visitor.disambiguate(second, "tmp", Set.of());

        assertSubproc(second.body().get(0), 1, 0, "tmp");
    }

    @Test
    void returnStatement_isWalkedGenerically() {
        FunctionDef f = def(1, "f", List.of(), ret(2, 4, name("x")), expr(3, 4, name("cleanup")));
        Module tree = module(f);

        visitor.disambiguate(tree, "def f():\n    return x\n    cleanup", Set.of());

        assertSubproc(f.body().get(1), 3, 4, "cleanup");
    }
}
