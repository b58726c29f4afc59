package org.hybridsh.compiler.frontend.postprocess;

import com.typesafe.config.Config;

import org.hybridsh.compiler.frontend.parser.ast.Assignment;
import org.hybridsh.compiler.frontend.parser.ast.AstNode;
import org.hybridsh.compiler.frontend.parser.ast.AstPrinter;
import org.hybridsh.compiler.frontend.parser.ast.Block;
import org.hybridsh.compiler.frontend.parser.ast.ClassDef;
import org.hybridsh.compiler.frontend.parser.ast.Delete;
import org.hybridsh.compiler.frontend.parser.ast.ExceptHandler;
import org.hybridsh.compiler.frontend.parser.ast.Expression;
import org.hybridsh.compiler.frontend.parser.ast.ExpressionStatement;
import org.hybridsh.compiler.frontend.parser.ast.For;
import org.hybridsh.compiler.frontend.parser.ast.FunctionDef;
import org.hybridsh.compiler.frontend.parser.ast.GlobalDecl;
import org.hybridsh.compiler.frontend.parser.ast.Import;
import org.hybridsh.compiler.frontend.parser.ast.ImportAlias;
import org.hybridsh.compiler.frontend.parser.ast.ImportFrom;
import org.hybridsh.compiler.frontend.parser.ast.ListExpr;
import org.hybridsh.compiler.frontend.parser.ast.Module;
import org.hybridsh.compiler.frontend.parser.ast.Name;
import org.hybridsh.compiler.frontend.parser.ast.NodeKind;
import org.hybridsh.compiler.frontend.parser.ast.Statement;
import org.hybridsh.compiler.frontend.parser.ast.TryExcept;
import org.hybridsh.compiler.frontend.parser.ast.TupleExpr;
import org.hybridsh.compiler.frontend.parser.ast.With;
import org.hybridsh.compiler.frontend.parser.ast.WithItem;
import org.hybridsh.compiler.frontend.semantics.LeftmostNameResolver;
import org.hybridsh.compiler.frontend.semantics.ScopeStack;
import org.hybridsh.compiler.frontend.subproc.ReparseAdapter;
import org.hybridsh.compiler.frontend.subproc.ReparseResult;
import org.hybridsh.compiler.frontend.subproc.SourceLineIndex;
import org.hybridsh.compiler.frontend.subproc.SubprocLineParser;
import org.hybridsh.compiler.frontend.subproc.SubprocLineTransformer;
import org.hybridsh.compiler.frontend.subproc.SubprocParser;
import org.hybridsh.compiler.frontend.subproc.UncapturedSubprocWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites ambiguous expression statements into subprocess calls based on which names are
 * in scope.
 * <p>
 * A line such as {@code ls -la} parses as the expression {@code ls - la}. If {@code ls} is
 * not bound at that point of the program, the statement is almost certainly meant as a
 * command, so its source line is wrapped in subprocess syntax, reparsed, and the result is
 * swapped into the enclosing {@link Block}. Statements whose leftmost name is bound are left
 * alone, as are statements whose line does not parse as a command.
 * <p>
 * The walk is depth-first and pre-order. Bindings introduced by a statement header (a
 * function's own name, a loop target) take effect before its body is walked. Function and
 * class bodies get their own frame, discarded once the body is done.
 *
 * <p><strong>Thread Safety:</strong> Instances hold only immutable collaborators and may be
 * shared; every run builds its own traversal state.
 */
public class DisambiguatingVisitor {

    private static final Logger LOG = LoggerFactory.getLogger(DisambiguatingVisitor.class);

    private final SubprocParser parser;
    private final SubprocLineTransformer transformer;
    private final DisambiguationOptions options;

    /**
     * Creates a visitor with the built-in subprocess grammar and default options.
     */
    public DisambiguatingVisitor() {
        this(DisambiguationOptions.defaults());
    }

    /**
     * Creates a visitor with the built-in subprocess grammar, configured from the
     * {@value DisambiguationOptions#CONFIG_PATH} section.
     *
     * @param config The application configuration.
     */
    public DisambiguatingVisitor(Config config) {
        this(DisambiguationOptions.fromConfig(config));
    }

    /**
     * Creates a visitor with the built-in subprocess grammar.
     *
     * @param options The pass options.
     */
    public DisambiguatingVisitor(DisambiguationOptions options) {
        this(new SubprocLineParser(),
                new UncapturedSubprocWrapper(options.subprocOpen(), options.subprocClose()),
                options);
    }

    /**
     * Creates a visitor with custom collaborators.
     *
     * @param parser      Parses a transformed line under the subprocess grammar.
     * @param transformer Turns a raw line into subprocess syntax.
     * @param options     The pass options.
     */
    public DisambiguatingVisitor(SubprocParser parser, SubprocLineTransformer transformer,
                                 DisambiguationOptions options) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Disambiguates a tree in place.
     *
     * @param tree            The parsed program; mutated in place.
     * @param sourceText      The exact text {@code tree} was parsed from.
     * @param initialBindings Names already bound before the program runs. Not modified.
     * @return {@code tree}.
     */
    public Module disambiguate(Module tree, String sourceText, Set<String> initialBindings) {
        return disambiguateWithReport(tree, sourceText, initialBindings).tree();
    }

    /**
     * Disambiguates a tree in place, taking the known names from a namespace mapping.
     *
     * @param tree            The parsed program; mutated in place.
     * @param sourceText      The exact text {@code tree} was parsed from.
     * @param initialBindings Namespace whose keys are the bound names; values are ignored.
     * @return {@code tree}.
     */
    public Module disambiguate(Module tree, String sourceText, Map<String, ?> initialBindings) {
        return disambiguateWithReport(tree, sourceText, initialBindings.keySet()).tree();
    }

    /**
     * Disambiguates a tree in place and reports what happened to each expression statement.
     *
     * @param tree            The parsed program; mutated in place.
     * @param sourceText      The exact text {@code tree} was parsed from.
     * @param initialBindings Names already bound before the program runs. Not modified.
     * @return The tree together with one outcome per visited expression statement.
     */
    public DisambiguationReport disambiguateWithReport(Module tree, String sourceText,
                                                       Collection<String> initialBindings) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(initialBindings, "initialBindings");

        if (!options.enabled()) {
            LOG.debug("Disambiguation disabled, returning tree unchanged");
            return new DisambiguationReport(tree, List.of());
        }

        Traversal traversal = new Traversal(
                new ScopeStack(initialBindings),
                new ReparseAdapter(SourceLineIndex.of(sourceText), parser, transformer));
        traversal.visit(tree);

        DisambiguationReport report = new DisambiguationReport(tree, traversal.outcomes);
        LOG.debug("Disambiguated {} expression statements: {} replaced, {} kept after parse failure",
                report.outcomes().size(), report.count(Outcome.REPLACED),
                report.count(Outcome.UNCHANGED_PARSE_FAILURE));
        return report;
    }

    /**
     * State of one run: the scope stack, the reparse glue and the collected outcomes.
     */
    private final class Traversal {
        private final ScopeStack scope;
        private final ReparseAdapter reparser;
        private final List<StatementOutcome> outcomes = new ArrayList<>();

        Traversal(ScopeStack scope, ReparseAdapter reparser) {
            this.scope = scope;
            this.reparser = reparser;
        }

        void visit(AstNode node) {
            switch (node.kind()) {
                case BLOCK -> visitBlock((Block) node);
                case EXPRESSION_STATEMENT -> {
                    // Outside a block there is no slot to replace into; see visitBlock.
                }
                case ASSIGNMENT -> {
                    for (Expression target : ((Assignment) node).targets()) {
                        bindTarget(target);
                    }
                    visitChildren(node);
                }
                case IMPORT -> bindImports(((Import) node).names());
                case IMPORT_FROM -> bindImports(((ImportFrom) node).names());
                case WITH -> {
                    for (WithItem item : ((With) node).items()) {
                        if (item.optionalVars() != null) {
                            scope.bind(leftmostName(item.optionalVars()));
                        }
                    }
                    visitChildren(node);
                }
                case FOR -> {
                    bindTarget(((For) node).target());
                    visitChildren(node);
                }
                case FUNCTION_DEF -> {
                    FunctionDef def = (FunctionDef) node;
                    scope.bind(def.name());
                    scope.pushFrame();
                    try {
                        if (options.bindFunctionParameters()) {
                            scope.bindAll(def.parameters());
                        }
                        visitChildren(node);
                    } finally {
                        scope.popFrame();
                    }
                }
                case CLASS_DEF -> {
                    scope.bind(((ClassDef) node).name());
                    scope.pushFrame();
                    try {
                        visitChildren(node);
                    } finally {
                        scope.popFrame();
                    }
                }
                case DELETE -> {
                    for (Expression target : ((Delete) node).targets()) {
                        if (target instanceof Name name) {
                            scope.unbind(name.id());
                        }
                    }
                    visitChildren(node);
                }
                case TRY_EXCEPT -> {
                    for (ExceptHandler handler : ((TryExcept) node).handlers()) {
                        if (handler.name() != null) {
                            scope.bind(handler.name());
                        }
                    }
                    visitChildren(node);
                }
                case GLOBAL_DECL -> {
                    scope.bindGlobal(((GlobalDecl) node).names());
                    visitChildren(node);
                }
                default -> visitChildren(node);
            }
        }

        private void visitChildren(AstNode node) {
            for (AstNode child : node.getChildren()) {
                visit(child);
            }
        }

        private void visitBlock(Block block) {
            for (int i = 0; i < block.size(); i++) {
                Statement statement = block.get(i);
                if (statement instanceof ExpressionStatement expression) {
                    Statement result = disambiguate(expression);
                    if (result != expression) {
                        block.replace(i, result);
                    }
                } else {
                    visit(statement);
                }
            }
        }

        private Statement disambiguate(ExpressionStatement node) {
            Optional<String> lname = LeftmostNameResolver.resolve(node);
            String name = lname.orElse(null);
            if (scope.isBound(name)) {
                record(node, name, Outcome.UNCHANGED, null);
                return node;
            }
            if (options.skipSubprocessStatements() && node.value().kind() == NodeKind.SUBPROC_CALL) {
                record(node, name, Outcome.UNCHANGED, null);
                return node;
            }

            ReparseResult result = reparser.reparse(node);
            if (result instanceof ReparseResult.Replaced replaced) {
                Statement replacement = replaced.replacement();
                LOG.debug("Line {}: '{}' is not in scope, reinterpreted as subprocess",
                        node.position().line(), name);
                if (LOG.isTraceEnabled()) {
                    LOG.trace("Replacement for line {}:\n{}", node.position().line(), AstPrinter.print(replacement));
                }
                record(node, name, Outcome.REPLACED, null);
                return replacement;
            }
            String reason = ((ReparseResult.NoReplacement) result).reason();
            LOG.debug("Line {}: keeping expression, subprocess reparse failed: {}", node.position().line(), reason);
            record(node, name, Outcome.UNCHANGED_PARSE_FAILURE, reason);
            return node;
        }

        /**
         * Binds an assignment or loop target. Unpacking patterns bind the leftmost name of each
         * element; any other target binds its own leftmost name.
         */
        private void bindTarget(Expression target) {
            if (target.kind() == NodeKind.TUPLE) {
                for (Expression element : ((TupleExpr) target).elements()) {
                    scope.bind(leftmostName(element));
                }
            } else if (target.kind() == NodeKind.LIST) {
                for (Expression element : ((ListExpr) target).elements()) {
                    scope.bind(leftmostName(element));
                }
            } else {
                scope.bind(leftmostName(target));
            }
        }

        private void bindImports(List<ImportAlias> names) {
            for (ImportAlias alias : names) {
                scope.bind(alias.boundName());
            }
        }

        private String leftmostName(AstNode node) {
            return LeftmostNameResolver.resolve(node).orElse(null);
        }

        private void record(ExpressionStatement node, String name, Outcome outcome, String detail) {
            outcomes.add(new StatementOutcome(node.position(), name, outcome, detail));
        }
    }
}
