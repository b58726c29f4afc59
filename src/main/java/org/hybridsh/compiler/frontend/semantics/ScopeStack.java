package org.hybridsh.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stack of binding frames tracking which identifiers are visible while a tree is walked.
 * <p>
 * Frame 0 holds the names the caller already knows about (e.g. the interactive session's
 * namespace). Frame 1 collects module-level bindings and is the target of {@code global}
 * declarations. Each function or class body pushes a further frame that is discarded when
 * the body has been walked, so names bound inside it do not leak out.
 *
 * <p><strong>Thread Safety:</strong> Not thread-safe. One instance belongs to one traversal.
 */
public class ScopeStack {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeStack.class);

    /** Index of the frame that receives {@code global} declarations. */
    static final int GLOBAL_FRAME = 1;

    private final List<Set<String>> frames = new ArrayList<>();

    /**
     * Creates a stack seeded with the given names. The collection is copied, never modified.
     *
     * @param initialBindings Names considered bound before the walk begins.
     */
    public ScopeStack(Collection<String> initialBindings) {
        Set<String> root = new HashSet<>();
        for (String name : initialBindings) {
            if (name != null) root.add(name);
        }
        frames.add(root);
        frames.add(new HashSet<>());
    }

    /**
     * Checks whether a name is visible, searching from the innermost frame outwards.
     *
     * @param identifier The name to look up; null is never bound.
     * @return true if any frame contains the name.
     */
    public boolean isBound(String identifier) {
        if (identifier == null) return false;
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).contains(identifier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Binds a name in the innermost frame. A null name (an unresolvable target) is ignored.
     */
    public void bind(String identifier) {
        if (identifier == null) return;
        LOG.trace("bind '{}' at depth {}", identifier, frames.size() - 1);
        top().add(identifier);
    }

    /**
     * Binds every non-null name in the innermost frame.
     */
    public void bindAll(Iterable<String> identifiers) {
        for (String identifier : identifiers) {
            bind(identifier);
        }
    }

    /**
     * Removes a name from the innermost frame that contains it.
     * Unbinding a name that is not bound anywhere is a no-op.
     *
     * @param identifier The name to remove.
     * @return true if a binding was removed.
     */
    public boolean unbind(String identifier) {
        if (identifier == null) return false;
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).remove(identifier)) {
                LOG.trace("unbind '{}' from depth {}", identifier, i);
                return true;
            }
        }
        return false;
    }

    /**
     * Binds names in the module-level frame regardless of the current nesting depth.
     */
    public void bindGlobal(Iterable<String> identifiers) {
        Set<String> global = frames.get(GLOBAL_FRAME);
        for (String identifier : identifiers) {
            if (identifier != null) {
                LOG.trace("bind global '{}'", identifier);
                global.add(identifier);
            }
        }
    }

    /**
     * Enters a function or class body.
     */
    public void pushFrame() {
        frames.add(new HashSet<>());
    }

    /**
     * Leaves the current function or class body, discarding its bindings.
     *
     * @throws IllegalStateException if only the root and module frames remain.
     */
    public void popFrame() {
        if (frames.size() <= GLOBAL_FRAME + 1) {
            throw new IllegalStateException("Cannot pop the root or module frame.");
        }
        frames.remove(frames.size() - 1);
    }

    /**
     * @return The number of frames, at least 2.
     */
    public int depth() {
        return frames.size();
    }

    private Set<String> top() {
        return frames.get(frames.size() - 1);
    }
}
