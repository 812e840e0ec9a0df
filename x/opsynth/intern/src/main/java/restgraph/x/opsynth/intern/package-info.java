/**
 * Structural signatures and interning for graphql-java executable-document nodes.
 *
 * <p>{@link restgraph.x.opsynth.intern.StructuralHasher} signs nodes by content, and {@link
 * restgraph.x.opsynth.intern.NodeInterningCache} uses those signatures to hand out one canonical
 * instance per distinct subtree.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package restgraph.x.opsynth.intern;

import org.jspecify.annotations.NullMarked;
