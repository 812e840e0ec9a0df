/**
 * Synthesis of complete GraphQL operations from a schema.
 *
 * <p>{@link restgraph.x.opsynth.synth.OperationSynthesizer} builds the operation for one root
 * field; {@link restgraph.x.opsynth.synth.OperationCatalog} builds one per field of a root type.
 * {@link restgraph.x.opsynth.synth.SynthesisOptions} and {@link
 * restgraph.x.opsynth.synth.SelectedFields} control what gets selected.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package restgraph.x.opsynth.synth;

import org.jspecify.annotations.NullMarked;
