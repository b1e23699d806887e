/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.polyir.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * OpKind kind = OpKind.builder("test.op").build();
 * kind.attachExt(IRExts.FOLDER, (op, operands) -> null);
 *
 * Operation op = builder.create(new OperationState(context, loc, kind));
 * op.getNullable(IRExts.FOLDER); // found through the kind
 * op.attachExt(IRExts.NAME_HINT, "x"); // only on this operation
 * }</pre>
 * <p>
 * Every IR object is an ext container. Operation kinds carry their behaviour
 * (verification, folding, printing) as exts, and operations delegate to their kind,
 * so passes can attach scratch data to IR objects without changing the IR classes.
 * <p>
 * Specialised implementations of {@link io.github.eutro.polyir.core.ext.ExtContainer}
 * implement fast-paths for certain {@link io.github.eutro.polyir.core.ext.Ext}s
 * by storing them directly in fields of the class; the owner back-references in
 * {@link io.github.eutro.polyir.core.ext.IRExts} are stored this way.
 */
package io.github.eutro.polyir.core.ext;
