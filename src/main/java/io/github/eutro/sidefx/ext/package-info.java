/**
 * The ext API associates arbitrary data with
 * instances of {@link io.github.eutro.sidefx.ext.ExtContainer}.
 *
 * <pre>{@code
 * OpKey key = new SimpleOpKey("read_var");
 * key.attachExt(CommonExts.RESOURCE_ACCESS, ResourceAccessKind.READ);
 *
 * key.getExtOrThrow(CommonExts.RESOURCE_ACCESS); // => READ
 * }</pre>
 * <p>
 * The IR uses it both for scratch data of analyses (such as the
 * {@link io.github.eutro.sidefx.ext.CommonExts#CONTROL_DEPS control dependency graph} of a function)
 * and for describing operations (such as whether they are
 * {@link io.github.eutro.sidefx.ext.CommonExts#IS_PURE pure}), without the IR classes
 * having to know about either.
 * <p>
 * Some containers {@link io.github.eutro.sidefx.ext.DelegatingExtHolder delegate} to another:
 * an instruction sees the exts of its operation, which sees the exts of its key.
 */
package io.github.eutro.sidefx.ext;
