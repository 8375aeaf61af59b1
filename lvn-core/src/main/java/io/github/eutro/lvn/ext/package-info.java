/**
 * Typed metadata for IR objects.
 * <p>
 * An {@link io.github.eutro.lvn.ext.Ext} is a key; any
 * {@link io.github.eutro.lvn.ext.ExtContainer} can hold a value for it:
 *
 * <pre>{@code
 * function.attachExt(CommonExts.FUNCTION_NAME, "Foo.bar(I)I");
 * function.getExtOrThrow(CommonExts.FUNCTION_NAME); // => "Foo.bar(I)I"
 * }</pre>
 * <p>
 * Instructions delegate lookups to their operation, and operations to
 * their key, so facts like {@link io.github.eutro.lvn.ext.CommonExts#BINARY_OPCODE}
 * only need to be attached once per kind of operation.
 */
package io.github.eutro.lvn.ext;
