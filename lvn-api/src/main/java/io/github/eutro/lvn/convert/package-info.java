/**
 * Frontends that convert other representations to the IR.
 */
package io.github.eutro.lvn.convert;
